package com.cred.freestyle.recommendation.api.dto;

import com.cred.freestyle.recommendation.service.DiscountEngine.CustomDiscountResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for a custom per-recommendation discount batch.
 *
 * @author Recommendation Team
 */
public class CustomDiscountResponse {

    private String message;

    @JsonProperty("updated_ids")
    private List<Long> updatedIds;

    public CustomDiscountResponse() {
    }

    public static CustomDiscountResponse fromResult(CustomDiscountResult result) {
        CustomDiscountResponse response = new CustomDiscountResponse();
        response.setMessage(String.format("Applied custom discounts to %d recommendations",
                result.getUpdatedCount()));
        response.setUpdatedIds(result.getUpdatedIds());
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public List<Long> getUpdatedIds() {
        return updatedIds;
    }

    public void setUpdatedIds(List<Long> updatedIds) {
        this.updatedIds = updatedIds;
    }
}
