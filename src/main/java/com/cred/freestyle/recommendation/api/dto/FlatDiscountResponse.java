package com.cred.freestyle.recommendation.api.dto;

import com.cred.freestyle.recommendation.service.DiscountEngine;
import com.cred.freestyle.recommendation.service.DiscountEngine.FlatDiscountResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for a flat discount over accessory recommendations.
 *
 * @author Recommendation Team
 */
public class FlatDiscountResponse {

    private String message;

    @JsonProperty("updated_count")
    private Integer updatedCount;

    @JsonProperty("updated_ids")
    private List<Long> updatedIds;

    public FlatDiscountResponse() {
    }

    public static FlatDiscountResponse fromResult(FlatDiscountResult result) {
        FlatDiscountResponse response = new FlatDiscountResponse();
        response.setMessage(String.format("Applied %s%% discount to %d accessory recommendations",
                DiscountEngine.formatPercent(result.getDiscount()), result.getUpdatedCount()));
        response.setUpdatedCount(result.getUpdatedCount());
        response.setUpdatedIds(result.getUpdatedIds());
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Integer getUpdatedCount() {
        return updatedCount;
    }

    public void setUpdatedCount(Integer updatedCount) {
        this.updatedCount = updatedCount;
    }

    public List<Long> getUpdatedIds() {
        return updatedIds;
    }

    public void setUpdatedIds(List<Long> updatedIds) {
        this.updatedIds = updatedIds;
    }
}
