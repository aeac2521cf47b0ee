package com.cred.freestyle.recommendation.api.dto;

import com.cred.freestyle.recommendation.domain.model.Recommendation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a single recommendation.
 * Null prices are rendered as JSON null rather than omitted.
 *
 * @author Recommendation Team
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class RecommendationResponse {

    @JsonProperty("recommendation_id")
    private Long recommendationId;

    @JsonProperty("base_product_id")
    private Integer baseProductId;

    @JsonProperty("recommended_product_id")
    private Integer recommendedProductId;

    @JsonProperty("recommendation_type")
    private String recommendationType;

    private String status;

    @JsonProperty("confidence_score")
    private BigDecimal confidenceScore;

    @JsonProperty("base_product_price")
    private BigDecimal baseProductPrice;

    @JsonProperty("recommended_product_price")
    private BigDecimal recommendedProductPrice;

    @JsonProperty("base_product_description")
    private String baseProductDescription;

    @JsonProperty("recommended_product_description")
    private String recommendedProductDescription;

    @JsonProperty("created_date")
    private Instant createdDate;

    @JsonProperty("updated_date")
    private Instant updatedDate;

    public RecommendationResponse() {
    }

    /**
     * Create response from Recommendation entity.
     *
     * @param recommendation Recommendation entity
     * @return RecommendationResponse
     */
    public static RecommendationResponse fromEntity(Recommendation recommendation) {
        RecommendationResponse response = new RecommendationResponse();
        response.setRecommendationId(recommendation.getId());
        response.setBaseProductId(recommendation.getBaseProductId());
        response.setRecommendedProductId(recommendation.getRecommendedProductId());
        if (recommendation.getRecommendationType() != null) {
            response.setRecommendationType(recommendation.getRecommendationType().getValue());
        }
        if (recommendation.getStatus() != null) {
            response.setStatus(recommendation.getStatus().getValue());
        }
        response.setConfidenceScore(recommendation.getConfidenceScore());
        response.setBaseProductPrice(recommendation.getBaseProductPrice());
        response.setRecommendedProductPrice(recommendation.getRecommendedProductPrice());
        response.setBaseProductDescription(recommendation.getBaseProductDescription());
        response.setRecommendedProductDescription(recommendation.getRecommendedProductDescription());
        response.setCreatedDate(recommendation.getCreatedDate());
        response.setUpdatedDate(recommendation.getUpdatedDate());
        return response;
    }

    // Getters and setters
    public Long getRecommendationId() {
        return recommendationId;
    }

    public void setRecommendationId(Long recommendationId) {
        this.recommendationId = recommendationId;
    }

    public Integer getBaseProductId() {
        return baseProductId;
    }

    public void setBaseProductId(Integer baseProductId) {
        this.baseProductId = baseProductId;
    }

    public Integer getRecommendedProductId() {
        return recommendedProductId;
    }

    public void setRecommendedProductId(Integer recommendedProductId) {
        this.recommendedProductId = recommendedProductId;
    }

    public String getRecommendationType() {
        return recommendationType;
    }

    public void setRecommendationType(String recommendationType) {
        this.recommendationType = recommendationType;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public BigDecimal getConfidenceScore() {
        return confidenceScore;
    }

    public void setConfidenceScore(BigDecimal confidenceScore) {
        this.confidenceScore = confidenceScore;
    }

    public BigDecimal getBaseProductPrice() {
        return baseProductPrice;
    }

    public void setBaseProductPrice(BigDecimal baseProductPrice) {
        this.baseProductPrice = baseProductPrice;
    }

    public BigDecimal getRecommendedProductPrice() {
        return recommendedProductPrice;
    }

    public void setRecommendedProductPrice(BigDecimal recommendedProductPrice) {
        this.recommendedProductPrice = recommendedProductPrice;
    }

    public String getBaseProductDescription() {
        return baseProductDescription;
    }

    public void setBaseProductDescription(String baseProductDescription) {
        this.baseProductDescription = baseProductDescription;
    }

    public String getRecommendedProductDescription() {
        return recommendedProductDescription;
    }

    public void setRecommendedProductDescription(String recommendedProductDescription) {
        this.recommendedProductDescription = recommendedProductDescription;
    }

    public Instant getCreatedDate() {
        return createdDate;
    }

    public void setCreatedDate(Instant createdDate) {
        this.createdDate = createdDate;
    }

    public Instant getUpdatedDate() {
        return updatedDate;
    }

    public void setUpdatedDate(Instant updatedDate) {
        this.updatedDate = updatedDate;
    }
}
