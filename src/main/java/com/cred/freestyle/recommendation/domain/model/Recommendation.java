package com.cred.freestyle.recommendation.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * Recommendation entity linking a base product to a recommended product.
 * Carries the optional prices of both products, which the discount engine rewrites.
 *
 * @author Recommendation Team
 */
@Entity
@Table(name = "recommendations", indexes = {
    @Index(name = "idx_base_product", columnList = "base_product_id"),
    @Index(name = "idx_recommendation_type", columnList = "recommendation_type"),
    @Index(name = "idx_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    /**
     * Surrogate key assigned by the database on insert.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "recommendation_id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "base_product_id", nullable = false)
    private Integer baseProductId;

    @Column(name = "recommended_product_id", nullable = false)
    private Integer recommendedProductId;

    /**
     * Kind of association. Only ACCESSORY records take part in flat discounts.
     */
    @Convert(converter = RecommendationTypeConverter.class)
    @Column(name = "recommendation_type", nullable = false, length = 20)
    private RecommendationType recommendationType;

    @Convert(converter = RecommendationStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private RecommendationStatus status = RecommendationStatus.ACTIVE;

    /**
     * Model confidence in [0, 1].
     */
    @Column(name = "confidence_score", nullable = false, precision = 3, scale = 2)
    private BigDecimal confidenceScore;

    /**
     * Price of the base product. Null when unknown; a null price is never discounted.
     */
    @Column(name = "base_product_price", precision = 14, scale = 2)
    private BigDecimal baseProductPrice;

    /**
     * Price of the recommended product. Null when unknown; a null price is never discounted.
     */
    @Column(name = "recommended_product_price", precision = 14, scale = 2)
    private BigDecimal recommendedProductPrice;

    @Column(name = "base_product_description", length = 1023)
    private String baseProductDescription;

    @Column(name = "recommended_product_description", length = 1023)
    private String recommendedProductDescription;

    @Column(name = "created_date", nullable = false, updatable = false)
    private Instant createdDate;

    /**
     * Refreshed only when a price actually changes; see DiscountEngine.
     */
    @Column(name = "updated_date", nullable = false)
    private Instant updatedDate;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        createdDate = now;
        if (updatedDate == null) {
            updatedDate = now;
        }
        if (status == null) {
            status = RecommendationStatus.ACTIVE;
        }
    }

    /**
     * Recommendation type enum, persisted and serialized as its lowercase tag.
     */
    public enum RecommendationType {
        CROSS_SELL("cross-sell"),
        UP_SELL("up-sell"),
        ACCESSORY("accessory");

        private final String value;

        RecommendationType(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        /**
         * Resolve a tag case-insensitively, ignoring surrounding whitespace.
         *
         * @param value Tag such as "Cross-Sell"
         * @return Matching type
         * @throws IllegalArgumentException if the tag is blank or unknown
         */
        @JsonCreator
        public static RecommendationType fromValue(String value) {
            String normalized = normalize(value, "recommendation_type");
            for (RecommendationType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
            throw new IllegalArgumentException(
                    "recommendation_type must be one of [accessory, cross-sell, up-sell]");
        }
    }

    /**
     * Recommendation status enum, persisted and serialized as its lowercase tag.
     */
    public enum RecommendationStatus {
        ACTIVE("active"),
        INACTIVE("inactive");

        private final String value;

        RecommendationStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }

        @JsonCreator
        public static RecommendationStatus fromValue(String value) {
            String normalized = normalize(value, "status");
            for (RecommendationStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("status must be one of [active, inactive]");
        }
    }

    private static String normalize(String value, String field) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return normalized;
    }
}
