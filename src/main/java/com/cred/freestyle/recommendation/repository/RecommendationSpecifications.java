package com.cred.freestyle.recommendation.repository;

import com.cred.freestyle.recommendation.domain.model.Recommendation;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationStatus;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationType;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;

/**
 * Composable query filters for {@link RecommendationRepository}.
 * Each factory returns null for a null argument so that
 * {@link Specification#where(Specification)} chains skip absent filters.
 */
public final class RecommendationSpecifications {

    private RecommendationSpecifications() {
    }

    public static Specification<Recommendation> hasBaseProductId(Integer baseProductId) {
        if (baseProductId == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("baseProductId"), baseProductId);
    }

    public static Specification<Recommendation> hasType(RecommendationType type) {
        if (type == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("recommendationType"), type);
    }

    public static Specification<Recommendation> hasStatus(RecommendationStatus status) {
        if (status == null) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    /**
     * Inclusive lower bound on confidence score.
     */
    public static Specification<Recommendation> hasMinConfidence(BigDecimal minConfidence) {
        if (minConfidence == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.<BigDecimal>get("confidenceScore"), minConfidence);
    }
}
