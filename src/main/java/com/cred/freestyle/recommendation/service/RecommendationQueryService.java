package com.cred.freestyle.recommendation.service;

import com.cred.freestyle.recommendation.domain.model.Recommendation;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationStatus;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationType;
import com.cred.freestyle.recommendation.repository.RecommendationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static com.cred.freestyle.recommendation.repository.RecommendationSpecifications.hasBaseProductId;
import static com.cred.freestyle.recommendation.repository.RecommendationSpecifications.hasMinConfidence;
import static com.cred.freestyle.recommendation.repository.RecommendationSpecifications.hasStatus;
import static com.cred.freestyle.recommendation.repository.RecommendationSpecifications.hasType;

/**
 * Read-side access to recommendations.
 *
 * @author Recommendation Team
 */
@Service
public class RecommendationQueryService {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationQueryService.class);

    private final RecommendationRepository recommendationRepository;

    public RecommendationQueryService(RecommendationRepository recommendationRepository) {
        this.recommendationRepository = recommendationRepository;
    }

    /**
     * Find recommendations matching every supplied filter. Null filters are ignored.
     *
     * @param baseProductId Exact base product id
     * @param type Recommendation type
     * @param status Recommendation status
     * @param minConfidence Minimum confidence score, inclusive
     * @return Matching recommendations ordered by id
     */
    @Transactional(readOnly = true)
    public List<Recommendation> search(
            Integer baseProductId,
            RecommendationType type,
            RecommendationStatus status,
            BigDecimal minConfidence
    ) {
        logger.debug("Searching recommendations: baseProductId={}, type={}, status={}, minConfidence={}",
                baseProductId, type, status, minConfidence);

        Specification<Recommendation> filter = Specification.where(hasBaseProductId(baseProductId))
                .and(hasType(type))
                .and(hasStatus(status))
                .and(hasMinConfidence(minConfidence));

        List<Recommendation> recommendations = recommendationRepository.findAll(filter, Sort.by("id"));

        logger.debug("Found {} recommendations", recommendations.size());
        return recommendations;
    }
}
