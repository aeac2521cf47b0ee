package com.cred.freestyle.recommendation.api.controller;

import com.cred.freestyle.recommendation.api.dto.RecommendationResponse;
import com.cred.freestyle.recommendation.domain.model.Recommendation;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationStatus;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationType;
import com.cred.freestyle.recommendation.service.RecommendationQueryService;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for listing recommendations.
 *
 * @author Recommendation Team
 */
@RestController
@RequestMapping("/api/recommendations")
@Validated
public class RecommendationController {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationController.class);

    private final RecommendationQueryService queryService;

    public RecommendationController(RecommendationQueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * List recommendations, optionally filtered. All filters are combined with AND.
     *
     * @param baseProductId Exact base product id
     * @param recommendationType Type tag, case-insensitive
     * @param status Status tag, case-insensitive
     * @param confidenceScore Minimum confidence score in [0, 1], inclusive
     * @return Matching recommendations, empty list when nothing matches
     */
    @GetMapping
    public ResponseEntity<List<RecommendationResponse>> listRecommendations(
            @RequestParam(value = "base_product_id", required = false) Integer baseProductId,
            @RequestParam(value = "recommendation_type", required = false) String recommendationType,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "confidence_score", required = false)
            @DecimalMin(value = "0.0", message = "confidence_score must be between 0 and 1")
            @DecimalMax(value = "1.0", message = "confidence_score must be between 0 and 1")
            BigDecimal confidenceScore
    ) {
        RecommendationType type = recommendationType != null
                ? RecommendationType.fromValue(recommendationType)
                : null;
        RecommendationStatus recommendationStatus = status != null
                ? RecommendationStatus.fromValue(status)
                : null;

        List<Recommendation> recommendations =
                queryService.search(baseProductId, type, recommendationStatus, confidenceScore);

        List<RecommendationResponse> responses = recommendations.stream()
                .map(RecommendationResponse::fromEntity)
                .collect(Collectors.toList());

        logger.debug("Returning {} recommendations", responses.size());
        return ResponseEntity.ok(responses);
    }
}
