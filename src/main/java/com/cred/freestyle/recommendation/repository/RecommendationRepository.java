package com.cred.freestyle.recommendation.repository;

import com.cred.freestyle.recommendation.domain.model.Recommendation;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Recommendation entity.
 * Provides lookups for the discount engine and filtered scans for the query API.
 *
 * @author Recommendation Team
 */
@Repository
public interface RecommendationRepository
        extends JpaRepository<Recommendation, Long>, JpaSpecificationExecutor<Recommendation> {

    /**
     * Find all recommendations of a given type, ordered by id.
     * The flat discount walks this list, so the order determines the order of updated ids.
     *
     * @param recommendationType Recommendation type
     * @return Matching recommendations
     */
    List<Recommendation> findByRecommendationTypeOrderByIdAsc(RecommendationType recommendationType);
}
