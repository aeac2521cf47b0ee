package com.cred.freestyle.recommendation.domain.model;

import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA converter storing recommendation statuses as their lowercase tags.
 */
@Converter
public class RecommendationStatusConverter implements AttributeConverter<RecommendationStatus, String> {

    @Override
    public String convertToDatabaseColumn(RecommendationStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public RecommendationStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : RecommendationStatus.fromValue(dbData);
    }
}
