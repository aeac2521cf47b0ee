package com.cred.freestyle.recommendation.domain.model;

import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA converter storing recommendation types as their lowercase tags
 * ("cross-sell", "up-sell", "accessory").
 */
@Converter
public class RecommendationTypeConverter implements AttributeConverter<RecommendationType, String> {

    @Override
    public String convertToDatabaseColumn(RecommendationType type) {
        return type == null ? null : type.getValue();
    }

    @Override
    public RecommendationType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : RecommendationType.fromValue(dbData);
    }
}
