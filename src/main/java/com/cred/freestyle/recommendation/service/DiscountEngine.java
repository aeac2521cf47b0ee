package com.cred.freestyle.recommendation.service;

import com.cred.freestyle.recommendation.domain.model.Recommendation;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationType;
import com.cred.freestyle.recommendation.exception.DataValidationException;
import com.cred.freestyle.recommendation.exception.ResourceNotFoundException;
import com.cred.freestyle.recommendation.infrastructure.metrics.RecommendationMetricsService;
import com.cred.freestyle.recommendation.repository.RecommendationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Applies percentage discounts to recommendation prices.
 *
 * Two bulk operations are supported:
 * 1. Flat discount: one percentage applied to every accessory recommendation
 * 2. Custom discounts: a per-recommendation, per-price percentage mapping
 *
 * Each operation runs in exactly one database transaction. Either every repriced
 * recommendation is committed or none is. Null prices are never discounted, and
 * updated_date is refreshed only on recommendations whose prices changed.
 *
 * @author Recommendation Team
 */
@Service
public class DiscountEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiscountEngine.class);

    public static final String BASE_PRODUCT_PRICE = "base_product_price";
    public static final String RECOMMENDED_PRODUCT_PRICE = "recommended_product_price";

    public static final String INVALID_DISCOUNT_MESSAGE = "Discount must be between 0 and 100";
    public static final String INVALID_MAPPING_MESSAGE = "JSON body must map recommendation_id to discount objects";
    public static final String INVALID_KEY_MESSAGE = "Keys must be numeric recommendation IDs";
    public static final String INVALID_CONFIG_MESSAGE = "Each value must be an object with price discount fields";
    public static final String MISSING_FIELDS_MESSAGE =
            "Provide at least one of base_product_price or recommended_product_price";

    static final String MODE_FLAT = "flat";
    static final String MODE_CUSTOM = "custom";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int PRICE_SCALE = 2;

    private static final MathContext ARITHMETIC = MathContext.DECIMAL128;
    private static final int MAX_PLAIN_SCALE = 34;

    private final RecommendationRepository recommendationRepository;
    private final TransactionTemplate transactionTemplate;
    private final RecommendationMetricsService metricsService;

    public DiscountEngine(
            RecommendationRepository recommendationRepository,
            PlatformTransactionManager transactionManager,
            RecommendationMetricsService metricsService
    ) {
        this.recommendationRepository = recommendationRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metricsService = metricsService;
    }

    /**
     * Parse and range-check a discount percentage.
     *
     * @param value String or number, e.g. "10", 12.5
     * @return The percentage, strictly between 0 and 100
     * @throws DataValidationException if the value is not numeric or is outside (0, 100)
     */
    public static BigDecimal validatePercentage(Object value) {
        BigDecimal percent;
        try {
            percent = toDecimal(value);
        } catch (NumberFormatException e) {
            throw new DataValidationException(INVALID_DISCOUNT_MESSAGE, e);
        }

        if (percent.compareTo(BigDecimal.ZERO) <= 0 || percent.compareTo(HUNDRED) >= 0) {
            throw new DataValidationException(INVALID_DISCOUNT_MESSAGE);
        }
        return percent;
    }

    /**
     * Compute price * (100 - percent) / 100, rounded half-up to 2 decimal places.
     * Intermediate results carry 34 significant digits.
     *
     * @param price Non-negative price
     * @param percent Validated percentage in (0, 100)
     * @return Discounted price with scale 2
     */
    public static BigDecimal applyPercentDiscount(BigDecimal price, BigDecimal percent) {
        return price.multiply(HUNDRED.subtract(percent, ARITHMETIC), ARITHMETIC)
                .divide(HUNDRED, ARITHMETIC)
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Render a percentage without trailing zeros, e.g. 12.50 as "12.5" and 10 as "10".
     * Values too small to print in plain notation use scientific notation, e.g. "1E-999999999".
     */
    public static String formatPercent(BigDecimal percent) {
        BigDecimal stripped = percent.stripTrailingZeros();
        if (stripped.scale() > MAX_PLAIN_SCALE) {
            return stripped.toString();
        }
        return stripped.toPlainString();
    }

    /**
     * Apply one percentage to both prices of every accessory recommendation.
     *
     * @param percent Raw percentage (validated here)
     * @return Ids of the repriced recommendations, in id order
     * @throws DataValidationException if the percentage is invalid or the database rejects the update
     * @throws ResourceNotFoundException if there are no accessories, or none has a price
     */
    public FlatDiscountResult applyFlatDiscount(Object percent) {
        long startTime = System.currentTimeMillis();

        try {
            BigDecimal discount = validatePercentage(percent);
            logger.info("Applying flat discount of {}% to accessory recommendations", formatPercent(discount));

            List<Long> updatedIds = executeInTransaction("applyFlatDiscount",
                    () -> repriceAccessories(discount));

            metricsService.recordDiscountApplied(MODE_FLAT, updatedIds.size());
            metricsService.recordDiscountLatency(MODE_FLAT, System.currentTimeMillis() - startTime);

            logger.info("Flat discount of {}% applied to {} accessory recommendations",
                    formatPercent(discount), updatedIds.size());
            return new FlatDiscountResult(discount, updatedIds);

        } catch (DataValidationException e) {
            metricsService.recordDiscountRejected(MODE_FLAT, rejectionReason(e));
            throw e;
        } catch (ResourceNotFoundException e) {
            logger.info("Flat discount not applied: {}", e.getMessage());
            metricsService.recordDiscountRejected(MODE_FLAT, "NOT_FOUND");
            throw e;
        }
    }

    /**
     * Apply per-recommendation discounts from a mapping of id to price percentages, e.g.
     * {"12": {"base_product_price": 10, "recommended_product_price": 20}}.
     *
     * Every entry is validated before anything is read or written; one malformed entry
     * rejects the whole batch. Ids that do not exist are skipped.
     *
     * @param mapping Map of recommendation id to discount configuration
     * @return Ids of the repriced recommendations, in mapping order
     * @throws DataValidationException if the mapping is malformed or the database rejects the update
     */
    public CustomDiscountResult applyCustomDiscounts(Object mapping) {
        long startTime = System.currentTimeMillis();

        try {
            List<CustomDiscount> discounts = parseCustomDiscounts(mapping);
            logger.info("Applying custom discounts to {} recommendations", discounts.size());

            List<Long> updatedIds = executeInTransaction("applyCustomDiscounts",
                    () -> repriceCustom(discounts));

            metricsService.recordDiscountApplied(MODE_CUSTOM, updatedIds.size());
            metricsService.recordDiscountLatency(MODE_CUSTOM, System.currentTimeMillis() - startTime);

            logger.info("Custom discounts applied: {} of {} entries updated a recommendation",
                    updatedIds.size(), discounts.size());
            return new CustomDiscountResult(updatedIds);

        } catch (DataValidationException e) {
            logger.info("Custom discounts rejected: {}", e.getMessage());
            metricsService.recordDiscountRejected(MODE_CUSTOM, rejectionReason(e));
            throw e;
        }
    }

    /**
     * Validate the raw mapping into discount entries without touching the database.
     */
    List<CustomDiscount> parseCustomDiscounts(Object mapping) {
        if (!(mapping instanceof Map) || ((Map<?, ?>) mapping).isEmpty()) {
            throw new DataValidationException(INVALID_MAPPING_MESSAGE);
        }

        List<CustomDiscount> discounts = new ArrayList<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) mapping).entrySet()) {
            Long recommendationId = parseRecommendationId(entry.getKey());

            if (!(entry.getValue() instanceof Map) || ((Map<?, ?>) entry.getValue()).isEmpty()) {
                throw new DataValidationException(INVALID_CONFIG_MESSAGE);
            }
            Map<?, ?> config = (Map<?, ?>) entry.getValue();

            boolean hasBase = config.containsKey(BASE_PRODUCT_PRICE);
            boolean hasRecommended = config.containsKey(RECOMMENDED_PRODUCT_PRICE);
            if (!hasBase && !hasRecommended) {
                throw new DataValidationException(MISSING_FIELDS_MESSAGE);
            }

            BigDecimal basePercent = hasBase ? validatePercentage(config.get(BASE_PRODUCT_PRICE)) : null;
            BigDecimal recommendedPercent = hasRecommended
                    ? validatePercentage(config.get(RECOMMENDED_PRODUCT_PRICE))
                    : null;

            discounts.add(new CustomDiscount(recommendationId, basePercent, recommendedPercent));
        }
        return discounts;
    }

    private List<Long> repriceAccessories(BigDecimal discount) {
        List<Recommendation> accessories =
                recommendationRepository.findByRecommendationTypeOrderByIdAsc(RecommendationType.ACCESSORY);
        if (accessories.isEmpty()) {
            throw new ResourceNotFoundException("Recommendation", "No matching accessory recommendations found");
        }

        Instant now = Instant.now();
        List<Recommendation> updated = new ArrayList<>();
        List<Long> updatedIds = new ArrayList<>();
        for (Recommendation recommendation : accessories) {
            if (reprice(recommendation, discount, discount, now)) {
                updated.add(recommendation);
                updatedIds.add(recommendation.getId());
            } else {
                logger.debug("Accessory recommendation {} has no prices, skipping", recommendation.getId());
            }
        }

        if (updated.isEmpty()) {
            throw new ResourceNotFoundException("Recommendation",
                    "No matching accessory recommendations found with prices to discount");
        }

        recommendationRepository.saveAllAndFlush(updated);
        return updatedIds;
    }

    private List<Long> repriceCustom(List<CustomDiscount> discounts) {
        Instant now = Instant.now();
        List<Recommendation> updated = new ArrayList<>();
        List<Long> updatedIds = new ArrayList<>();

        for (CustomDiscount discount : discounts) {
            Optional<Recommendation> found = recommendationRepository.findById(discount.getRecommendationId());
            if (found.isEmpty()) {
                logger.debug("Recommendation {} not found, skipping", discount.getRecommendationId());
                continue;
            }

            Recommendation recommendation = found.get();
            if (reprice(recommendation, discount.getBasePercent(), discount.getRecommendedPercent(), now)) {
                updated.add(recommendation);
                updatedIds.add(recommendation.getId());
            } else {
                logger.debug("Recommendation {} has no price for the requested discount, skipping",
                        recommendation.getId());
            }
        }

        if (!updated.isEmpty()) {
            recommendationRepository.saveAllAndFlush(updated);
        }
        return updatedIds;
    }

    /**
     * Discount each non-null price that has a percentage. Stamps updatedDate when anything changed.
     *
     * @return true if at least one price was recomputed
     */
    private boolean reprice(Recommendation recommendation, BigDecimal basePercent,
                            BigDecimal recommendedPercent, Instant now) {
        boolean changed = false;

        if (basePercent != null && recommendation.getBaseProductPrice() != null) {
            recommendation.setBaseProductPrice(
                    applyPercentDiscount(recommendation.getBaseProductPrice(), basePercent));
            changed = true;
        }
        if (recommendedPercent != null && recommendation.getRecommendedProductPrice() != null) {
            recommendation.setRecommendedProductPrice(
                    applyPercentDiscount(recommendation.getRecommendedProductPrice(), recommendedPercent));
            changed = true;
        }

        if (changed) {
            recommendation.setUpdatedDate(now);
        }
        return changed;
    }

    /**
     * Run work in a single transaction. Storage failures roll the transaction back and
     * surface as DataValidationException.
     */
    private <T> T executeInTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            logger.error("Database error during {}, transaction rolled back", operation, e);
            metricsService.recordError("DATABASE_ERROR", operation);
            throw new DataValidationException(e);
        }
    }

    private static Long parseRecommendationId(Object key) {
        try {
            return Long.parseLong(String.valueOf(key).trim());
        } catch (NumberFormatException e) {
            throw new DataValidationException(INVALID_KEY_MESSAGE, e);
        }
    }

    private static BigDecimal toDecimal(Object value) {
        if (value == null || value instanceof Boolean) {
            throw new NumberFormatException("Not a number: " + value);
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString().trim());
    }

    private static String rejectionReason(DataValidationException e) {
        Throwable cause = e.getCause();
        if (cause instanceof DataAccessException || cause instanceof TransactionException) {
            return "STORAGE";
        }
        return "VALIDATION";
    }

    /**
     * One validated entry of a custom discount mapping.
     * A null percentage means that price is not discounted.
     */
    static class CustomDiscount {
        private final Long recommendationId;
        private final BigDecimal basePercent;
        private final BigDecimal recommendedPercent;

        CustomDiscount(Long recommendationId, BigDecimal basePercent, BigDecimal recommendedPercent) {
            this.recommendationId = recommendationId;
            this.basePercent = basePercent;
            this.recommendedPercent = recommendedPercent;
        }

        Long getRecommendationId() { return recommendationId; }
        BigDecimal getBasePercent() { return basePercent; }
        BigDecimal getRecommendedPercent() { return recommendedPercent; }
    }

    /**
     * Outcome of a flat discount.
     */
    public static class FlatDiscountResult {
        private final BigDecimal discount;
        private final List<Long> updatedIds;

        public FlatDiscountResult(BigDecimal discount, List<Long> updatedIds) {
            this.discount = discount;
            this.updatedIds = Collections.unmodifiableList(updatedIds);
        }

        public BigDecimal getDiscount() { return discount; }
        public List<Long> getUpdatedIds() { return updatedIds; }
        public int getUpdatedCount() { return updatedIds.size(); }
    }

    /**
     * Outcome of a custom discount batch.
     */
    public static class CustomDiscountResult {
        private final List<Long> updatedIds;

        public CustomDiscountResult(List<Long> updatedIds) {
            this.updatedIds = Collections.unmodifiableList(updatedIds);
        }

        public List<Long> getUpdatedIds() { return updatedIds; }
        public int getUpdatedCount() { return updatedIds.size(); }
    }
}
