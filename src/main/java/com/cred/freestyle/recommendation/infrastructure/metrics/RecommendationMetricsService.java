package com.cred.freestyle.recommendation.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for the recommendation discount subsystem.
 * Records through Micrometer; the registry publishes to CloudWatch when enabled.
 *
 * Key Metrics:
 * - Discount operations by mode (flat/custom) and outcome
 * - Number of recommendations repriced
 * - Discount latency (p50, p95, p99)
 * - Error rates
 *
 * @author Recommendation Team
 */
@Service
public class RecommendationMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(RecommendationMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "recommendation.";
    private static final String DISCOUNT_PREFIX = METRIC_PREFIX + "discount.";

    public RecommendationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a successful discount operation.
     *
     * @param mode Discount mode ("flat" or "custom")
     * @param updatedCount Number of recommendations repriced
     */
    public void recordDiscountApplied(String mode, int updatedCount) {
        Counter.builder(DISCOUNT_PREFIX + "applied")
                .tag("mode", mode)
                .description("Successful discount operations")
                .register(meterRegistry)
                .increment();

        Counter.builder(DISCOUNT_PREFIX + "updated.records")
                .tag("mode", mode)
                .description("Recommendations repriced by discount operations")
                .register(meterRegistry)
                .increment(updatedCount);

        logger.debug("Recorded discount applied: mode={}, updated={}", mode, updatedCount);
    }

    /**
     * Record a rejected discount operation.
     *
     * @param mode Discount mode ("flat" or "custom")
     * @param reason Rejection reason (e.g. "VALIDATION", "NOT_FOUND", "STORAGE")
     */
    public void recordDiscountRejected(String mode, String reason) {
        Counter.builder(DISCOUNT_PREFIX + "rejected")
                .tag("mode", mode)
                .tag("reason", reason)
                .description("Rejected discount operations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded discount rejected: mode={}, reason={}", mode, reason);
    }

    /**
     * Record end-to-end latency of a discount operation.
     *
     * @param mode Discount mode
     * @param durationMs Duration in milliseconds
     */
    public void recordDiscountLatency(String mode, long durationMs) {
        Timer.builder(DISCOUNT_PREFIX + "latency")
                .tag("mode", mode)
                .description("Discount operation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
