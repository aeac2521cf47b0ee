package com.cred.freestyle.recommendation.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * Publishes discount metrics to AWS CloudWatch when cloud.aws.cloudwatch.enabled=true.
 * Without it the actuator's in-memory registry backs {@code RecommendationMetricsService}.
 *
 * @author Recommendation Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    private final String region;
    private final Map<String, String> registrySettings;

    public CloudWatchConfig(
            @Value("${cloud.aws.region:us-east-1}") String region,
            @Value("${cloud.aws.cloudwatch.namespace:Recommendations}") String namespace,
            @Value("${cloud.aws.cloudwatch.batch-size:20}") int batchSize,
            @Value("${cloud.aws.cloudwatch.step:PT1M}") String step
    ) {
        this.region = region;
        // Keys follow micrometer's "cloudwatch." property prefix
        this.registrySettings = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step
        );
    }

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(region))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        return new CloudWatchMeterRegistry(registryConfig(), Clock.SYSTEM, cloudWatchAsyncClient);
    }

    io.micrometer.cloudwatch2.CloudWatchConfig registryConfig() {
        return registrySettings::get;
    }
}
