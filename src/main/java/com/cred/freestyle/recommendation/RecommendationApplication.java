package com.cred.freestyle.recommendation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the Recommendation service.
 *
 * System Overview:
 * - Stores product-to-product recommendations (cross-sell, up-sell, accessory)
 * - Flat percentage discount applied to every accessory recommendation
 * - Custom per-recommendation discounts applied to a batch in one request
 * - One database transaction per bulk discount operation
 *
 * Architecture:
 * - API Layer: REST controllers and a global exception handler
 * - Service Layer: discount engine and recommendation queries
 * - Data Access Layer: JPA repositories
 * - Infrastructure Layer: Micrometer metrics, optionally published to CloudWatch
 *
 * @author Recommendation Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class RecommendationApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecommendationApplication.class, args);
    }
}
