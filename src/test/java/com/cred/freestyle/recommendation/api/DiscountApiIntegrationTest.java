package com.cred.freestyle.recommendation.api;

import com.cred.freestyle.recommendation.domain.model.Recommendation;
import com.cred.freestyle.recommendation.domain.model.Recommendation.RecommendationType;
import com.cred.freestyle.recommendation.repository.RecommendationRepository;
import com.cred.freestyle.recommendation.testutil.TestDataBuilder.RecommendationBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.cred.freestyle.recommendation.testutil.TestDataBuilder.recommendation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests for discount pricing.
 * Runs against in-memory H2; each discount request commits its own transaction,
 * so the table is cleared before every test instead of rolling back.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:recommendationdb;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.datasource.username=sa",
    "spring.datasource.password=",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.jpa.show-sql=false",
    "cloud.aws.cloudwatch.enabled=false"
})
@AutoConfigureMockMvc
@DisplayName("Discount API Integration Tests")
class DiscountApiIntegrationTest {

    private static final String DISCOUNT_URL = "/api/recommendations/apply_discount";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RecommendationRepository recommendationRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        recommendationRepository.deleteAll();
    }

    // ========================================
    // Flat discount
    // ========================================

    @Test
    @DisplayName("Flat discount reprices every accessory and leaves other types alone")
    void flatDiscount_RepricesAccessories() throws Exception {
        // Given
        Recommendation first = save(recommendation().accessory()
                .baseProductPrice("100.00").recommendedProductPrice("50.00"));
        Recommendation second = save(recommendation().accessory()
                .baseProductPrice("20.00").recommendedProductPrice("10.00"));
        Recommendation crossSell = save(recommendation().type(RecommendationType.CROSS_SELL)
                .baseProductPrice("100.00").recommendedProductPrice("50.00"));

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL).param("discount", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Applied 10% discount to 2 accessory recommendations"))
                .andExpect(jsonPath("$.updated_count").value(2))
                .andExpect(jsonPath("$.updated_ids", containsInAnyOrder(
                        first.getId().intValue(), second.getId().intValue())));

        assertPrices(first.getId(), "90.00", "45.00");
        assertPrices(second.getId(), "18.00", "9.00");
        assertPrices(crossSell.getId(), "100.00", "50.00");

        assertThat(meterRegistry.get("recommendation.discount.applied").tag("mode", "flat").counter().count())
                .isGreaterThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Flat discount of 0 is rejected and nothing changes")
    void flatDiscount_ZeroRejected() throws Exception {
        // Given
        Recommendation accessory = save(recommendation().accessory()
                .baseProductPrice("100.00").recommendedProductPrice("50.00"));

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL).param("discount", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Discount must be between 0 and 100"));

        assertPrices(accessory.getId(), "100.00", "50.00");
    }

    @Test
    @DisplayName("Flat discount with no accessories returns 404")
    void flatDiscount_NoAccessories() throws Exception {
        // Given
        save(recommendation().type(RecommendationType.CROSS_SELL));

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL).param("discount", "10"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Flat discount keeps null prices null")
    void flatDiscount_NullPricesPreserved() throws Exception {
        // Given
        Recommendation partial = save(recommendation().accessory()
                .baseProductPrice(null).recommendedProductPrice("50.00"));

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL).param("discount", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated_ids", contains(partial.getId().intValue())));

        Recommendation reloaded = recommendationRepository.findById(partial.getId()).orElseThrow();
        assertThat(reloaded.getBaseProductPrice()).isNull();
        assertThat(reloaded.getRecommendedProductPrice()).isEqualByComparingTo("40.00");
    }

    @Test
    @Timeout(10)
    @DisplayName("Flat discount with an extreme-exponent percent succeeds and keeps prices")
    void flatDiscount_TinyPercent() throws Exception {
        // Given
        Recommendation accessory = save(recommendation().accessory()
                .baseProductPrice("100.00").recommendedProductPrice("50.00"));

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL).param("discount", "1e-999999999"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message")
                        .value("Applied 1E-999999999% discount to 1 accessory recommendations"))
                .andExpect(jsonPath("$.updated_ids", contains(accessory.getId().intValue())));

        assertPrices(accessory.getId(), "100.00", "50.00");
    }

    @Test
    @DisplayName("Flat discount rejected by the database mid-batch leaves every record unchanged")
    void flatDiscount_StorageFailureRollsBack() throws Exception {
        // Given
        Recommendation first = save(recommendation().accessory()
                .baseProductPrice("100.00").recommendedProductPrice("50.00"));
        Recommendation second = save(recommendation().accessory()
                .baseProductPrice("20.00").recommendedProductPrice("10.00"));
        // The second record's discounted price (9.00) violates this constraint; the first one's does not
        jdbcTemplate.execute("ALTER TABLE recommendations ADD CONSTRAINT chk_no_nine "
                + "CHECK (recommended_product_price IS NULL OR recommended_product_price <> 9.00)");

        try {
            // When / Then
            mockMvc.perform(put(DISCOUNT_URL).param("discount", "10"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.status").value(400));
        } finally {
            jdbcTemplate.execute("ALTER TABLE recommendations DROP CONSTRAINT chk_no_nine");
        }

        assertPrices(first.getId(), "100.00", "50.00");
        assertPrices(second.getId(), "20.00", "10.00");
    }

    // ========================================
    // Custom discounts
    // ========================================

    @Test
    @DisplayName("Custom discounts apply per record and per price")
    void customDiscounts_AppliedPerRecord() throws Exception {
        // Given
        Recommendation first = save(recommendation().baseProductPrice("200.00").recommendedProductPrice("20.00"));
        Recommendation second = save(recommendation().baseProductPrice("100.00").recommendedProductPrice("10.00"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put(String.valueOf(first.getId()), Map.of("base_product_price", 10, "recommended_product_price", 20));
        body.put(String.valueOf(second.getId()), Map.of("base_product_price", 15));

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Applied custom discounts to 2 recommendations"))
                .andExpect(jsonPath("$.updated_ids", contains(
                        first.getId().intValue(), second.getId().intValue())));

        assertPrices(first.getId(), "180.00", "16.00");
        assertPrices(second.getId(), "85.00", "10.00");
    }

    @Test
    @DisplayName("Custom discounts for unknown ids succeed with no updates")
    void customDiscounts_UnknownIds() throws Exception {
        // Given
        Recommendation existing = save(recommendation());

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"987654\": {\"base_product_price\": 10}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated_ids", hasSize(0)));

        assertPrices(existing.getId(), "100.00", "50.00");
    }

    @Test
    @DisplayName("Custom discount on a null price excludes the record and keeps its updated date")
    void customDiscounts_NullTargetPrice() throws Exception {
        // Given
        Recommendation target = save(recommendation().baseProductPrice(null).recommendedProductPrice("30.00"));
        Instant updatedBefore = recommendationRepository.findById(target.getId()).orElseThrow().getUpdatedDate();

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"" + target.getId() + "\": {\"base_product_price\": 10}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated_ids", hasSize(0)));

        Recommendation reloaded = recommendationRepository.findById(target.getId()).orElseThrow();
        assertThat(reloaded.getBaseProductPrice()).isNull();
        assertThat(reloaded.getUpdatedDate()).isEqualTo(updatedBefore);
    }

    @Test
    @DisplayName("A malformed entry rejects the whole mapping and nothing changes")
    void customDiscounts_FailFast() throws Exception {
        // Given
        Recommendation target = save(recommendation().baseProductPrice("100.00").recommendedProductPrice("50.00"));

        String body = "{\"" + target.getId() + "\": {\"base_product_price\": 10}, \"abc\": {\"base_product_price\": 10}}";

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Keys must be numeric recommendation IDs"));

        assertPrices(target.getId(), "100.00", "50.00");
    }

    @Test
    @DisplayName("A JSON body sent without a JSON content type is treated as missing")
    void customDiscounts_WrongContentType() throws Exception {
        // Given
        Recommendation target = save(recommendation());

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL)
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("{\"" + target.getId() + "\": {\"base_product_price\": 10}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("required")));
    }

    @Test
    @Timeout(10)
    @DisplayName("Custom discount with an extreme-exponent percent succeeds and keeps the price")
    void customDiscounts_TinyPercent() throws Exception {
        // Given
        Recommendation target = save(recommendation().baseProductPrice("100.00").recommendedProductPrice("50.00"));

        // When / Then
        mockMvc.perform(put(DISCOUNT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"" + target.getId() + "\": {\"base_product_price\": \"1e-10000000\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated_ids", contains(target.getId().intValue())));

        assertPrices(target.getId(), "100.00", "50.00");
    }

    // ========================================
    // Listing and health
    // ========================================

    @Test
    @DisplayName("Listing shows discounted prices and filters by type")
    void listRecommendations_AfterDiscount() throws Exception {
        // Given
        Recommendation accessory = save(recommendation().accessory()
                .baseProductPrice("10.00").recommendedProductPrice("5.00"));
        save(recommendation().type(RecommendationType.UP_SELL));

        mockMvc.perform(put(DISCOUNT_URL).param("discount", "50"))
                .andExpect(status().isOk());

        // When / Then
        mockMvc.perform(get("/api/recommendations").param("recommendation_type", "ACCESSORY"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].recommendation_id").value(accessory.getId().intValue()))
                .andExpect(jsonPath("$[0].base_product_price").value(5.0))
                .andExpect(jsonPath("$[0].recommended_product_price").value(2.5));
    }

    @Test
    @DisplayName("Health endpoint reports OK")
    void health_ReportsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"));
    }

    private Recommendation save(RecommendationBuilder builder) {
        return recommendationRepository.save(builder.build());
    }

    private void assertPrices(Long id, String basePrice, String recommendedPrice) {
        Recommendation reloaded = recommendationRepository.findById(id).orElseThrow();
        assertThat(reloaded.getBaseProductPrice()).isEqualByComparingTo(new BigDecimal(basePrice));
        assertThat(reloaded.getRecommendedProductPrice()).isEqualByComparingTo(new BigDecimal(recommendedPrice));
    }
}
