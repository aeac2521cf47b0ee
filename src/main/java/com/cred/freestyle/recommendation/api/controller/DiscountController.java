package com.cred.freestyle.recommendation.api.controller;

import com.cred.freestyle.recommendation.api.dto.CustomDiscountResponse;
import com.cred.freestyle.recommendation.api.dto.FlatDiscountResponse;
import com.cred.freestyle.recommendation.exception.DataValidationException;
import com.cred.freestyle.recommendation.service.DiscountEngine;
import com.cred.freestyle.recommendation.service.DiscountEngine.CustomDiscountResult;
import com.cred.freestyle.recommendation.service.DiscountEngine.FlatDiscountResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for discount pricing.
 *
 * A {@code discount} query parameter selects flat mode: that percentage is applied to every
 * accessory recommendation and any body is ignored. Otherwise a JSON body mapping
 * recommendation ids to per-price percentages selects custom mode.
 *
 * @author Recommendation Team
 */
@RestController
@RequestMapping("/api/recommendations")
public class DiscountController {

    private static final Logger logger = LoggerFactory.getLogger(DiscountController.class);

    static final String MISSING_INPUT_MESSAGE = "A discount query parameter or a JSON body is required";

    private final DiscountEngine discountEngine;
    private final ObjectMapper objectMapper;

    public DiscountController(DiscountEngine discountEngine, ObjectMapper objectMapper) {
        this.discountEngine = discountEngine;
        this.objectMapper = objectMapper;
    }

    /**
     * Apply a flat or custom discount.
     *
     * @param discount Flat percentage, e.g. "10"
     * @param body Raw request body, read only when the content type is JSON
     * @return Updated ids and a summary message
     */
    @PutMapping("/apply_discount")
    public ResponseEntity<?> applyDiscount(
            @RequestParam(value = "discount", required = false) String discount,
            @RequestBody(required = false) String body,
            HttpServletRequest request
    ) {
        if (discount != null) {
            logger.debug("Flat discount requested: discount={}", discount);
            FlatDiscountResult result = discountEngine.applyFlatDiscount(discount);
            return ResponseEntity.ok(FlatDiscountResponse.fromResult(result));
        }

        if (!isJson(request.getContentType()) || !StringUtils.hasText(body)) {
            throw new DataValidationException(MISSING_INPUT_MESSAGE);
        }

        Object mapping;
        try {
            mapping = objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            throw new DataValidationException("Request body is not valid JSON", e);
        }

        logger.debug("Custom discounts requested");
        CustomDiscountResult result = discountEngine.applyCustomDiscounts(mapping);
        return ResponseEntity.ok(CustomDiscountResponse.fromResult(result));
    }

    private static boolean isJson(String contentType) {
        if (!StringUtils.hasText(contentType)) {
            return false;
        }
        try {
            MediaType mediaType = MediaType.parseMediaType(contentType);
            return MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)
                    || mediaType.getSubtype().endsWith("+json");
        } catch (InvalidMediaTypeException e) {
            logger.debug("Unparseable content type '{}', treating request as having no body", contentType);
            return false;
        }
    }
}
