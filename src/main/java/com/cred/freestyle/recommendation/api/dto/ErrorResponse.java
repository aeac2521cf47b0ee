package com.cred.freestyle.recommendation.api.dto;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every failing endpoint; {@code message} carries the reason
 * clients should show.
 *
 * @author Recommendation Team
 */
@Getter
@Setter
@NoArgsConstructor
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private Integer status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        ErrorResponse response = new ErrorResponse();
        response.setStatus(status.value());
        response.setError(error);
        response.setMessage(message);
        response.setPath(path);
        return response;
    }

    public ErrorResponse addDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }
}
