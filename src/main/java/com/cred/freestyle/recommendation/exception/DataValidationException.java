package com.cred.freestyle.recommendation.exception;

/**
 * Exception thrown when request data fails validation, or when the database rejects
 * a bulk write. Both surface to clients as 400 Bad Request.
 *
 * @author Recommendation Team
 */
public class DataValidationException extends RuntimeException {

    public DataValidationException(String message) {
        super(message);
    }

    public DataValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wrap a storage failure. The message of the cause is kept so clients see what the database rejected.
     *
     * @param cause Underlying persistence exception
     */
    public DataValidationException(Throwable cause) {
        super(cause.getMessage(), cause);
    }
}
