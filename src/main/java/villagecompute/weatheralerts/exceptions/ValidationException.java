/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.exceptions;

/**
 * Exception thrown when input validation fails (e.g., malformed alert form, illegal store path segment).
 *
 * <p>
 * Extends RuntimeException per project standards. The ingestion path drops the offending record and logs; REST
 * resources map it to HTTP 400 Bad Request.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
