/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.exceptions;

/**
 * Exception thrown when a reverse-geocoding lookup fails (no result, malformed response, transport failure).
 *
 * <p>
 * All causes are handled identically by the ingestion path: the alert is dropped from aggregation and the failure is
 * logged.
 */
public class GeocodingException extends RuntimeException {

    public GeocodingException(String message) {
        super(message);
    }

    public GeocodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
