/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.exceptions;

/**
 * Exception thrown when the hierarchical store cannot serve a request within the configured wait.
 *
 * <p>
 * Transient infrastructure failure. The aggregation engine never retries internally; the exception is surfaced to the
 * job runtime or mapped to HTTP 503 Service Unavailable by REST resources.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
