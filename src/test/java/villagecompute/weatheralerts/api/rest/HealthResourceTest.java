/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.api.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import jakarta.ws.rs.core.Response;
import villagecompute.weatheralerts.api.rest.HealthResource.HealthResponse;
import villagecompute.weatheralerts.config.AggregationConfig;
import villagecompute.weatheralerts.data.store.HierarchicalStore;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.observability.ObservabilityMetrics;

/**
 * Unit tests for {@link HealthResource}.
 */
class HealthResourceTest {

    @Mock
    HierarchicalStore store;

    @Mock
    AggregationConfig config;

    @Mock
    ObservabilityMetrics metrics;

    @InjectMocks
    HealthResource resource;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(config.membersRoot()).thenReturn("aggregation");
        when(metrics.getLastSweepEpochSeconds()).thenReturn(1741946400L);
    }

    @Test
    void testHealth_up() {
        when(store.exists(anyString())).thenReturn(true);

        Response response = resource.health();

        assertEquals(200, response.getStatus());
        HealthResponse body = (HealthResponse) response.getEntity();
        assertEquals("UP", body.status());
        assertEquals(1741946400L, body.lastSweepEpochSeconds());
    }

    @Test
    void testHealth_storeUnavailable() {
        when(store.exists(anyString())).thenThrow(new StoreUnavailableException("Timed out after 5000 ms"));

        Response response = resource.health();

        assertEquals(503, response.getStatus());
        assertEquals("DOWN", ((HealthResponse) response.getEntity()).status());
    }
}
