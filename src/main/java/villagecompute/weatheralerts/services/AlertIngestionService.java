/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.AlertFormType;
import villagecompute.weatheralerts.api.types.LocationType;
import villagecompute.weatheralerts.config.AggregationConfig;
import villagecompute.weatheralerts.data.models.AlertRecord;
import villagecompute.weatheralerts.data.models.CriticalWeatherPhenomenon;
import villagecompute.weatheralerts.data.store.StorePaths;
import villagecompute.weatheralerts.exceptions.GeocodingException;
import villagecompute.weatheralerts.integration.geocoding.GeocodeResult;
import villagecompute.weatheralerts.integration.geocoding.GoogleGeocodingClient;
import villagecompute.weatheralerts.observability.LoggingConfig;
import villagecompute.weatheralerts.observability.ObservabilityMetrics;

/**
 * Assigns a newly submitted alert to its aggregation bucket.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>Validate the phenomenon, the location and the record id; invalid forms are dropped with a logged reason</li>
 * <li>Short-circuit redelivered records already aggregated under the same phenomenon</li>
 * <li>Reverse-geocode the location; a failed lookup drops the alert</li>
 * <li>Derive the bucket id from the place name and bounds</li>
 * <li>Create the bucket if absent, then add the member and increment its counter atomically</li>
 * </ol>
 *
 * <p>
 * Processing the same record twice leaves the store unchanged after the first success. Store outages propagate as
 * {@link villagecompute.weatheralerts.exceptions.StoreUnavailableException} so the job runtime can retry.
 */
@ApplicationScoped
public class AlertIngestionService {

    private static final Logger LOG = Logger.getLogger(AlertIngestionService.class);

    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("HH:mm");

    /**
     * Result category of one ingestion.
     */
    public enum IngestionOutcome {
        /** Record added to its bucket. */
        AGGREGATED,
        /** Record was already a member; nothing changed. */
        DUPLICATE,
        /** Phenomenon, location or id missing or malformed. */
        DROPPED_INVALID,
        /** Reverse geocoding failed. */
        DROPPED_GEOCODE_FAILED
    }

    /**
     * Outcome of one ingestion with the bucket it landed in, when known.
     */
    public record IngestionResult(IngestionOutcome outcome, String phenomenon, String bucketId, String placeName) {

        static IngestionResult dropped(IngestionOutcome outcome, String phenomenon) {
            return new IngestionResult(outcome, phenomenon, null, null);
        }
    }

    private final AggregationStore aggregationStore;
    private final GoogleGeocodingClient geocodingClient;
    private final BucketKeyDeriver bucketKeyDeriver;
    private final AggregationConfig config;
    private final ObservabilityMetrics metrics;

    @Inject
    public AlertIngestionService(AggregationStore aggregationStore, GoogleGeocodingClient geocodingClient,
            BucketKeyDeriver bucketKeyDeriver, AggregationConfig config, ObservabilityMetrics metrics) {
        this.aggregationStore = aggregationStore;
        this.geocodingClient = geocodingClient;
        this.bucketKeyDeriver = bucketKeyDeriver;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Ingests a form using the current time as the default timestamp.
     */
    public IngestionResult ingest(String recordId, AlertFormType form) {
        return ingest(recordId, form, System.currentTimeMillis());
    }

    /**
     * Ingests a form.
     *
     * @param recordId
     *            unique alert id (the form id)
     * @param form
     *            submitted form
     * @param nowMillis
     *            ingestion time, used when the form carries no timestamp
     * @return the outcome
     */
    public IngestionResult ingest(String recordId, AlertFormType form, long nowMillis) {
        Optional<CriticalWeatherPhenomenon> phenomenon = CriticalWeatherPhenomenon
                .fromValue(form.criticalWeatherPhenomenon());
        LoggingConfig.setAlertContext(recordId, phenomenon.map(Enum::name).orElse(null));
        try {
            IngestionResult result = doIngest(recordId, form, phenomenon, nowMillis);
            metrics.recordIngestion(result.outcome().name());
            return result;
        } finally {
            LoggingConfig.clearAlertContext();
        }
    }

    private IngestionResult doIngest(String recordId, AlertFormType form,
            Optional<CriticalWeatherPhenomenon> resolved, long nowMillis) {
        if (resolved.isEmpty()) {
            LOG.warnf("Dropping alert %s: missing or unknown phenomenon '%s'", recordId,
                    form.criticalWeatherPhenomenon());
            return IngestionResult.dropped(IngestionOutcome.DROPPED_INVALID, null);
        }
        String phenomenon = resolved.get().name();

        if (!StorePaths.isValidSegment(recordId)) {
            LOG.warnf("Dropping alert: record id '%s' is not a valid key", recordId);
            return IngestionResult.dropped(IngestionOutcome.DROPPED_INVALID, phenomenon);
        }
        if (!isValidLocation(form.location())) {
            LOG.warnf("Dropping alert %s: missing or out-of-range location %s", recordId, form.location());
            return IngestionResult.dropped(IngestionOutcome.DROPPED_INVALID, phenomenon);
        }

        Optional<String> existingBucket = aggregationStore.findBucketOfMember(phenomenon, recordId);
        if (existingBucket.isPresent()) {
            LOG.infof("Alert %s already aggregated in %s/%s", recordId, phenomenon, existingBucket.get());
            return new IngestionResult(IngestionOutcome.DUPLICATE, phenomenon, existingBucket.get(), null);
        }

        GeocodeResult place;
        try {
            place = geocodingClient.geocode(form.location().latitude(), form.location().longitude());
        } catch (GeocodingException e) {
            LOG.warnf("Dropping alert %s: geocoding failed: %s", recordId, e.getMessage());
            return IngestionResult.dropped(IngestionOutcome.DROPPED_GEOCODE_FAILED, phenomenon);
        }

        String bucketId = bucketKeyDeriver.derive(place.placeName(), place.bounds());
        long timestamp = form.timestamp() != null ? form.timestamp() : nowMillis;
        AlertRecord record = new AlertRecord(recordId, phenomenon, form.location(), timestamp,
                displayTime(timestamp), form.criticalLevel(), form.message(), form.imageUrl());

        aggregationStore.createBucket(phenomenon, bucketId, place.bounds());
        if (!aggregationStore.addMember(phenomenon, bucketId, place.bounds(), record)) {
            LOG.infof("Alert %s already present in %s/%s", recordId, phenomenon, bucketId);
            return new IngestionResult(IngestionOutcome.DUPLICATE, phenomenon, bucketId, place.placeName());
        }

        LOG.infof("Aggregated alert %s into %s/%s (%s)", recordId, phenomenon, bucketId, place.placeName());
        return new IngestionResult(IngestionOutcome.AGGREGATED, phenomenon, bucketId, place.placeName());
    }

    private String displayTime(long timestamp) {
        return DISPLAY_TIME.format(Instant.ofEpochMilli(timestamp).atZone(config.displayZone()));
    }

    private static boolean isValidLocation(LocationType location) {
        if (location == null || location.latitude() == null || location.longitude() == null) {
            return false;
        }
        double lat = location.latitude();
        double lng = location.longitude();
        return lat >= -90 && lat <= 90 && lng >= -180 && lng <= 180;
    }
}
