/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.data.models.CriticalWeatherPhenomenon;
import villagecompute.weatheralerts.data.store.StorePaths;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.observability.LoggingConfig;
import villagecompute.weatheralerts.observability.ObservabilityMetrics;

/**
 * Operator-initiated removal of a whole bucket or of a single member.
 *
 * <p>
 * Not-found conditions are reported as a {@link PurgeResult}, never thrown. Member removal goes through
 * {@link AggregationStore#removeMember}, so the counter stays equal to the member count and an emptied bucket is
 * deleted along with its counter.
 */
@ApplicationScoped
public class ManualPurgeService {

    private static final Logger LOG = Logger.getLogger(ManualPurgeService.class);

    static final String PHENOMENON_NOT_FOUND = "Phenomenon not found";
    static final String PLACE_NOT_FOUND = "Place not found";
    static final String ALERT_NOT_FOUND = "Alert not found";
    static final String INVALID_KEY = "Invalid key";
    static final String STORE_UNAVAILABLE = "An unexpected error occurred";

    /**
     * Purge outcome categories.
     */
    public enum PurgeStatus {
        PURGED, NOT_FOUND, INVALID, UNAVAILABLE
    }

    /**
     * Outcome of a purge; {@code message} is null on success.
     */
    public record PurgeResult(PurgeStatus status, String message) {

        public boolean success() {
            return status == PurgeStatus.PURGED;
        }

        static PurgeResult purged() {
            return new PurgeResult(PurgeStatus.PURGED, null);
        }
    }

    private final AggregationStore aggregationStore;
    private final ObservabilityMetrics metrics;

    @Inject
    public ManualPurgeService(AggregationStore aggregationStore, ObservabilityMetrics metrics) {
        this.aggregationStore = aggregationStore;
        this.metrics = metrics;
    }

    /**
     * Deletes a bucket and its counter together. Succeeds even if the bucket has no members.
     */
    public PurgeResult purgeBucket(String phenomenon, String bucketId) {
        PurgeResult result = doPurgeBucket(phenomenon, bucketId);
        metrics.recordPurge("bucket", result.status().name());
        return result;
    }

    /**
     * Removes one member and decrements its bucket counter atomically.
     */
    public PurgeResult purgeMember(String phenomenon, String bucketId, String alertId) {
        LoggingConfig.setAlertContext(alertId, phenomenon);
        try {
            PurgeResult result = doPurgeMember(phenomenon, bucketId, alertId);
            metrics.recordPurge("member", result.status().name());
            return result;
        } finally {
            LoggingConfig.clearAlertContext();
        }
    }

    private PurgeResult doPurgeBucket(String rawPhenomenon, String bucketId) {
        if (!StorePaths.isValidSegment(bucketId)) {
            return new PurgeResult(PurgeStatus.INVALID, INVALID_KEY);
        }
        Optional<String> phenomenon = resolvePhenomenon(rawPhenomenon);
        try {
            if (phenomenon.isEmpty()) {
                return new PurgeResult(PurgeStatus.NOT_FOUND, PHENOMENON_NOT_FOUND);
            }
            if (!aggregationStore.deleteBucket(phenomenon.get(), bucketId)) {
                return new PurgeResult(PurgeStatus.NOT_FOUND, PLACE_NOT_FOUND);
            }
        } catch (StoreUnavailableException e) {
            LOG.errorf(e, "Purge of bucket %s/%s failed", rawPhenomenon, bucketId);
            return new PurgeResult(PurgeStatus.UNAVAILABLE, STORE_UNAVAILABLE);
        }
        LOG.infof("Purged bucket %s/%s", phenomenon.get(), bucketId);
        return PurgeResult.purged();
    }

    private PurgeResult doPurgeMember(String rawPhenomenon, String bucketId, String alertId) {
        if (!StorePaths.isValidSegment(bucketId) || !StorePaths.isValidSegment(alertId)) {
            return new PurgeResult(PurgeStatus.INVALID, INVALID_KEY);
        }
        Optional<String> phenomenon = resolvePhenomenon(rawPhenomenon);
        try {
            if (phenomenon.isEmpty()) {
                return new PurgeResult(PurgeStatus.NOT_FOUND, PHENOMENON_NOT_FOUND);
            }
            if (!aggregationStore.bucketExists(phenomenon.get(), bucketId)) {
                return new PurgeResult(PurgeStatus.NOT_FOUND, PLACE_NOT_FOUND);
            }
            if (!aggregationStore.removeMember(phenomenon.get(), bucketId, alertId)) {
                return new PurgeResult(PurgeStatus.NOT_FOUND, ALERT_NOT_FOUND);
            }
        } catch (StoreUnavailableException e) {
            LOG.errorf(e, "Purge of alert %s in %s/%s failed", alertId, rawPhenomenon, bucketId);
            return new PurgeResult(PurgeStatus.UNAVAILABLE, STORE_UNAVAILABLE);
        }
        LOG.infof("Purged alert %s from %s/%s", alertId, phenomenon.get(), bucketId);
        return PurgeResult.purged();
    }

    /**
     * Maps a request value to the stored phenomenon key, if that phenomenon currently has any buckets.
     */
    private Optional<String> resolvePhenomenon(String rawPhenomenon) {
        return CriticalWeatherPhenomenon.fromValue(rawPhenomenon).map(Enum::name)
                .filter(aggregationStore::phenomenonExists);
    }
}
