/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.SweepResultType;
import villagecompute.weatheralerts.config.AggregationConfig;
import villagecompute.weatheralerts.data.models.AlertRecord;
import villagecompute.weatheralerts.data.models.Bucket;
import villagecompute.weatheralerts.data.store.HierarchicalStore;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.observability.ObservabilityMetrics;

/**
 * Evicts bucket members older than the retention window.
 *
 * <p>
 * A sweep works from a single snapshot of all buckets. Each expired member is removed with a conditional
 * {@link AggregationStore#removeMemberIf} that re-checks expiry on the member as read inside the removal transaction,
 * so members added after the snapshot are never touched and a member purged concurrently is simply skipped. Removing
 * the last member deletes its bucket. Buckets that were already empty in the snapshot (a create whose add never
 * landed) are removed if they are still empty.
 *
 * <p>
 * A failure on one member is logged and counted; the sweep continues with the next one. When the sweep completes its
 * wall-clock time (epoch seconds) and eviction count are published as metrics and written to the store under
 * {@code lastCleanupTimestamp} and {@code lastNumOfDeletedAlerts}.
 */
@ApplicationScoped
public class RetentionSweepService {

    private static final Logger LOG = Logger.getLogger(RetentionSweepService.class);

    private final AggregationStore aggregationStore;
    private final HierarchicalStore store;
    private final AggregationConfig config;
    private final ObservabilityMetrics metrics;

    @Inject
    public RetentionSweepService(AggregationStore aggregationStore, HierarchicalStore store,
            AggregationConfig config, ObservabilityMetrics metrics) {
        this.aggregationStore = aggregationStore;
        this.store = store;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Runs a sweep against the current wall-clock time.
     */
    public SweepResultType sweep() {
        return sweep(System.currentTimeMillis());
    }

    /**
     * Runs a sweep treating {@code nowMillis} as the current time.
     *
     * @throws StoreUnavailableException
     *             if the bucket snapshot cannot be read
     */
    public SweepResultType sweep(long nowMillis) {
        long started = System.nanoTime();
        long window = config.retentionWindowMillis();

        List<Bucket> buckets = aggregationStore.listBuckets();
        int deleted = 0;
        int bucketsRemoved = 0;
        int failures = 0;

        for (Bucket bucket : buckets) {
            if (bucket.isEmpty()) {
                if (removeOrphan(bucket)) {
                    bucketsRemoved++;
                }
                continue;
            }

            int deletedHere = 0;
            for (Map.Entry<String, AlertRecord> member : bucket.members().entrySet()) {
                if (!member.getValue().isExpired(nowMillis, window)) {
                    continue;
                }
                try {
                    if (aggregationStore.removeMemberIf(bucket.phenomenon(), bucket.bucketId(), member.getKey(),
                            current -> current.isExpired(nowMillis, window))) {
                        deletedHere++;
                    }
                } catch (RuntimeException e) {
                    failures++;
                    LOG.errorf(e, "Failed to evict alert %s from %s/%s (continuing)", member.getKey(),
                            bucket.phenomenon(), bucket.bucketId());
                }
            }

            deleted += deletedHere;
            if (deletedHere > 0 && deletedHere == bucket.members().size()
                    && !aggregationStore.bucketExists(bucket.phenomenon(), bucket.bucketId())) {
                bucketsRemoved++;
                LOG.debugf("Bucket %s/%s emptied by sweep", bucket.phenomenon(), bucket.bucketId());
            }
        }

        long sweptAtSeconds = nowMillis / 1000;
        persistStats(nowMillis, deleted);
        metrics.recordSweep(sweptAtSeconds, deleted, failures, System.nanoTime() - started);

        LOG.infof("Retention sweep completed: %d buckets scanned, %d alerts deleted, %d buckets removed, %d failures",
                buckets.size(), deleted, bucketsRemoved, failures);
        return new SweepResultType(sweptAtSeconds, buckets.size(), deleted, bucketsRemoved, failures);
    }

    private boolean removeOrphan(Bucket bucket) {
        try {
            boolean removed = aggregationStore.deleteBucketIfEmpty(bucket.phenomenon(), bucket.bucketId());
            if (removed) {
                LOG.infof("Removed empty bucket %s/%s", bucket.phenomenon(), bucket.bucketId());
            }
            return removed;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to remove empty bucket %s/%s (continuing)", bucket.phenomenon(), bucket.bucketId());
            return false;
        }
    }

    private void persistStats(long nowMillis, int deleted) {
        try {
            store.transaction(ops -> {
                ops.set(config.lastCleanupKey(), DoubleNode.valueOf(nowMillis / 1000.0));
                ops.set(config.lastDeletedKey(), LongNode.valueOf(deleted));
                return null;
            });
        } catch (StoreUnavailableException e) {
            LOG.warnf("Could not record sweep statistics: %s", e.getMessage());
        }
    }
}
