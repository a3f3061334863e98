/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.LongNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.api.types.BoundsType;
import villagecompute.weatheralerts.api.types.LocationType;
import villagecompute.weatheralerts.config.AggregationConfig;
import villagecompute.weatheralerts.data.models.AlertRecord;
import villagecompute.weatheralerts.data.models.Bucket;
import villagecompute.weatheralerts.data.store.HierarchicalStore;
import villagecompute.weatheralerts.data.store.StoreOperations;
import villagecompute.weatheralerts.data.store.StorePaths;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.exceptions.ValidationException;

/**
 * Bucket-level CRUD and counter operations over the {@link HierarchicalStore}.
 *
 * <p>
 * Members live under {@code <membersRoot>/<phenomenon>/<bucketId>/members/<recordId>} and the live count under
 * {@code <countsRoot>/<phenomenon>/<bucketId>/counter}. Every mutation that touches both trees runs inside one
 * {@link HierarchicalStore#transaction store transaction}, so {@code counter == |members|} holds for every bucket with
 * no operation in flight. Counters are only changed by {@link StoreOperations#increment} inside those transactions,
 * never by a read followed by a separate write.
 *
 * <p>
 * <b>Error Handling:</b> all operations propagate {@link StoreUnavailableException} when the store cannot be reached,
 * and {@link ValidationException} when a key segment is not a legal path segment.
 *
 * @see AlertIngestionService
 * @see RetentionSweepService
 * @see ManualPurgeService
 */
@ApplicationScoped
public class AggregationStore {

    private static final Logger LOG = Logger.getLogger(AggregationStore.class);

    static final String BOUNDS = "bounds";
    static final String MEMBERS = "members";
    static final String COUNTER = "counter";

    private final HierarchicalStore store;
    private final ObjectMapper objectMapper;
    private final AggregationConfig config;

    @Inject
    public AggregationStore(HierarchicalStore store, ObjectMapper objectMapper, AggregationConfig config) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    public boolean phenomenonExists(String phenomenon) {
        return store.exists(StorePaths.join(config.membersRoot(), phenomenon));
    }

    public boolean bucketExists(String phenomenon, String bucketId) {
        return store.exists(bucketPath(phenomenon, bucketId));
    }

    public boolean memberExists(String phenomenon, String bucketId, String recordId) {
        return store.exists(memberPath(phenomenon, bucketId, recordId));
    }

    /**
     * Creates the bucket with its bounds. Idempotent: an existing bucket keeps the bounds it was created with.
     *
     * @return true if this call created the bucket
     */
    public boolean createBucket(String phenomenon, String bucketId, BoundsType bounds) {
        String boundsPath = StorePaths.child(bucketPath(phenomenon, bucketId), BOUNDS);
        JsonNode boundsNode = objectMapper.valueToTree(bounds);

        boolean created = store.transaction(tx -> {
            if (tx.exists(boundsPath)) {
                return false;
            }
            tx.set(boundsPath, boundsNode);
            return true;
        });
        if (created) {
            LOG.infof("Created bucket %s/%s", phenomenon, bucketId);
        }
        return created;
    }

    /**
     * Inserts a record and increments the bucket counter by one, atomically.
     *
     * <p>
     * Re-adding a record id that is already a member is a no-op: neither the member nor the counter change. If the
     * bucket lost its bounds since {@link #createBucket} (its last member was evicted or purged in between), the bounds
     * are written again in the same transaction, so a bucket with members always has bounds.
     *
     * @return true if the record was added, false if it was already present
     */
    public boolean addMember(String phenomenon, String bucketId, BoundsType bounds, AlertRecord record) {
        String boundsPath = StorePaths.child(bucketPath(phenomenon, bucketId), BOUNDS);
        String memberPath = memberPath(phenomenon, bucketId, record.id());
        String counterPath = counterPath(phenomenon, bucketId);
        JsonNode boundsNode = objectMapper.valueToTree(bounds);
        JsonNode memberNode = objectMapper.valueToTree(StoredAlert.from(record));

        return store.transaction(tx -> {
            if (tx.exists(memberPath)) {
                return false;
            }
            if (!tx.exists(boundsPath)) {
                tx.set(boundsPath, boundsNode);
                LOG.infof("Recreated bucket %s/%s removed before its first member landed", phenomenon, bucketId);
            }
            tx.set(memberPath, memberNode);
            tx.increment(counterPath, 1);
            return true;
        });
    }

    /**
     * Removes a member and decrements the counter, atomically. The bucket (bounds and counter included) is deleted in
     * the same transaction when its last member goes.
     *
     * @return true if the member existed and was removed
     */
    public boolean removeMember(String phenomenon, String bucketId, String recordId) {
        return removeMemberIf(phenomenon, bucketId, recordId, record -> true);
    }

    /**
     * Like {@link #removeMember}, but only removes the member if {@code condition} accepts the record as read inside
     * the transaction.
     *
     * @return true if the member existed, matched and was removed
     */
    public boolean removeMemberIf(String phenomenon, String bucketId, String recordId,
            Predicate<AlertRecord> condition) {
        String bucketPath = bucketPath(phenomenon, bucketId);
        String membersPath = StorePaths.child(bucketPath, MEMBERS);
        String memberPath = StorePaths.child(membersPath, recordId);
        String countsBucketPath = countsBucketPath(phenomenon, bucketId);
        String counterPath = StorePaths.child(countsBucketPath, COUNTER);

        return store.transaction(tx -> {
            Optional<JsonNode> node = tx.get(memberPath);
            if (node.isEmpty()) {
                return false;
            }
            if (!condition.test(toRecord(phenomenon, recordId, node.get()))) {
                return false;
            }

            tx.delete(memberPath);
            long remaining = tx.increment(counterPath, -1);

            if (!tx.exists(membersPath)) {
                tx.delete(bucketPath);
                tx.delete(countsBucketPath);
                LOG.infof("Removed empty bucket %s/%s", phenomenon, bucketId);
            } else if (remaining <= 0) {
                long actual = tx.get(membersPath).map(JsonNode::size).orElse(0);
                LOG.warnf("Counter drift on bucket %s/%s (counter=%d), resetting to %d members", phenomenon, bucketId,
                        remaining, actual);
                tx.set(counterPath, LongNode.valueOf(actual));
            }
            return true;
        });
    }

    /**
     * Deletes a bucket and its counter in one transaction, whatever the member count.
     *
     * @return true if the bucket existed
     */
    public boolean deleteBucket(String phenomenon, String bucketId) {
        String bucketPath = bucketPath(phenomenon, bucketId);
        String countsBucketPath = countsBucketPath(phenomenon, bucketId);

        return store.transaction(tx -> {
            boolean existed = tx.exists(bucketPath);
            tx.delete(bucketPath);
            tx.delete(countsBucketPath);
            return existed;
        });
    }

    /**
     * Deletes a bucket only if it currently has no members, e.g. one left behind by an ingestion interrupted between
     * bucket creation and member insertion.
     *
     * @return true if an empty bucket was deleted
     */
    public boolean deleteBucketIfEmpty(String phenomenon, String bucketId) {
        String bucketPath = bucketPath(phenomenon, bucketId);
        String membersPath = StorePaths.child(bucketPath, MEMBERS);
        String countsBucketPath = countsBucketPath(phenomenon, bucketId);

        return store.transaction(tx -> {
            if (!tx.exists(bucketPath) || tx.exists(membersPath)) {
                return false;
            }
            tx.delete(bucketPath);
            tx.delete(countsBucketPath);
            return true;
        });
    }

    /**
     * Reads one bucket together with its counter.
     */
    public Optional<Bucket> getBucket(String phenomenon, String bucketId) {
        String bucketPath = bucketPath(phenomenon, bucketId);
        String counterPath = counterPath(phenomenon, bucketId);

        return store.transaction(tx -> {
            Optional<JsonNode> bucketNode = tx.get(bucketPath);
            if (bucketNode.isEmpty()) {
                return Optional.<Bucket> empty();
            }
            long counter = tx.get(counterPath).map(JsonNode::asLong).orElse(0L);
            return Optional.of(toBucket(phenomenon, bucketId, bucketNode.get(), counter));
        });
    }

    /**
     * Returns a snapshot of every bucket. Members that cannot be parsed are skipped and logged.
     */
    public List<Bucket> listBuckets() {
        JsonNode[] trees = store.transaction(tx -> new JsonNode[]{tx.get(config.membersRoot()).orElse(null),
                tx.get(config.countsRoot()).orElse(null)});
        JsonNode membersTree = trees[0];
        JsonNode countsTree = trees[1];

        List<Bucket> buckets = new ArrayList<>();
        if (membersTree == null) {
            return buckets;
        }
        Iterator<Map.Entry<String, JsonNode>> phenomena = membersTree.fields();
        while (phenomena.hasNext()) {
            Map.Entry<String, JsonNode> phenomenon = phenomena.next();
            Iterator<Map.Entry<String, JsonNode>> places = phenomenon.getValue().fields();
            while (places.hasNext()) {
                Map.Entry<String, JsonNode> place = places.next();
                long counter = countsTree == null ? 0L
                        : countsTree.path(phenomenon.getKey()).path(place.getKey()).path(COUNTER).asLong(0L);
                buckets.add(toBucket(phenomenon.getKey(), place.getKey(), place.getValue(), counter));
            }
        }
        return buckets;
    }

    /**
     * Finds the bucket, within one phenomenon, that already holds {@code recordId}.
     *
     * @return the bucket id, or empty if no bucket of that phenomenon has the record
     */
    public Optional<String> findBucketOfMember(String phenomenon, String recordId) {
        Optional<JsonNode> phenomenonTree = store.get(StorePaths.join(config.membersRoot(), phenomenon));
        if (phenomenonTree.isEmpty()) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> places = phenomenonTree.get().fields();
        while (places.hasNext()) {
            Map.Entry<String, JsonNode> place = places.next();
            if (place.getValue().path(MEMBERS).has(recordId)) {
                return Optional.of(place.getKey());
            }
        }
        return Optional.empty();
    }

    private Bucket toBucket(String phenomenon, String bucketId, JsonNode bucketNode, long counter) {
        BoundsType bounds = null;
        JsonNode boundsNode = bucketNode.get(BOUNDS);
        if (boundsNode != null) {
            try {
                bounds = objectMapper.convertValue(boundsNode, BoundsType.class);
            } catch (IllegalArgumentException e) {
                LOG.warnf("Unreadable bounds on bucket %s/%s: %s", phenomenon, bucketId, e.getMessage());
            }
        }

        Map<String, AlertRecord> members = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = bucketNode.path(MEMBERS).fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            try {
                members.put(entry.getKey(), toRecord(phenomenon, entry.getKey(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                LOG.warnf("Skipping unreadable member %s in bucket %s/%s: %s", entry.getKey(), phenomenon, bucketId,
                        e.getMessage());
            }
        }
        return new Bucket(phenomenon, bucketId, bounds, members, counter);
    }

    private AlertRecord toRecord(String phenomenon, String recordId, JsonNode node) {
        StoredAlert stored = objectMapper.convertValue(node, StoredAlert.class);
        return new AlertRecord(recordId, phenomenon, stored.location(), stored.timestamp(), stored.time(),
                stored.criticalLevel(), stored.message(), stored.imageUrl());
    }

    private String bucketPath(String phenomenon, String bucketId) {
        return StorePaths.join(config.membersRoot(), phenomenon, bucketId);
    }

    private String memberPath(String phenomenon, String bucketId, String recordId) {
        return StorePaths.join(config.membersRoot(), phenomenon, bucketId, MEMBERS, recordId);
    }

    private String countsBucketPath(String phenomenon, String bucketId) {
        return StorePaths.join(config.countsRoot(), phenomenon, bucketId);
    }

    private String counterPath(String phenomenon, String bucketId) {
        return StorePaths.join(config.countsRoot(), phenomenon, bucketId, COUNTER);
    }

    /**
     * Member document as persisted; the record id and phenomenon are implied by its path.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredAlert(@JsonProperty("location") LocationType location, @JsonProperty("timestamp") Long timestamp,
            @JsonProperty("time") String time, @JsonProperty("imageURL") String imageUrl,
            @JsonProperty("criticalLevel") JsonNode criticalLevel, @JsonProperty("message") String message) {

        static StoredAlert from(AlertRecord record) {
            return new StoredAlert(record.location(), record.timestamp(), record.time(), record.imageUrl(),
                    record.criticalLevel(), record.message());
        }
    }
}
