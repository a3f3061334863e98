/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static villagecompute.weatheralerts.TestConstants.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.LongNode;

import villagecompute.weatheralerts.TestFixtures;
import villagecompute.weatheralerts.config.AggregationConfig;
import villagecompute.weatheralerts.data.models.AlertRecord;
import villagecompute.weatheralerts.data.models.Bucket;
import villagecompute.weatheralerts.data.store.InMemoryHierarchicalStore;

/**
 * Unit tests for {@link AggregationStore} over an in-memory store.
 */
class AggregationStoreTest {

    private static final String FLOOD = "FLOOD";

    private InMemoryHierarchicalStore store;
    private AggregationStore aggregationStore;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        store = new InMemoryHierarchicalStore(objectMapper, 5000);
        aggregationStore = new AggregationStore(store, objectMapper, AggregationConfig.defaults());
    }

    @Test
    void testCreateBucket_idempotentKeepsOriginalBounds() {
        assertTrue(aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds()));
        assertFalse(aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.pagratiBounds()));

        Bucket bucket = aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow();
        assertEquals(TestFixtures.kolonakiBounds(), bucket.bounds());
        assertTrue(bucket.isEmpty());
        assertEquals(0, bucket.counter());
    }

    @Test
    void testAddMember_incrementsCounter() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());

        assertTrue(aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS)));
        assertTrue(aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a2", NOW_MILLIS)));

        Bucket bucket = aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow();
        assertEquals(2, bucket.counter());
        assertEquals(2, bucket.members().size());
        assertEquals(TEST_MESSAGE, bucket.members().get("a1").message());
        assertEquals(3, bucket.members().get("a1").criticalLevel().asInt());
    }

    @Test
    void testAddMember_duplicateIsNoOp() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        AlertRecord record = TestFixtures.floodRecord("a1", NOW_MILLIS);

        assertTrue(aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(), record));
        assertFalse(aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(), record));

        assertEquals(1, aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow().counter());
    }

    @Test
    void testAddMember_restoresBoundsOfBucketEmptiedAfterCreate() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("old", NOW_MILLIS));

        // Ingestion of "new" finds the bucket present, then the sweeper evicts its last member
        assertFalse(aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds()));
        assertTrue(aggregationStore.removeMember(FLOOD, KOLONAKI_BUCKET_ID, "old"));
        assertFalse(aggregationStore.bucketExists(FLOOD, KOLONAKI_BUCKET_ID));

        assertTrue(aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("new", NOW_MILLIS)));

        Bucket bucket = aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow();
        assertEquals(TestFixtures.kolonakiBounds(), bucket.bounds());
        assertEquals(1, bucket.counter());
        assertEquals(List.of("new"), List.copyOf(bucket.members().keySet()));
    }

    @Test
    void testAddMember_keepsExistingBounds() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());

        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.pagratiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));

        assertEquals(TestFixtures.kolonakiBounds(),
                aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow().bounds());
    }

    @Test
    void testStoredLayout() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));

        assertTrue(store.exists("aggregation/FLOOD/" + KOLONAKI_BUCKET_ID + "/bounds/northeast"));
        assertEquals(NOW_MILLIS,
                store.get("aggregation/FLOOD/" + KOLONAKI_BUCKET_ID + "/members/a1/timestamp").orElseThrow().asLong());
        assertEquals(TEST_IMAGE_URL,
                store.get("aggregation/FLOOD/" + KOLONAKI_BUCKET_ID + "/members/a1/imageURL").orElseThrow().asText());
        assertEquals(1, store.get("aggregationCounts/FLOOD/" + KOLONAKI_BUCKET_ID + "/counter").orElseThrow().asLong());
    }

    @Test
    void testRemoveMember_decrementsAndDeletesEmptyBucket() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a2", NOW_MILLIS));

        assertTrue(aggregationStore.removeMember(FLOOD, KOLONAKI_BUCKET_ID, "a1"));
        assertEquals(1, aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow().counter());

        assertTrue(aggregationStore.removeMember(FLOOD, KOLONAKI_BUCKET_ID, "a2"));
        assertFalse(aggregationStore.bucketExists(FLOOD, KOLONAKI_BUCKET_ID));
        assertFalse(store.exists("aggregationCounts/FLOOD/" + KOLONAKI_BUCKET_ID));
        assertFalse(aggregationStore.phenomenonExists(FLOOD));
    }

    @Test
    void testRemoveMember_missingReturnsFalse() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));

        assertFalse(aggregationStore.removeMember(FLOOD, KOLONAKI_BUCKET_ID, "nope"));
        assertEquals(1, aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow().counter());
    }

    @Test
    void testRemoveMemberIf_predicateRejects() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));

        assertFalse(aggregationStore.removeMemberIf(FLOOD, KOLONAKI_BUCKET_ID, "a1", r -> false));
        assertTrue(aggregationStore.memberExists(FLOOD, KOLONAKI_BUCKET_ID, "a1"));
    }

    @Test
    void testRemoveMember_repairsDriftedCounter() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a2", NOW_MILLIS));
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a3", NOW_MILLIS));
        store.set("aggregationCounts/FLOOD/" + KOLONAKI_BUCKET_ID + "/counter", LongNode.valueOf(1));

        aggregationStore.removeMember(FLOOD, KOLONAKI_BUCKET_ID, "a1");

        assertEquals(2, aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow().counter());
    }

    @Test
    void testDeleteBucket() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));

        assertTrue(aggregationStore.deleteBucket(FLOOD, KOLONAKI_BUCKET_ID));
        assertFalse(aggregationStore.bucketExists(FLOOD, KOLONAKI_BUCKET_ID));
        assertFalse(store.exists("aggregationCounts/FLOOD/" + KOLONAKI_BUCKET_ID));
        assertFalse(aggregationStore.deleteBucket(FLOOD, KOLONAKI_BUCKET_ID));
    }

    @Test
    void testDeleteBucketIfEmpty() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.createBucket(FLOOD, PAGRATI_BUCKET_ID, TestFixtures.pagratiBounds());
        aggregationStore.addMember(FLOOD, PAGRATI_BUCKET_ID, TestFixtures.pagratiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));

        assertTrue(aggregationStore.deleteBucketIfEmpty(FLOOD, KOLONAKI_BUCKET_ID));
        assertFalse(aggregationStore.deleteBucketIfEmpty(FLOOD, PAGRATI_BUCKET_ID));
        assertTrue(aggregationStore.bucketExists(FLOOD, PAGRATI_BUCKET_ID));
    }

    @Test
    void testListBuckets_snapshot() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));
        aggregationStore.createBucket("FIRE", PAGRATI_BUCKET_ID, TestFixtures.pagratiBounds());
        aggregationStore.addMember("FIRE", PAGRATI_BUCKET_ID, TestFixtures.pagratiBounds(),
                TestFixtures.record("f1", "FIRE", NOW_MILLIS));
        aggregationStore.addMember("FIRE", PAGRATI_BUCKET_ID, TestFixtures.pagratiBounds(),
                TestFixtures.record("f2", "FIRE", NOW_MILLIS));

        List<Bucket> buckets = aggregationStore.listBuckets();

        assertEquals(2, buckets.size());
        for (Bucket bucket : buckets) {
            assertEquals(bucket.members().size(), bucket.counter());
            assertTrue(bucket.bounds() != null);
        }
    }

    @Test
    void testFindBucketOfMember() {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                TestFixtures.floodRecord("a1", NOW_MILLIS));

        assertEquals(KOLONAKI_BUCKET_ID, aggregationStore.findBucketOfMember(FLOOD, "a1").orElseThrow());
        assertTrue(aggregationStore.findBucketOfMember(FLOOD, "a2").isEmpty());
        assertTrue(aggregationStore.findBucketOfMember("FIRE", "a1").isEmpty());
    }

    @Test
    void testConcurrentAddsKeepCounterExact() throws Exception {
        aggregationStore.createBucket(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String id = "alert-" + (i % 100);
                tasks.add(() -> aggregationStore.addMember(FLOOD, KOLONAKI_BUCKET_ID, TestFixtures.kolonakiBounds(),
                        TestFixtures.floodRecord(id, NOW_MILLIS)));
            }
            int added = 0;
            for (Future<Boolean> result : executor.invokeAll(tasks, 30, TimeUnit.SECONDS)) {
                if (result.get()) {
                    added++;
                }
            }

            Bucket bucket = aggregationStore.getBucket(FLOOD, KOLONAKI_BUCKET_ID).orElseThrow();
            assertEquals(100, added);
            assertEquals(100, bucket.members().size());
            assertEquals(100, bucket.counter());
        } finally {
            executor.shutdownNow();
        }
    }
}
