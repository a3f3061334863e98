/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.data.store;

import java.util.function.Function;

import villagecompute.weatheralerts.exceptions.StoreUnavailableException;

/**
 * Hierarchical key-value store shared by the aggregation engine and other subsystems.
 *
 * <p>
 * Single operations are atomic. {@link #transaction(Function)} groups several operations, possibly on unrelated paths,
 * into one atomic unit: concurrent readers never observe a partial result, and if the work function throws, every write
 * it made is rolled back before the exception propagates.
 *
 * <p>
 * Every call waits a bounded time for the store; on timeout it fails with {@link StoreUnavailableException}.
 */
public interface HierarchicalStore extends StoreOperations {

    /**
     * Runs {@code work} atomically against the store.
     *
     * @param work
     *            function receiving a transactional view of the store; must not retain the view after returning
     * @return the work function's result
     * @throws StoreUnavailableException
     *             if the store cannot be acquired in time
     */
    <T> T transaction(Function<StoreOperations, T> work);
}
