/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.data.store;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Primitive read/write operations on a hierarchical JSON store.
 *
 * <p>
 * Paths are slash-separated (see {@link StorePaths}). A node exists only while it holds a value: writing {@code null}
 * or an empty object deletes it, and removing the last child of a node removes that node as well.
 */
public interface StoreOperations {

    /**
     * Returns a detached copy of the value at {@code path}.
     */
    Optional<JsonNode> get(String path);

    boolean exists(String path);

    /**
     * Replaces the value at {@code path}, creating intermediate nodes as needed.
     */
    void set(String path, JsonNode value);

    /**
     * Removes the value at {@code path}. Removing a missing path is a no-op.
     */
    void delete(String path);

    /**
     * Adds {@code delta} to the numeric value at {@code path} (missing counts as zero) and returns the new value.
     */
    long increment(String path, long delta);
}
