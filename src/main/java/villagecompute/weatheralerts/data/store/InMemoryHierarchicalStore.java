/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weatheralerts.data.store;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weatheralerts.exceptions.StoreUnavailableException;
import villagecompute.weatheralerts.exceptions.ValidationException;

/**
 * Process-local {@link HierarchicalStore} backed by a Jackson {@link ObjectNode} tree.
 *
 * <p>
 * <b>Concurrency:</b> reads take the shared side of a {@link ReentrantReadWriteLock}, writes and transactions take the
 * exclusive side. Every acquisition waits at most {@code alerts.store.timeout-millis}; a timeout or interrupt surfaces
 * as {@link StoreUnavailableException}. The lock is reentrant, so a transaction's work function may call the public
 * operations on the view it receives.
 *
 * <p>
 * <b>Rollback:</b> while a transaction is open, each mutation pushes an undo action onto a journal. If the work
 * function throws, the journal is replayed newest-first, restoring the tree exactly.
 *
 * <p>
 * <b>Configuration:</b>
 * <ul>
 * <li>{@code alerts.store.timeout-millis} - bounded wait for the store lock (default 5000)</li>
 * </ul>
 */
@ApplicationScoped
public class InMemoryHierarchicalStore implements HierarchicalStore {

    private static final Logger LOG = Logger.getLogger(InMemoryHierarchicalStore.class);

    private final ObjectNode root;
    private final long timeoutMillis;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Undo actions of the open transaction; only touched by the thread holding the write lock. */
    private Deque<Runnable> journal;

    @Inject
    public InMemoryHierarchicalStore(ObjectMapper objectMapper, @ConfigProperty(
            name = "alerts.store.timeout-millis",
            defaultValue = "5000") long timeoutMillis) {
        this.root = objectMapper.createObjectNode();
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public Optional<JsonNode> get(String path) {
        List<String> segments = StorePaths.split(path);
        Lock readLock = acquire(lock.readLock());
        try {
            JsonNode node = find(segments, segments.size());
            return node == null ? Optional.empty() : Optional.of(node.deepCopy());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean exists(String path) {
        List<String> segments = StorePaths.split(path);
        Lock readLock = acquire(lock.readLock());
        try {
            return find(segments, segments.size()) != null;
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void set(String path, JsonNode value) {
        List<String> segments = requireNonRoot(path);
        Lock writeLock = acquire(lock.writeLock());
        try {
            if (isAbsentValue(value)) {
                deleteLocked(segments);
            } else {
                setLocked(segments, value.deepCopy());
            }
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void delete(String path) {
        List<String> segments = requireNonRoot(path);
        Lock writeLock = acquire(lock.writeLock());
        try {
            deleteLocked(segments);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public long increment(String path, long delta) {
        List<String> segments = requireNonRoot(path);
        Lock writeLock = acquire(lock.writeLock());
        try {
            JsonNode current = find(segments, segments.size());
            if (current != null && !current.isNumber()) {
                throw new ValidationException("Cannot increment non-numeric value at " + path);
            }
            long updated = (current == null ? 0L : current.asLong()) + delta;
            setLocked(segments, LongNode.valueOf(updated));
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public <T> T transaction(Function<StoreOperations, T> work) {
        Lock writeLock = acquire(lock.writeLock());
        boolean outermost = journal == null;
        if (outermost) {
            journal = new ArrayDeque<>();
        }
        try {
            T result = work.apply(this);
            if (outermost) {
                journal = null;
            }
            return result;
        } catch (RuntimeException e) {
            if (outermost) {
                int undone = journal.size();
                while (!journal.isEmpty()) {
                    journal.pop().run();
                }
                journal = null;
                LOG.debugf("Rolled back %d store writes after transaction failure", undone);
            }
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private Lock acquire(Lock target) {
        try {
            if (!target.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new StoreUnavailableException("Timed out after " + timeoutMillis + " ms waiting for store");
            }
            return target;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for store", e);
        }
    }

    /**
     * Walks the first {@code depth} segments from the root.
     *
     * @return the node, or null if any step is missing or passes through a non-object
     */
    private JsonNode find(List<String> segments, int depth) {
        JsonNode node = root;
        for (int i = 0; i < depth; i++) {
            if (!(node instanceof ObjectNode)) {
                return null;
            }
            node = node.get(segments.get(i));
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private void setLocked(List<String> segments, JsonNode value) {
        recordUndo(segments, firstChangedDepth(segments));

        ObjectNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = parent.get(segments.get(i));
            if (!(child instanceof ObjectNode)) {
                child = parent.putObject(segments.get(i));
            }
            parent = (ObjectNode) child;
        }
        parent.set(segments.get(segments.size() - 1), value);
    }

    private void deleteLocked(List<String> segments) {
        JsonNode parent = find(segments, segments.size() - 1);
        String leaf = segments.get(segments.size() - 1);
        if (!(parent instanceof ObjectNode) || !parent.has(leaf)) {
            return;
        }
        recordUndo(segments, segments.size());
        ((ObjectNode) parent).remove(leaf);

        // Prune ancestors left without children
        for (int depth = segments.size() - 1; depth > 0; depth--) {
            JsonNode ancestor = find(segments, depth);
            if (ancestor == null || ancestor.size() > 0) {
                break;
            }
            ((ObjectNode) find(segments, depth - 1)).remove(segments.get(depth - 1));
        }
    }

    /**
     * Returns the depth (1-based) of the first node a set on {@code segments} would create or replace: either a missing
     * or non-object intermediate, or the leaf itself.
     */
    private int firstChangedDepth(List<String> segments) {
        JsonNode node = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            node = node.get(segments.get(i));
            if (!(node instanceof ObjectNode)) {
                return i + 1;
            }
        }
        return segments.size();
    }

    private void recordUndo(List<String> segments, int depth) {
        if (journal == null) {
            return;
        }
        List<String> changed = List.copyOf(segments.subList(0, depth));
        JsonNode previous = find(changed, changed.size());
        JsonNode saved = previous == null ? null : previous.deepCopy();
        journal.push(() -> {
            if (saved == null) {
                deleteRaw(changed);
            } else {
                setRaw(changed, saved);
            }
        });
    }

    private void setRaw(List<String> segments, JsonNode value) {
        ObjectNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = parent.get(segments.get(i));
            if (!(child instanceof ObjectNode)) {
                child = parent.putObject(segments.get(i));
            }
            parent = (ObjectNode) child;
        }
        parent.set(segments.get(segments.size() - 1), value);
    }

    private void deleteRaw(List<String> segments) {
        Deque<Runnable> suspended = journal;
        journal = null;
        try {
            deleteLocked(segments);
        } finally {
            journal = suspended;
        }
    }

    private static boolean isAbsentValue(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode() || (value.isObject() && value.size() == 0);
    }

    private static List<String> requireNonRoot(String path) {
        List<String> segments = StorePaths.split(path);
        if (segments.isEmpty()) {
            throw new ValidationException("The store root cannot be written directly");
        }
        return segments;
    }
}
