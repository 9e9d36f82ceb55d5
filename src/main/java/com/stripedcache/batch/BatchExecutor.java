package com.stripedcache.batch;

import com.stripedcache.cache.Cache;
import com.stripedcache.cache.CapacityExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies batches to a cache one operation at a time.
 *
 * Every operation goes through the cache's single-key API, so each one takes only the
 * lock of the shard owning its key and no lock is held across operations. An operation
 * that throws is reported as a failed result and the rest of the batch still runs.
 */
public class BatchExecutor<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(BatchExecutor.class);

    private final Cache<K, V> cache;

    public BatchExecutor(Cache<K, V> cache) {
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public BatchResult<K, V> apply(List<BatchOperation<K, V>> operations) {
        Objects.requireNonNull(operations, "operations");
        List<OperationResult<K, V>> results = new ArrayList<>(operations.size());

        for (BatchOperation<K, V> operation : operations) {
            results.add(applyOne(operation));
        }

        BatchResult<K, V> result = new BatchResult<>(results);
        if (result.allSucceeded()) {
            logger.debug("Applied batch: {}", result);
        } else {
            logger.info("Applied batch with failures: {}", result);
        }
        return result;
    }

    private OperationResult<K, V> applyOne(BatchOperation<K, V> operation) {
        K key = operation.getKey();
        try {
            switch (operation.getType()) {
                case INSERT:
                    V previous = operation.getTtl() == null
                            ? cache.insert(key, operation.getValue())
                            : cache.insertWithTtl(key, operation.getValue(), operation.getTtl());
                    return OperationResult.success(OperationType.INSERT, key, previous);

                case REMOVE:
                    return OperationResult.success(OperationType.REMOVE, key, cache.remove(key));

                case GET:
                    return OperationResult.success(OperationType.GET, key, cache.get(key));

                default:
                    throw new IllegalStateException("Unknown operation type: " + operation.getType());
            }
        } catch (CapacityExceededException e) {
            return OperationResult.failure(operation.getType(), key, e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Batch operation {} failed", operation, e);
            return OperationResult.failure(operation.getType(), key,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
