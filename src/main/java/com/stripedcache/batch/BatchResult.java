package com.stripedcache.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Per-operation report of a batch, in submission order.
 *
 * A batch is not a transaction: some operations may fail while the rest succeed.
 */
public final class BatchResult<K, V> {
    private final List<OperationResult<K, V>> results;
    private final Map<K, OperationResult<K, V>> byKey;

    BatchResult(List<OperationResult<K, V>> results) {
        this.results = List.copyOf(results);
        Map<K, OperationResult<K, V>> index = new LinkedHashMap<>();
        for (OperationResult<K, V> result : this.results) {
            index.put(result.getKey(), result);
        }
        this.byKey = Collections.unmodifiableMap(index);
    }

    public List<OperationResult<K, V>> getResults() {
        return results;
    }

    /**
     * @return the outcome of the last operation on {@code key}, or null if the batch never touched it
     */
    public OperationResult<K, V> forKey(K key) {
        return byKey.get(key);
    }

    public Map<K, OperationResult<K, V>> byKey() {
        return byKey;
    }

    public List<OperationResult<K, V>> succeeded() {
        return results.stream().filter(OperationResult::isSuccess).collect(Collectors.toList());
    }

    public List<OperationResult<K, V>> failed() {
        return results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
    }

    public int successCount() {
        return (int) results.stream().filter(OperationResult::isSuccess).count();
    }

    public int failureCount() {
        return results.size() - successCount();
    }

    public boolean allSucceeded() {
        return failureCount() == 0;
    }

    public int size() {
        return results.size();
    }

    @Override
    public String toString() {
        return "BatchResult{operations=" + results.size() +
                ", succeeded=" + successCount() +
                ", failed=" + failureCount() + '}';
    }
}
