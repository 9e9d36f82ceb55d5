package com.stripedcache.batch;

/**
 * Outcome of one batch operation.
 *
 * For GET the value is the one found (null if absent); for INSERT and REMOVE it is the
 * previous value, if any. A failed operation carries the reason instead.
 */
public final class OperationResult<K, V> {
    private final OperationType type;
    private final K key;
    private final boolean success;
    private final V value;
    private final String error;

    private OperationResult(OperationType type, K key, boolean success, V value, String error) {
        this.type = type;
        this.key = key;
        this.success = success;
        this.value = value;
        this.error = error;
    }

    static <K, V> OperationResult<K, V> success(OperationType type, K key, V value) {
        return new OperationResult<>(type, key, true, value, null);
    }

    static <K, V> OperationResult<K, V> failure(OperationType type, K key, String error) {
        return new OperationResult<>(type, key, false, null, error);
    }

    public OperationType getType() {
        return type;
    }

    public K getKey() {
        return key;
    }

    public boolean isSuccess() {
        return success;
    }

    public V getValue() {
        return value;
    }

    /**
     * @return true for a successful GET that found a value
     */
    public boolean isFound() {
        return success && value != null;
    }

    /**
     * @return failure reason, or null on success
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return success
                ? String.format("OperationResult{%s '%s' ok, value=%s}", type, key, value)
                : String.format("OperationResult{%s '%s' failed: %s}", type, key, error);
    }
}
