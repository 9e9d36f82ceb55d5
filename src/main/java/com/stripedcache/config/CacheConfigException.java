package com.stripedcache.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a cache cannot be built from its configuration.
 *
 * Carries every validation problem found, not just the first one. Not recoverable
 * automatically: fix the configuration and build again.
 */
public class CacheConfigException extends Exception {
    private final List<String> errors;

    public CacheConfigException(List<String> errors) {
        super("Cache configuration validation failed:\n" +
                errors.stream()
                        .map(e -> "  - " + e)
                        .collect(Collectors.joining("\n")));
        this.errors = List.copyOf(errors);
    }

    public CacheConfigException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }

    public List<String> getErrors() {
        return errors;
    }
}
