package dev.bbengine;

import java.util.Collection;

/**
 * Precondition helpers for configuration input; each throws
 * {@link Errors.SystemLoadError} on failure.
 */
public final class Validation {

    private Validation() {}

    /**
     * Require that a string is not empty.
     */
    public static void requireNotEmpty(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new Errors.SystemLoadError(fieldName + " must not be empty");
        }
    }

    /**
     * Require that a collection is not empty.
     */
    public static void requireNotEmpty(Collection<?> collection, String fieldName) {
        if (collection == null || collection.isEmpty()) {
            throw new Errors.SystemLoadError(fieldName + " must not be empty");
        }
    }

    /**
     * Require that a condition about the input holds.
     */
    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new Errors.SystemLoadError(message);
        }
    }
}
