package com.questrail.localtranslate.api;

import java.util.Objects;
import java.util.UUID;

/**
 * TaskId
 * -----------------------------------------------------------------------------
 * Opaque identifier of one logical translation submission.
 *
 * <p>A task keeps the same id across all of its attempts. Callers should treat
 * the value as opaque and compare ids only for equality, typically to ignore
 * events that belong to a superseded task.</p>
 */
public record TaskId(String value)
{
    public TaskId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    /** Generates a fresh, short random id. */
    public static TaskId random() {
        return new TaskId(UUID.randomUUID().toString().substring(0, 8));
    }

    public static TaskId of(String value) {
        return new TaskId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
