package io.scheduler4j.core;

/**
 * Result of an upsert: the id written and whether a new row was inserted.
 */
public record PersistResult(
        String id,
        boolean created,
        boolean updated
) {
    public static PersistResult createdResult(String id) {
        return new PersistResult(id, true, false);
    }

    public static PersistResult updatedResult(String id) {
        return new PersistResult(id, false, true);
    }
}
