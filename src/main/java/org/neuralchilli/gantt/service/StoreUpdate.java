package org.neuralchilli.gantt.service;

import org.neuralchilli.gantt.domain.ProjectSnapshot;

/**
 * Outcome of an operation run inside {@link ProjectStore#update}: the snapshot
 * to write back (null for read-only outcomes) and the value returned to the caller.
 */
public record StoreUpdate<T>(
        ProjectSnapshot snapshot,
        T result
) {

    public static <T> StoreUpdate<T> write(ProjectSnapshot snapshot, T result) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot to write cannot be null");
        }
        return new StoreUpdate<>(snapshot, result);
    }

    public static <T> StoreUpdate<T> readOnly(T result) {
        return new StoreUpdate<>(null, result);
    }

    public boolean hasChanges() {
        return snapshot != null;
    }
}
