package io.taskrelay.sync;

import java.util.Objects;

/**
 * One reversible write: the entity it touched and the value it held before the write.
 * A {@code null} prior snapshot means the write created the entity.
 */
public record LedgerEntry(EntityType entityType, String entityId, Object priorSnapshot) {

    public LedgerEntry {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(entityId, "entityId");
    }

    public boolean created() {
        return priorSnapshot == null;
    }
}
