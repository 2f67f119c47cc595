package io.taskrelay.sync;

import io.taskrelay.model.AgentState;
import io.taskrelay.model.Task;
import io.taskrelay.model.WorkRequest;
import io.taskrelay.store.StateStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered record of the writes made while one message is processed, kept until the message is
 * resolved. {@link #rollback(StateStore)} undoes the writes newest first.
 * <p>
 * The ledger also holds the consuming agent's state as it was when processing began; after the
 * entries are undone the agent is checked against it and restored if anything still differs.
 */
public final class ChangeLedger {

    private static final Logger log = LoggerFactory.getLogger(ChangeLedger.class);

    private final String agentId;
    private final AgentState agentAtEntry;
    private final List<LedgerEntry> entries = new ArrayList<>();

    public ChangeLedger(String agentId, AgentState agentAtEntry) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.agentAtEntry = agentAtEntry;
    }

    public void record(EntityType type, String entityId, Object priorSnapshot) {
        entries.add(new LedgerEntry(type, entityId, priorSnapshot));
    }

    public List<LedgerEntry> entries() {
        return List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Undoes every recorded write in reverse order. An entry that fails to undo is logged and
     * skipped so the remaining entries still get their chance.
     *
     * @return the entries that could not be undone
     */
    public List<LedgerEntry> rollback(StateStore store) {
        List<LedgerEntry> failed = new ArrayList<>();
        for (int i = entries.size() - 1; i >= 0; i--) {
            LedgerEntry entry = entries.get(i);
            try {
                undo(store, entry);
            } catch (RuntimeException e) {
                log.error("Rollback of {} '{}' failed: {}", entry.entityType(), entry.entityId(), e.getMessage(), e);
                failed.add(entry);
            }
        }
        try {
            restoreAgentIfTouched(store);
        } catch (RuntimeException e) {
            log.error("Restoring agent '{}' to its entry snapshot failed: {}", agentId, e.getMessage(), e);
            failed.add(new LedgerEntry(EntityType.AGENT_STATE, agentId, agentAtEntry));
        }
        entries.clear();
        return List.copyOf(failed);
    }

    private void restoreAgentIfTouched(StateStore store) {
        boolean touched = entries.stream()
            .anyMatch(entry -> entry.entityType() == EntityType.AGENT_STATE && entry.entityId().equals(agentId));
        if (!touched) {
            return;
        }
        AgentState current = store.getAgentState(agentId).orElse(null);
        if (agentAtEntry == null) {
            if (current != null) {
                store.deleteAgentState(agentId);
            }
        } else if (!agentAtEntry.equals(current)) {
            store.restoreAgentState(agentAtEntry);
        }
    }

    private static void undo(StateStore store, LedgerEntry entry) {
        switch (entry.entityType()) {
            case TASK -> {
                if (entry.created()) {
                    store.deleteTask(entry.entityId());
                } else {
                    store.restoreTask((Task) entry.priorSnapshot());
                }
            }
            case AGENT_STATE -> {
                if (entry.created()) {
                    store.deleteAgentState(entry.entityId());
                } else {
                    store.restoreAgentState((AgentState) entry.priorSnapshot());
                }
            }
            case ACTIVITY -> store.deleteActivity(Long.parseLong(entry.entityId()));
            case WORK_REQUEST -> {
                if (entry.created()) {
                    store.deleteWorkRequest(entry.entityId());
                } else {
                    store.restoreWorkRequest((WorkRequest) entry.priorSnapshot());
                }
            }
            default -> throw new IllegalStateException("Unhandled entity type " + entry.entityType());
        }
    }
}
