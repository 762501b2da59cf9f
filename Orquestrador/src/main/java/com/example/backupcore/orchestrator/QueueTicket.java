package com.example.backupcore.orchestrator;

import com.example.backupcore.model.BackupTypes.StorageType;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Pedido de backup que entrou na fila por falta de slot. O id ({@code queue-<uuid>}) não é
 * id de job; quando despachado, {@link #jobId()} aponta para o job real.
 */
public final class QueueTicket {

    public static final String PREFIX = "queue-";

    public enum State { QUEUED, DISPATCHED, CANCELLED, REJECTED }

    private final String id;
    private final StorageType storageType;
    private final State state;
    private final String jobId;
    private final Instant createdAt;

    QueueTicket(String id, StorageType storageType, State state, String jobId, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.storageType = Objects.requireNonNull(storageType, "storageType");
        this.state = Objects.requireNonNull(state, "state");
        this.jobId = jobId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public static boolean isTicketId(String id) {
        return id != null && id.startsWith(PREFIX);
    }

    public String id() { return id; }
    public StorageType storageType() { return storageType; }
    public State state() { return state; }
    public Optional<String> jobId() { return Optional.ofNullable(jobId); }
    public Instant createdAt() { return createdAt; }

    QueueTicket dispatched(String newJobId) {
        return new QueueTicket(id, storageType, State.DISPATCHED, newJobId, createdAt);
    }

    QueueTicket withState(State newState) {
        return new QueueTicket(id, storageType, newState, jobId, createdAt);
    }

    @Override
    public String toString() {
        return "QueueTicket{id=" + id + ", storageType=" + storageType.id() + ", state=" + state
                + (jobId != null ? ", jobId=" + jobId : "") + "}";
    }
}
