package personal.salon.sync.ledger.domain.model;

/**
 * Sync Log Status
 */
public enum SyncStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
