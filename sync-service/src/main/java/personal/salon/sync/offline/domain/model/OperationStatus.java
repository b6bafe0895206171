package personal.salon.sync.offline.domain.model;

/**
 * Queued Operation Status
 * PENDING → PROCESSING → COMPLETED | FAILED
 * FAILED(재시도 남음) → PENDING, PENDING → CANCELLED
 */
public enum OperationStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
}
