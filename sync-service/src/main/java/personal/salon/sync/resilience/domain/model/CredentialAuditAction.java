package personal.salon.sync.resilience.domain.model;

public enum CredentialAuditAction {
    CREATE,
    ROTATE,
    DEACTIVATE
}
