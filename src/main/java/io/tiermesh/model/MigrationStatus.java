package io.tiermesh.model;

public enum MigrationStatus {
    PENDING,
    TRANSFERRING,
    VERIFYING,
    COMMITTING,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
