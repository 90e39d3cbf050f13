package io.tiermesh.model;

/**
 * Per-record progress inside a migration job. The ordering of the constants is the
 * order a record moves through; {@link #FAILED} can follow any of the first three.
 */
public enum RecordMigrationState {
    SELECTED,
    TRANSFERRED,
    VERIFIED,
    COMMITTED,
    FAILED
}
