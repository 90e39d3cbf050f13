package io.tiermesh.error;

public final class IntegrityException extends TierMeshException {
    private final String recordId;
    private final String expectedChecksum;
    private final String actualChecksum;

    public IntegrityException(String recordId, String expectedChecksum, String actualChecksum) {
        super("Checksum mismatch for record " + recordId + ": expected=" + expectedChecksum + " actual=" + actualChecksum);
        this.recordId = recordId;
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }

    public IntegrityException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
        this.expectedChecksum = null;
        this.actualChecksum = null;
    }

    /**
     * A copy that should exist after a successful write is gone.
     */
    public static IntegrityException missingCopy(String recordId, String tierId) {
        return new IntegrityException(recordId, "Copy of " + recordId + " missing from tier " + tierId, (Throwable) null);
    }

    public String recordId() {
        return recordId;
    }

    public String expectedChecksum() {
        return expectedChecksum;
    }

    public String actualChecksum() {
        return actualChecksum;
    }

    @Override
    public String kind() {
        return "integrity";
    }
}
