package io.tiermesh.error;

/**
 * Root of the failure taxonomy. Every subtype is recoverable: by retrying, by the
 * next scheduled cycle or by re-triggering the operation.
 */
public abstract class TierMeshException extends RuntimeException {
    protected TierMeshException(String message) {
        super(message);
    }

    protected TierMeshException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable short name recorded in job results and audit rows.
     */
    public abstract String kind();
}
