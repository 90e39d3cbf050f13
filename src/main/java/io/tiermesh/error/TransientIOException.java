package io.tiermesh.error;

public final class TransientIOException extends TierMeshException {
    public TransientIOException(String message) {
        super(message);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "transient_io";
    }
}
