package io.tiermesh.error;

public final class AlreadyRunningException extends TierMeshException {
    private final String pairKey;
    private final String activeJobId;

    public AlreadyRunningException(String pairKey, String activeJobId) {
        super("Migration already active for " + pairKey + (activeJobId == null ? "" : ": " + activeJobId));
        this.pairKey = pairKey;
        this.activeJobId = activeJobId;
    }

    public String pairKey() {
        return pairKey;
    }

    public String activeJobId() {
        return activeJobId;
    }

    @Override
    public String kind() {
        return "already_running";
    }
}
