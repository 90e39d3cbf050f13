package io.tiermesh.error;

public final class CapacityException extends TierMeshException {
    private final String tierId;
    private final long requiredBytes;
    private final long availableBytes;

    public CapacityException(String tierId, long requiredBytes, long availableBytes) {
        super("Tier " + tierId + " has no room: required=" + requiredBytes + " available=" + availableBytes);
        this.tierId = tierId;
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    public String tierId() {
        return tierId;
    }

    public long requiredBytes() {
        return requiredBytes;
    }

    public long availableBytes() {
        return availableBytes;
    }

    @Override
    public String kind() {
        return "capacity";
    }
}
