package io.tiermesh.error;

public final class NotFoundException extends TierMeshException {
    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "not_found";
    }
}
