package io.tiermesh.error;

public final class NoHealthyEndpointException extends TierMeshException {
    public NoHealthyEndpointException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "no_healthy_endpoint";
    }
}
