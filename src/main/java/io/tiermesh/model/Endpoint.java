package io.tiermesh.model;

public record Endpoint(
        String id,
        String address,
        String healthUrl
) {
}
