package io.tiermesh.migration;

public record RecordFailure(
        String recordId,
        String kind,
        String message
) {
}
