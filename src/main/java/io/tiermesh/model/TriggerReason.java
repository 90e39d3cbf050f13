package io.tiermesh.model;

public enum TriggerReason {
    QUOTA,
    AGE,
    MANUAL
}
