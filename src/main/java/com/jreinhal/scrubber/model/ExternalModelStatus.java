package com.jreinhal.scrubber.model;

/**
 * How the external recognition model took part in an operation.
 * DEGRADED means it was enabled but failed, timed out or was short-circuited,
 * so confidences are rule-only.
 */
public enum ExternalModelStatus {
    DISABLED,
    CONTRIBUTED,
    DEGRADED
}
