package com.negotiationplatform.common.model;

/**
 * Importance of a single {@link Need} to the party that holds it.
 * CRITICAL needs become red lines in a concession plan and are never traded.
 */
public enum Priority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
