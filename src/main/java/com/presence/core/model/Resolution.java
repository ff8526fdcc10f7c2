package com.presence.core.model;

/**
 * How a tracked turn relates to what the user has brought before.
 */
public enum Resolution {
    RESOLVED,
    RECURRING,
    EVOLVING,
    STUCK
}
