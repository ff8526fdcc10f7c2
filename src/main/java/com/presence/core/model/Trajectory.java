package com.presence.core.model;

/**
 * Direction of a user's recent reflective work, computed over the profile window.
 */
public enum Trajectory {
    EXPANDING,
    DEEPENING,
    INTEGRATING,
    CYCLING
}
