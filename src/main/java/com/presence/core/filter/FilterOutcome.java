package com.presence.core.filter;

public enum FilterOutcome {
    CONTINUE,
    TERMINATE
}
