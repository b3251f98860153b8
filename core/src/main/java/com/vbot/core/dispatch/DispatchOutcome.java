package com.vbot.core.dispatch;

public enum DispatchOutcome {
    // Not a command (no known prefix)
    IGNORED,
    DENIED,
    UNKNOWN,
    COMPLETED,
    FAILED
}
