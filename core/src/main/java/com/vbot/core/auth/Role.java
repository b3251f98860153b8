package com.vbot.core.auth;

/**
 * Effective privilege of a user, strongest first.
 */
public enum Role {
    OWNER("Owner"),
    DEVELOPER("Founder"),
    CHAT_ADMIN("Admin"),
    PUBLIC("Member");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    // Owner and developers are privileged everywhere, chat admins only in their chat
    public boolean isGlobal() {
        return this == OWNER || this == DEVELOPER;
    }
}
