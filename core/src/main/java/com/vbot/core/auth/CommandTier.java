package com.vbot.core.auth;

/**
 * Tier selected by the leading prefix character of a command.
 */
public enum CommandTier {
    DEVELOPER,
    ADMIN,
    PUBLIC,
    NONE
}
