package com.vbot.core.plugin;

import com.vbot.api.CommandHandler;

/**
 * Ownership of one normalized command name.
 */
public record CommandRoute(String normalizedName, String ownerId, CommandHandler handler) {
}
