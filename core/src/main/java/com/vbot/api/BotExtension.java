package com.vbot.api;

import com.vbot.core.Kernel;

import java.util.Collection;
import java.util.List;

/**
 * An independently loaded unit of command handlers, discovered through
 * {@link java.util.ServiceLoader}.
 */
public interface BotExtension {
    // Name of the extension (e.g. "Ping"), used as its id and in the plugins config map
    String getName();

    // Version (e.g. "1.0.0")
    String getVersion();

    // Called once at load time. May register transport listeners, services or handlers.
    default void onEnable(Kernel kernel) throws Exception {
    }

    /**
     * Command names this extension claims. Read only after {@link #onEnable(Kernel)}
     * succeeded; every name is routed to {@link #handleCommand(CommandRequest)}.
     */
    default Collection<String> getCommands() {
        return List.of();
    }

    default void handleCommand(CommandRequest request) throws Exception {
        throw new UnsupportedOperationException(getName() + " declares commands but does not handle them");
    }

    // Called on shutdown (cleanup).
    default void onDisable() {
    }
}
