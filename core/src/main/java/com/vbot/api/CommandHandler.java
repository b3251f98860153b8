package com.vbot.api;

/**
 * Handles one chat command. Built-in commands and extensions share this interface.
 */
@FunctionalInterface
public interface CommandHandler {
    void handle(CommandRequest request) throws Exception;
}
