package com.vbot.api;

/**
 * Handle of a message the bot sent, so it can be edited or deleted later.
 */
public record MessageRef(long chatId, long messageId) {
}
