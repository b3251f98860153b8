package com.vbot.api;

import java.time.Instant;

/**
 * Inbound text event as delivered by the transport.
 */
public record ChatMessage(long messageId,
                          long chatId,
                          long senderId,
                          String text,
                          boolean privateChat,
                          Instant sentAt) {
}
