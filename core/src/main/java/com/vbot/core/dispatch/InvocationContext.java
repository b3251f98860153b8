package com.vbot.core.dispatch;

import com.vbot.api.MessageRef;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-message scratch state shared between the pipeline and the handler it invokes.
 * Lives exactly as long as one dispatch cycle.
 */
public class InvocationContext {

    /**
     * Message ids are only unique within one chat, so the live map is keyed by both.
     */
    public record Key(long chatId, long messageId) {
    }

    private final Key key;
    private final Instant startedAt;
    private volatile Acknowledgement acknowledgement;
    private volatile boolean statusTaken;

    public InvocationContext(long chatId, long messageId, Instant startedAt) {
        this.key = new Key(chatId, messageId);
        this.startedAt = startedAt;
    }

    public Key getKey() {
        return key;
    }

    public long getChatId() {
        return key.chatId();
    }

    public long getMessageId() {
        return key.messageId();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }

    void attachAcknowledgement(Acknowledgement acknowledgement) {
        this.acknowledgement = acknowledgement;
    }

    /**
     * Hands the acknowledgement placeholder to the handler so it can edit its answer into it
     * instead of sending a second reply. Stops the remaining acknowledgement phases.
     */
    public Optional<MessageRef> takeStatusMessage() {
        Acknowledgement ack = acknowledgement;
        if (ack == null)
            return Optional.empty();
        ack.cancel();
        statusTaken = true;
        return Optional.of(ack.getPlaceholder());
    }

    public Optional<MessageRef> getStatusMessage() {
        Acknowledgement ack = acknowledgement;
        return ack == null ? Optional.empty() : Optional.of(ack.getPlaceholder());
    }

    boolean isStatusTaken() {
        return statusTaken;
    }

    void cancelAcknowledgement() {
        Acknowledgement ack = acknowledgement;
        if (ack != null)
            ack.cancel();
    }
}
