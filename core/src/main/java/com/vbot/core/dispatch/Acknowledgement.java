package com.vbot.core.dispatch;

import com.vbot.api.ChatMessage;
import com.vbot.api.ChatTransport;
import com.vbot.api.MessageRef;
import com.vbot.api.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Placeholder reply whose text steps through a fixed list of phases until it is cancelled.
 * Once {@link #cancel()} returns, no new phase edit is started; at most one edit that was
 * already in flight may still complete.
 */
public class Acknowledgement {
    private static final Logger logger = LoggerFactory.getLogger(Acknowledgement.class);

    private final ChatTransport transport;
    private final MessageRef placeholder;
    private final List<ScheduledFuture<?>> pending = new ArrayList<>();
    private boolean cancelled;
    private int inFlight;

    private Acknowledgement(ChatTransport transport, MessageRef placeholder) {
        this.transport = transport;
        this.placeholder = placeholder;
    }

    /**
     * Sends the first phase as a reply right away and schedules the remaining ones.
     */
    public static Acknowledgement start(ChatTransport transport, ChatMessage message, List<String> phases,
            long intervalMillis, ScheduledExecutorService scheduler) throws TransportException {
        MessageRef placeholder = transport.reply(message, phases.get(0));
        Acknowledgement ack = new Acknowledgement(transport, placeholder);
        synchronized (ack) {
            for (int i = 1; i < phases.size(); i++) {
                String text = phases.get(i);
                ack.pending.add(scheduler.schedule(() -> ack.applyPhase(text), intervalMillis * i,
                        TimeUnit.MILLISECONDS));
            }
        }
        return ack;
    }

    // Edit happens outside the lock; cancel() does not wait for it
    private void applyPhase(String text) {
        synchronized (this) {
            if (cancelled)
                return;
            inFlight++;
        }
        try {
            transport.editMessage(placeholder, text);
        } catch (TransportException e) {
            logger.debug("Acknowledgement edit failed for {}: {}", placeholder, e.getMessage());
        } finally {
            synchronized (this) {
                inFlight--;
            }
        }
    }

    /**
     * Stops all phases that have not started yet. A phase edit already sent to the transport
     * is left to finish; see {@link #hasEditInFlight()}.
     */
    public synchronized void cancel() {
        if (cancelled)
            return;
        cancelled = true;
        for (ScheduledFuture<?> future : pending) {
            future.cancel(false);
        }
        pending.clear();
    }

    public synchronized boolean hasEditInFlight() {
        return inFlight > 0;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public MessageRef getPlaceholder() {
        return placeholder;
    }
}
