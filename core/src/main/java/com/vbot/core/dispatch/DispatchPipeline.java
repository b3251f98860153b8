package com.vbot.core.dispatch;

import com.vbot.api.ChatMessage;
import com.vbot.api.ChatTransport;
import com.vbot.api.CommandHandler;
import com.vbot.api.CommandRequest;
import com.vbot.api.MessageRef;
import com.vbot.api.OperationalLog;
import com.vbot.api.PrivacyPolicy;
import com.vbot.api.TransportException;
import com.vbot.core.auth.CommandTier;
import com.vbot.core.auth.RoleResolver;
import com.vbot.core.config.Configuration;
import com.vbot.core.plugin.CommandRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Takes every inbound text event through classification, authorization, optional
 * acknowledgement, handler execution and finalization.
 * <p>
 * Handlers are resolved from the built-in route table first, then from the
 * {@link CommandRegistry}. Nothing thrown by a handler leaves {@link #dispatch}; the
 * outcome is reported as a {@link DispatchOutcome}.
 */
public class DispatchPipeline {
    private static final Logger logger = LoggerFactory.getLogger(DispatchPipeline.class);

    private final Configuration config;
    private final RoleResolver roles;
    private final CommandRegistry registry;
    private final OperationalLog operationalLog;
    private final PrivacyPolicy privacyPolicy;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Map<String, CommandHandler> builtins = new ConcurrentHashMap<>();
    private final Map<InvocationContext.Key, InvocationContext> contexts = new ConcurrentHashMap<>();

    public DispatchPipeline(Configuration config, RoleResolver roles, CommandRegistry registry,
            OperationalLog operationalLog, PrivacyPolicy privacyPolicy,
            ScheduledExecutorService scheduler, Clock clock) {
        this.config = config;
        this.roles = roles;
        this.registry = registry;
        this.operationalLog = operationalLog;
        this.privacyPolicy = privacyPolicy;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // --- Built-in route table ---

    public void registerBuiltin(String command, CommandHandler handler) {
        builtins.put(CommandNames.normalize(command), handler);
    }

    public Map<String, CommandHandler> getBuiltins() {
        return Map.copyOf(builtins);
    }

    // --- Live invocation contexts ---

    public InvocationContext getContext(long chatId, long messageId) {
        return contexts.get(new InvocationContext.Key(chatId, messageId));
    }

    public int activeContextCount() {
        return contexts.size();
    }

    public DispatchOutcome dispatch(ChatTransport transport, ChatMessage message) {
        String text = message.text();
        if (text == null || text.isBlank())
            return DispatchOutcome.IGNORED;

        // Received -> Classified
        String trimmed = text.trim();
        CommandTier tier = roles.classifyCommandPrefix(trimmed);
        if (tier == CommandTier.NONE)
            return DispatchOutcome.IGNORED;

        String[] tokens = trimmed.split("\\s+");
        String command = CommandNames.normalize(tokens[0]);
        List<String> args = new ArrayList<>(Arrays.asList(tokens).subList(1, tokens.length));

        // Classified -> Denied
        if (!roles.authorize(transport, message.senderId(), message.chatId(), trimmed)) {
            deny(transport, message, tier, command);
            return DispatchOutcome.DENIED;
        }

        // Classified -> Authorized
        InvocationContext context = new InvocationContext(message.chatId(), message.messageId(), clock.instant());
        InvocationContext previous = contexts.putIfAbsent(context.getKey(), context);
        if (previous != null) {
            logger.warn("Message {} in chat {} is already being dispatched, ignoring duplicate",
                    message.messageId(), message.chatId());
            return DispatchOutcome.IGNORED;
        }

        long start = System.nanoTime();
        try {
            CommandHandler builtin = builtins.get(command);
            if (builtin == null && !registry.isHandled(command)) {
                unknown(transport, message, command);
                return DispatchOutcome.UNKNOWN;
            }

            if (config.acknowledgeCommands)
                acknowledge(transport, message, context);

            // Executing
            CommandRequest request = new CommandRequest(transport, message, command, args, context);
            if (builtin != null) {
                builtin.handle(request);
            } else if (!registry.dispatch(command, request)) {
                unknown(transport, message, command);
                return DispatchOutcome.UNKNOWN;
            }

            // Completed
            context.cancelAcknowledgement();
            removeUntakenPlaceholder(transport, context);
            operationalLog.recordCommand(message.senderId(), trimmed, true, elapsedMillis(start), null);
            return DispatchOutcome.COMPLETED;
        } catch (Exception | LinkageError e) {
            // Failed; a linkage error from an extension jar counts as a handler fault
            context.cancelAcknowledgement();
            fail(transport, message, context, trimmed, command, e, elapsedMillis(start));
            return DispatchOutcome.FAILED;
        } finally {
            // Finalized
            context.cancelAcknowledgement();
            contexts.remove(context.getKey(), context);
        }
    }

    private void acknowledge(ChatTransport transport, ChatMessage message, InvocationContext context) {
        List<String> phases = config.acknowledgementPhases;
        if (phases == null || phases.isEmpty())
            return;
        try {
            context.attachAcknowledgement(Acknowledgement.start(transport, message, phases,
                    config.acknowledgementIntervalMillis, scheduler));
        } catch (TransportException e) {
            logger.warn("Could not send acknowledgement for message {}: {}", message.messageId(), e.getMessage());
        }
    }

    private void removeUntakenPlaceholder(ChatTransport transport, InvocationContext context) {
        if (context.isStatusTaken())
            return;
        context.getStatusMessage().ifPresent(ref -> {
            try {
                transport.deleteMessage(ref.chatId(), ref.messageId());
            } catch (TransportException e) {
                logger.debug("Could not remove acknowledgement {}: {}", ref, e.getMessage());
            }
        });
    }

    private void deny(ChatTransport transport, ChatMessage message, CommandTier tier, String command) {
        String response = roles.denialMessage(tier);
        logger.info("Command DENIED: user_id={}, chat_id={}, command={}", message.senderId(), message.chatId(), command);
        operationalLog.recordDenial(message.senderId(), message.chatId(), message.text());
        try {
            respond(transport, message, response);
        } catch (TransportException e) {
            logger.warn("Could not deliver denial to user {}: {}", message.senderId(), e.getMessage());
        }
    }

    /**
     * Answers privately when the privacy policy asks for it; in that case a group command is
     * removed from the chat as well.
     */
    private void respond(ChatTransport transport, ChatMessage message, String text) throws TransportException {
        if (privacyPolicy != null && privacyPolicy.shouldAnswerPrivately(message)) {
            transport.sendMessage(message.senderId(), text);
            if (!message.privateChat()) {
                try {
                    transport.deleteMessage(message.chatId(), message.messageId());
                } catch (TransportException e) {
                    logger.debug("Could not delete command message {}: {}", message.messageId(), e.getMessage());
                }
            }
        } else {
            transport.reply(message, text);
        }
    }

    private void unknown(ChatTransport transport, ChatMessage message, String command) {
        logger.debug("Unknown command {} from user {}", command, message.senderId());
        try {
            transport.reply(message, "❓ Unknown command: " + command);
        } catch (TransportException e) {
            logger.warn("Could not answer unknown command {}: {}", command, e.getMessage());
        }
    }

    private void fail(ChatTransport transport, ChatMessage message, InvocationContext context, String commandText,
            String command, Throwable fault, long elapsedMs) {
        String description = describe(fault);
        logger.error("Command {} failed for user {} in chat {}", command, message.senderId(), message.chatId(), fault);
        operationalLog.recordFault(fault, "command " + command + " in chat " + message.chatId(), message.senderId());

        try {
            MessageRef status = context.getStatusMessage().orElse(null);
            if (status != null) {
                transport.editMessage(status, "❌ **Command failed:** `" + command + "`\n\n" + description);
            } else {
                transport.reply(message, "❌ Error: " + description);
            }
        } catch (TransportException e) {
            logger.warn("Could not report failure of {} to chat {}: {}", command, message.chatId(), e.getMessage());
        }

        operationalLog.recordCommand(message.senderId(), commandText, false, elapsedMs, description);
    }

    static String describe(Throwable fault) {
        String msg = fault.getMessage();
        return (msg == null || msg.isBlank()) ? fault.getClass().getSimpleName() : msg;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
