package com.vbot.services.logging;

import com.vbot.api.ChatTransport;
import com.vbot.api.OperationalLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.function.Supplier;

/**
 * Operational log: every command record goes to slf4j and the command log store; fault
 * reports are additionally forwarded to the configured log chat.
 */
public class ChatOperationalLog implements OperationalLog {
    private static final Logger logger = LoggerFactory.getLogger(ChatOperationalLog.class);
    static final int MAX_REPORT_LENGTH = 4000;

    private final CommandLogStore store;
    private final Supplier<ChatTransport> transport;
    private final long logChatId;

    public ChatOperationalLog(CommandLogStore store, Supplier<ChatTransport> transport, long logChatId) {
        this.store = store;
        this.transport = transport;
        this.logChatId = logChatId;
    }

    @Override
    public void recordCommand(long userId, String commandText, boolean success, long elapsedMs, String error) {
        if (success) {
            logger.info("Command: {} | User: {} | Time: {}ms", commandText, userId, elapsedMs);
        } else {
            logger.error("Command: {} | User: {} | Time: {}ms | Error: {}", commandText, userId, elapsedMs, error);
        }
        persist(userId, null, commandText, success ? CommandLogStore.SUCCESS : CommandLogStore.FAILED, elapsedMs, error);
    }

    @Override
    public void recordDenial(long userId, long chatId, String commandText) {
        logger.warn("Command DENIED: {} | User: {} | Chat: {}", commandText, userId, chatId);
        persist(userId, chatId, commandText, CommandLogStore.DENIED, 0, null);
    }

    @Override
    public void recordFault(Throwable fault, String context, long userId) {
        logger.error("{}: {}", context, fault.toString(), fault);
        if (logChatId == 0)
            return;

        ChatTransport chat = transport.get();
        if (chat == null) {
            logger.debug("No transport registered, fault report not forwarded");
            return;
        }
        try {
            chat.sendMessage(logChatId, formatReport(fault, context, userId));
        } catch (Exception e) {
            logger.warn("Failed to forward fault report to log chat {}: {}", logChatId, e.getMessage());
        }
    }

    static String formatReport(Throwable fault, String context, long userId) {
        StringWriter trace = new StringWriter();
        fault.printStackTrace(new PrintWriter(trace));

        String report = "**Error Context:** " + context + "\n" +
                "**User ID:** " + userId + "\n" +
                "**Error Type:** " + fault.getClass().getSimpleName() + "\n" +
                "**Error Message:** " + fault.getMessage() + "\n\n" +
                "**Traceback:**\n```\n" + trace + "```";
        if (report.length() > MAX_REPORT_LENGTH)
            report = report.substring(0, MAX_REPORT_LENGTH - 20) + "\n...\n```\n[Truncated]";
        return report;
    }

    private void persist(long userId, Long chatId, String command, String outcome, long elapsedMs, String error) {
        if (store == null)
            return;
        try {
            store.insert(userId, chatId, command, outcome, elapsedMs, error);
        } catch (Exception e) {
            logger.warn("Failed to persist command log entry: {}", e.getMessage());
        }
    }
}
