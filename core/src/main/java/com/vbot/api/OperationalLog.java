package com.vbot.api;

/**
 * Sink for structured command records and fault reports.
 */
public interface OperationalLog {

    void recordCommand(long userId, String commandText, boolean success, long elapsedMs, String error);

    void recordDenial(long userId, long chatId, String commandText);

    void recordFault(Throwable fault, String context, long userId);
}
