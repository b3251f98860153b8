package com.vbot.test;

import com.vbot.api.OperationalLog;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingOperationalLog implements OperationalLog {

    public record CommandEntry(long userId, String commandText, boolean success, long elapsedMs, String error) {
    }

    public record DenialEntry(long userId, long chatId, String commandText) {
    }

    public record FaultEntry(Throwable fault, String context, long userId) {
    }

    public final List<CommandEntry> commands = new CopyOnWriteArrayList<>();
    public final List<DenialEntry> denials = new CopyOnWriteArrayList<>();
    public final List<FaultEntry> faults = new CopyOnWriteArrayList<>();

    @Override
    public void recordCommand(long userId, String commandText, boolean success, long elapsedMs, String error) {
        commands.add(new CommandEntry(userId, commandText, success, elapsedMs, error));
    }

    @Override
    public void recordDenial(long userId, long chatId, String commandText) {
        denials.add(new DenialEntry(userId, chatId, commandText));
    }

    @Override
    public void recordFault(Throwable fault, String context, long userId) {
        faults.add(new FaultEntry(fault, context, userId));
    }
}
