package com.vbot.common.privacy;

import com.vbot.api.ChatMessage;
import com.vbot.api.PrivacyPolicy;
import com.vbot.core.config.Configuration;
import com.vbot.core.dispatch.CommandNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides when the bot answers in a private message instead of in the group:
 * always in private chats, in chats switched to silent mode, and for private commands.
 */
public class PrivacyManager implements PrivacyPolicy {
    private static final Logger logger = LoggerFactory.getLogger(PrivacyManager.class);

    private final boolean enabled;
    private final Set<Long> silentChats = ConcurrentHashMap.newKeySet();
    private final Set<String> privateCommands = ConcurrentHashMap.newKeySet();

    public PrivacyManager(Configuration config) {
        this.enabled = config.privacyEnabled;
        this.silentChats.addAll(config.silentChats);
        for (String command : config.privateCommands) {
            privateCommands.add(CommandNames.normalize(command));
        }
    }

    @Override
    public boolean shouldAnswerPrivately(ChatMessage message) {
        if (!enabled)
            return false;
        if (message.privateChat())
            return true;
        if (silentChats.contains(message.chatId()))
            return true;
        return message.text() != null && privateCommands.contains(CommandNames.normalize(message.text()));
    }

    public void enableSilentMode(long chatId) {
        silentChats.add(chatId);
        logger.info("Enabled silent mode for chat {}", chatId);
    }

    public void disableSilentMode(long chatId) {
        silentChats.remove(chatId);
        logger.info("Disabled silent mode for chat {}", chatId);
    }

    public boolean isSilentMode(long chatId) {
        return silentChats.contains(chatId);
    }

    public void addPrivateCommand(String command) {
        privateCommands.add(CommandNames.normalize(command));
    }

    public void removePrivateCommand(String command) {
        privateCommands.remove(CommandNames.normalize(command));
    }

    public Set<String> getPrivateCommands() {
        return Set.copyOf(privateCommands);
    }

    public boolean isEnabled() {
        return enabled;
    }
}
