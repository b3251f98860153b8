package com.vbot.plugins.telegram.internal;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.vbot.api.ChatMessage;
import com.vbot.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Long-polls the Bot API and hands every text message to the dispatch pipeline on the
 * chat's lane. Admin promotions and demotions invalidate the admin cache of that chat.
 */
public class TelegramListenerService extends Thread {
    private static final Logger logger = LoggerFactory.getLogger(TelegramListenerService.class);
    private static final int POLL_TIMEOUT_SECONDS = 25;
    private static final List<String> ALLOWED_UPDATES = List.of("message", "chat_member", "my_chat_member");

    private final Kernel kernel;
    private final TelegramTransport transport;
    private final Set<Long> allowedChatIds = new HashSet<>();
    private volatile boolean running = true;
    private long lastUpdateId = 0;

    public TelegramListenerService(Kernel kernel, TelegramTransport transport, String whitelist) {
        this.kernel = kernel;
        this.transport = transport;
        this.setName("TelegramListener");
        this.setDaemon(true);
        parseWhitelist(whitelist);
    }

    private void parseWhitelist(String whitelist) {
        if (whitelist == null || whitelist.trim().isEmpty())
            return;
        for (String p : whitelist.split(",")) {
            try {
                allowedChatIds.add(Long.parseLong(p.trim()));
            } catch (NumberFormatException e) {
                logger.warn("Invalid Chat ID in whitelist: {}", p);
            }
        }
    }

    boolean isChatAllowed(long chatId) {
        // No whitelist means every chat is allowed
        return allowedChatIds.isEmpty() || allowedChatIds.contains(chatId);
    }

    @Override
    public void run() {
        logger.info("TelegramListener started. Polling Bot API...");
        while (running) {
            try {
                JsonArray updates = transport.getUpdates(lastUpdateId + 1, POLL_TIMEOUT_SECONDS, ALLOWED_UPDATES);
                for (JsonElement el : updates) {
                    processUpdate(el.getAsJsonObject());
                }
            } catch (RateLimitedException e) {
                logger.warn("Polling rate limited, retrying in {}s", e.getRetryAfterSeconds());
                pause(e.getRetryAfterSeconds() * 1000);
            } catch (Exception e) {
                if (!running)
                    break;
                logger.error("Listener Error", e);
                pause(5000);
            }
        }
        logger.info("TelegramListener stopped.");
    }

    void processUpdate(JsonObject update) {
        lastUpdateId = Math.max(lastUpdateId, update.get("update_id").getAsLong());

        if (update.has("message")) {
            ChatMessage message = UpdateMapper.toChatMessage(update.getAsJsonObject("message"));
            if (message == null || !isChatAllowed(message.chatId()))
                return;
            kernel.getChatDispatcher().submit(message.chatId(),
                    () -> kernel.getDispatchPipeline().dispatch(transport, message));
        }

        for (String key : new String[] { "chat_member", "my_chat_member" }) {
            if (update.has(key) && UpdateMapper.isAdminChange(update.getAsJsonObject(key))) {
                long chatId = UpdateMapper.chatIdOf(update.getAsJsonObject(key));
                logger.info("Admin list of chat {} changed, invalidating cache", chatId);
                kernel.getRoleResolver().invalidate(chatId);
            }
        }
    }

    long getLastUpdateId() {
        return lastUpdateId;
    }

    private void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    public void stopService() {
        running = false;
        interrupt();
    }
}
