package com.vbot.plugins.telegram.internal;

import com.google.gson.JsonObject;
import com.vbot.api.ChatMessage;

import java.time.Instant;
import java.util.Set;

/**
 * Turns Bot API update objects into the transport-neutral types of the core.
 */
public final class UpdateMapper {
    private static final Set<String> ADMIN_STATUSES = Set.of("administrator", "creator");

    private UpdateMapper() {
    }

    /**
     * @return the text message, or null for messages without text or sender
     */
    public static ChatMessage toChatMessage(JsonObject msg) {
        if (msg == null || !msg.has("from") || !msg.has("chat"))
            return null;

        String text = null;
        if (msg.has("text"))
            text = msg.get("text").getAsString();
        else if (msg.has("caption"))
            text = msg.get("caption").getAsString();
        if (text == null || text.isEmpty())
            return null;

        JsonObject chat = msg.getAsJsonObject("chat");
        long chatId = chat.get("id").getAsLong();
        boolean privateChat = chat.has("type") && "private".equals(chat.get("type").getAsString());
        long senderId = msg.getAsJsonObject("from").get("id").getAsLong();
        long messageId = msg.get("message_id").getAsLong();
        Instant sentAt = msg.has("date") ? Instant.ofEpochSecond(msg.get("date").getAsLong()) : Instant.now();

        return new ChatMessage(messageId, chatId, senderId, text, privateChat, sentAt);
    }

    /**
     * True if a chat_member update promotes someone to admin or demotes an admin.
     */
    public static boolean isAdminChange(JsonObject memberUpdate) {
        if (memberUpdate == null)
            return false;
        boolean wasAdmin = isAdmin(memberUpdate.getAsJsonObject("old_chat_member"));
        boolean isAdmin = isAdmin(memberUpdate.getAsJsonObject("new_chat_member"));
        return wasAdmin != isAdmin;
    }

    private static boolean isAdmin(JsonObject member) {
        return member != null && member.has("status") && ADMIN_STATUSES.contains(member.get("status").getAsString());
    }

    public static long chatIdOf(JsonObject update) {
        return update.getAsJsonObject("chat").get("id").getAsLong();
    }
}
