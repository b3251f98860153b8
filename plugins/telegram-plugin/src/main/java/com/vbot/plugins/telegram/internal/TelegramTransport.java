package com.vbot.plugins.telegram.internal;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.vbot.api.ChatMessage;
import com.vbot.api.ChatTransport;
import com.vbot.api.MessageRef;
import com.vbot.api.TransportException;

import java.util.ArrayList;
import java.util.List;

public class TelegramTransport implements ChatTransport {
    // Telegram rejects longer texts
    static final int MAX_MESSAGE_LENGTH = 4096;

    private final BotApiClient client;

    public TelegramTransport(BotApiClient client) {
        this.client = client;
    }

    @Override
    public List<Long> getChatAdministrators(long chatId) throws TransportException {
        JsonObject json = new JsonObject();
        json.addProperty("chat_id", chatId);
        return parseAdministrators(client.call("getChatAdministrators", json));
    }

    static List<Long> parseAdministrators(JsonElement result) throws TransportException {
        if (result == null || !result.isJsonArray())
            throw new TransportException("getChatAdministrators returned no list");

        List<Long> ids = new ArrayList<>();
        for (JsonElement member : result.getAsJsonArray()) {
            JsonObject user = member.getAsJsonObject().getAsJsonObject("user");
            if (user != null && user.has("id"))
                ids.add(user.get("id").getAsLong());
        }
        return ids;
    }

    @Override
    public MessageRef reply(ChatMessage message, String text) throws TransportException {
        JsonObject json = textPayload(message.chatId(), text);
        JsonObject replyParameters = new JsonObject();
        replyParameters.addProperty("message_id", message.messageId());
        replyParameters.addProperty("allow_sending_without_reply", true);
        json.add("reply_parameters", replyParameters);
        return sent(message.chatId(), client.call("sendMessage", json));
    }

    @Override
    public MessageRef sendMessage(long chatId, String text) throws TransportException {
        return sent(chatId, client.call("sendMessage", textPayload(chatId, text)));
    }

    @Override
    public void editMessage(MessageRef target, String text) throws TransportException {
        JsonObject json = textPayload(target.chatId(), text);
        json.addProperty("message_id", target.messageId());
        client.call("editMessageText", json);
    }

    @Override
    public void deleteMessage(long chatId, long messageId) throws TransportException {
        JsonObject json = new JsonObject();
        json.addProperty("chat_id", chatId);
        json.addProperty("message_id", messageId);
        client.call("deleteMessage", json);
    }

    public JsonArray getUpdates(long offset, int timeoutSeconds, List<String> allowedUpdates) throws TransportException {
        JsonObject json = new JsonObject();
        json.addProperty("offset", offset);
        json.addProperty("timeout", timeoutSeconds);
        JsonArray allowed = new JsonArray();
        allowedUpdates.forEach(allowed::add);
        json.add("allowed_updates", allowed);

        JsonElement result = client.call("getUpdates", json, (timeoutSeconds + 10) * 1000);
        return result != null && result.isJsonArray() ? result.getAsJsonArray() : new JsonArray();
    }

    private static JsonObject textPayload(long chatId, String text) {
        JsonObject json = new JsonObject();
        json.addProperty("chat_id", chatId);
        json.addProperty("text", truncate(text));
        return json;
    }

    static String truncate(String text) {
        if (text.length() <= MAX_MESSAGE_LENGTH)
            return text;
        return text.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }

    private static MessageRef sent(long chatId, JsonElement result) throws TransportException {
        if (result == null || !result.isJsonObject() || !result.getAsJsonObject().has("message_id"))
            throw new TransportException("sendMessage returned no message");
        return new MessageRef(chatId, result.getAsJsonObject().get("message_id").getAsLong());
    }
}
