package com.vbot.api;

import java.util.List;

/**
 * Outbound side of the chat protocol. Implemented by the transport plugin.
 */
public interface ChatTransport {

    List<Long> getChatAdministrators(long chatId) throws TransportException;

    MessageRef reply(ChatMessage message, String text) throws TransportException;

    MessageRef sendMessage(long chatId, String text) throws TransportException;

    void editMessage(MessageRef target, String text) throws TransportException;

    void deleteMessage(long chatId, long messageId) throws TransportException;
}
