package com.vbot.api;

import com.vbot.core.dispatch.InvocationContext;

import java.util.List;

/**
 * Everything a handler gets for one invocation: the transport to answer on, the inbound
 * message, the normalized command name, the argument tokens and the live invocation context.
 */
public record CommandRequest(ChatTransport transport,
                             ChatMessage message,
                             String command,
                             List<String> args,
                             InvocationContext context) {

    public CommandRequest {
        args = List.copyOf(args);
    }

    public String argLine() {
        return String.join(" ", args);
    }

    public MessageRef reply(String text) throws TransportException {
        return transport.reply(message, text);
    }
}
