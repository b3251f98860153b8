package com.vbot.plugins.telegram;

import com.vbot.api.BotExtension;
import com.vbot.core.Kernel;
import com.vbot.core.config.Configuration;
import com.vbot.plugins.telegram.internal.BotApiClient;
import com.vbot.plugins.telegram.internal.TelegramListenerService;
import com.vbot.plugins.telegram.internal.TelegramTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TelegramPlugin implements BotExtension {
    private static final Logger logger = LoggerFactory.getLogger(TelegramPlugin.class);
    private TelegramListenerService listener;

    @Override
    public String getName() {
        return "TelegramIntegration";
    }

    @Override
    public String getVersion() {
        return "2.1.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        Configuration config = kernel.getConfig();
        if (config.telegramToken == null || config.telegramToken.isBlank()) {
            logger.warn("No telegramToken configured, Telegram transport stays offline.");
            return;
        }

        // 1. Transport for replies, edits and admin lookups
        TelegramTransport transport = new TelegramTransport(new BotApiClient(config.telegramApiBase, config.telegramToken));
        kernel.registerTransport(transport);

        // 2. Listener feeds inbound messages into the dispatch pipeline
        listener = new TelegramListenerService(kernel, transport, config.telegramAllowedChats);
        listener.start();

        logger.info("✈️ Telegram Plugin online.");
    }

    @Override
    public void onDisable() {
        if (listener != null)
            listener.stopService();
    }
}
