package com.vbot.core.plugin.internal;

import com.vbot.api.BotExtension;

public class HiddenExtension implements BotExtension {
    @Override
    public String getName() {
        return "Hidden";
    }

    @Override
    public String getVersion() {
        return "0.0.1";
    }
}
