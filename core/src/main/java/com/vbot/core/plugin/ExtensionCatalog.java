package com.vbot.core.plugin;

import com.vbot.api.BotExtension;

import java.util.List;

/**
 * Source of extension instances. The registry filters and loads what this returns.
 */
@FunctionalInterface
public interface ExtensionCatalog {
    List<BotExtension> extensions();
}
