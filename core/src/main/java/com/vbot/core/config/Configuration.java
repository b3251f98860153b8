package com.vbot.core.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class Configuration {
    // --- Telegram ---
    public String telegramToken = "";
    public String telegramApiBase = "https://api.telegram.org";
    public String telegramAllowedChats = "";

    // --- Authorization ---
    public long ownerId = 0;
    // Developers are shown as "Founder" in user-facing texts
    public List<Long> developerIds = new ArrayList<>();
    // Every member of these chats counts as chat admin
    public List<Long> adminChatIds = new ArrayList<>();
    public long adminCacheTtlSeconds = 300;

    // --- Command prefixes (always three distinct characters) ---
    public String developerPrefix = ".";
    public String adminPrefix = "/";
    public String publicPrefix = "#";

    // --- Dispatch ---
    public boolean acknowledgeCommands = true;
    public List<String> acknowledgementPhases = new ArrayList<>(List.of("⏳ Processing...", "⚙️ Executing..."));
    public long acknowledgementIntervalMillis = 700;
    public int dispatchThreads = 4;

    // --- Privacy ---
    public boolean privacyEnabled = true;
    public Set<String> privateCommands = new HashSet<>(Set.of(".stats", ".plugins", ".status"));
    public Set<Long> silentChats = new HashSet<>();

    // --- Operational log ---
    // 0 = no fault forwarding
    public long logChatId = 0;

    // --- Extensions ---
    public String extensionNamespace = "com.vbot.plugins";
    public String pluginDirectory = "plugins";
    // Key = extension name, Value = enabled (true/false)
    public Map<String, Boolean> plugins = new HashMap<>();
    // Key = extension name, Value = settings map
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public String getPluginSetting(String pluginName, String key, String defaultValue) {
        if (!pluginConfigs.containsKey(pluginName))
            return defaultValue;
        return pluginConfigs.get(pluginName).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginName, String key, String value) {
        pluginConfigs.computeIfAbsent(pluginName, k -> new HashMap<>()).put(key, value);
    }
}
