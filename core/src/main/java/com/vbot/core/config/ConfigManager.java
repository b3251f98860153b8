package com.vbot.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final File configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(File toolsDir) {
        // Lives next to the other runtime files in the tools folder
        this.configFile = new File(toolsDir, "config.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public File getConfigFile() {
        return configFile;
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found. Created default configuration.");
            saveConfig();
            return;
        }

        try (Reader r = new FileReader(configFile, StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null)
                configuration = new Configuration();
            logger.info("Configuration loaded.");
        } catch (Exception e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }

    public synchronized void saveConfig() {
        File parent = configFile.getParentFile();
        if (parent != null && !parent.exists())
            parent.mkdirs();

        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(this.configuration, writer);
            logger.debug("Configuration saved to disk.");
        } catch (IOException e) {
            logger.error("Failed to save config", e);
        }
    }

    public void updateConfig(Configuration newConfig) {
        this.configuration = newConfig;
        saveConfig();
    }
}
