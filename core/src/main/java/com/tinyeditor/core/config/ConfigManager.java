package com.tinyeditor.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.tinyeditor.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class ConfigManager implements ConfigStore {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final File configFile;
    private final Gson gson;
    private volatile Configuration configuration;

    public ConfigManager(Kernel kernel) {
        this.configFile = new File(kernel.getToolsDir(), "config.json");
        this.gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    @Override
    public String get(String namespace, String key) {
        return configuration.getPluginSetting(namespace, key, null);
    }

    @Override
    public boolean isPluginEnabled(String pluginName) {
        return configuration.isPluginEnabled(pluginName);
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
            if (configuration == null) configuration = new Configuration();
            configuration.applyDefaults();
            logger.info("Configuration loaded.");
        } catch (Exception e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }

    public synchronized void saveConfig() {
        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(this.configuration, writer);
            logger.info("Configuration saved to disk.");
        } catch (IOException e) {
            logger.error("Failed to save config", e);
        }
    }
}
