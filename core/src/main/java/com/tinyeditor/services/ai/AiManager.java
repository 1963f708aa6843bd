package com.tinyeditor.services.ai;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.config.ConfigManager;
import com.tinyeditor.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AI provider action states and user policy acceptance.
 *
 * Providers live in the configuration, policy acceptances in ai_policy.json.
 */
public class AiManager {
    private static final Logger logger = LoggerFactory.getLogger(AiManager.class);

    private final ConfigManager configManager;
    private final File policyFile;
    private final Gson gson;
    private final Set<Long> policyAccepted = ConcurrentHashMap.newKeySet();

    public AiManager(Kernel kernel) {
        this.configManager = kernel.getConfigManager();
        this.policyFile = new File(kernel.getToolsDir(), "ai_policy.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration.AiProviderInstance createProviderInstance(String provider, String name, boolean enabled) {
        Configuration.AiProviderInstance instance = new Configuration.AiProviderInstance(name, provider, enabled);
        configManager.getConfig().aiProviders.add(instance);
        configManager.saveConfig();
        logger.info("AI provider instance created: {} ({})", name, provider);
        return instance;
    }

    public void setActionState(String providerName, String action, boolean enabled) {
        for (Configuration.AiProviderInstance instance : configManager.getConfig().aiProviders) {
            if (instance.name.equals(providerName)) {
                instance.actions.put(action, enabled);
                configManager.saveConfig();
                return;
            }
        }
        throw new IllegalArgumentException("Unknown AI provider instance: " + providerName);
    }

    /**
     * The placement must be enabled itself, have the action switched on and at least
     * one enabled provider must offer the action.
     */
    public boolean isActionAvailable(String placement, String action) {
        if (!"1".equals(configManager.get(placement, "enabled"))) return false;
        if ("0".equals(configManager.get(placement, action))) return false;
        for (Configuration.AiProviderInstance instance : configManager.getConfig().aiProviders) {
            if (instance.enabled && instance.actions.getOrDefault(action, false)) {
                return true;
            }
        }
        return false;
    }

    public boolean isPlacementEnabled(String placement) {
        return "1".equals(configManager.get(placement, "enabled"));
    }

    public boolean hasUserAcceptedPolicy(long userId) {
        return policyAccepted.contains(userId);
    }

    public void acceptPolicy(long userId) {
        if (policyAccepted.add(userId)) {
            save();
            logger.info("User {} accepted the AI policy", userId);
        }
    }

    private synchronized void save() {
        try (Writer w = new FileWriter(policyFile, StandardCharsets.UTF_8)) {
            gson.toJson(policyAccepted, w);
        } catch (IOException e) {
            logger.error("Failed to save AI policy acceptances", e);
        }
    }

    private void load() {
        if (!policyFile.exists()) return;
        try (Reader r = new FileReader(policyFile, StandardCharsets.UTF_8)) {
            Set<Long> loaded = gson.fromJson(r, new TypeToken<Set<Long>>() {}.getType());
            if (loaded != null) policyAccepted.addAll(loaded);
        } catch (Exception e) {
            logger.error("Failed to load AI policy acceptances", e);
        }
    }
}
