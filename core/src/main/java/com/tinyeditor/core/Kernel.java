package com.tinyeditor.core;

import com.tinyeditor.common.auth.AuthManager;
import com.tinyeditor.common.auth.CapabilityManager;
import com.tinyeditor.common.auth.UserManager;
import com.tinyeditor.core.config.ConfigManager;
import com.tinyeditor.core.config.ConfigValidator;
import com.tinyeditor.core.context.ContextManager;
import com.tinyeditor.core.editor.ConfigurationService;
import com.tinyeditor.core.plugin.PluginRegistry;
import com.tinyeditor.services.ai.AiManager;
import com.tinyeditor.services.lang.LanguageCatalog;
import com.tinyeditor.services.lang.LanguagePackCatalog;
import com.tinyeditor.services.upload.UploadLimitManager;
import com.tinyeditor.services.upload.UploadLimitService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.atomic.AtomicBoolean;

public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    // Infrastructure Managers
    private final ConfigManager configManager;
    private final ContextManager contextManager;
    private final UserManager userManager;
    private final AuthManager authManager;
    private final CapabilityManager capabilityManager;
    private final LanguageCatalog languageCatalog;
    private final UploadLimitService uploadLimitService;
    private final AiManager aiManager;
    private final PluginRegistry pluginRegistry;
    private final ConfigurationService configurationService;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final File toolsDir;

    public Kernel(File toolsDir, PluginRegistry pluginRegistry) {
        this.toolsDir = toolsDir;
        if (!toolsDir.exists())
            toolsDir.mkdirs();

        this.configManager = new ConfigManager(this);
        this.contextManager = new ContextManager(this);
        this.userManager = new UserManager(this);
        this.authManager = new AuthManager(this);
        this.capabilityManager = new CapabilityManager(this);
        this.languageCatalog = new LanguagePackCatalog(configManager);
        this.uploadLimitService = new UploadLimitManager(configManager, contextManager);
        this.aiManager = new AiManager(this);
        this.pluginRegistry = pluginRegistry;
        this.configurationService = new ConfigurationService(
                contextManager, configManager, pluginRegistry, capabilityManager, languageCatalog);
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("Kernel booting...");

        // Plugins seed their defaults before the configuration is checked
        this.pluginRegistry.enableAll(this);
        new ConfigValidator().validateAndReport(configManager.getConfig());
        this.configManager.saveConfig();

        logger.info("Kernel active. {} editor plugins registered.", pluginRegistry.getPlugins().size());
    }

    public boolean isRunning() {
        return running.get();
    }

    // --- Getters ---
    public File getToolsDir() {
        return toolsDir;
    }

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public ContextManager getContextManager() {
        return contextManager;
    }

    public UserManager getUserManager() {
        return userManager;
    }

    public AuthManager getAuthManager() {
        return authManager;
    }

    public CapabilityManager getCapabilityManager() {
        return capabilityManager;
    }

    public LanguageCatalog getLanguageCatalog() {
        return languageCatalog;
    }

    public UploadLimitService getUploadLimitService() {
        return uploadLimitService;
    }

    public AiManager getAiManager() {
        return aiManager;
    }

    public PluginRegistry getPluginRegistry() {
        return pluginRegistry;
    }

    public ConfigurationService getConfigurationService() {
        return configurationService;
    }
}
