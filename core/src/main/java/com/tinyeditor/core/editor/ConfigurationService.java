package com.tinyeditor.core.editor;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.common.auth.PermissionChecker;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.ConfigurationResponse;
import com.tinyeditor.common.model.InstalledLanguage;
import com.tinyeditor.common.model.PluginBlock;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.config.ConfigStore;
import com.tinyeditor.core.config.Configuration;
import com.tinyeditor.core.context.ContextResolver;
import com.tinyeditor.core.context.EditorContext;
import com.tinyeditor.core.error.PermissionDeniedException;
import com.tinyeditor.core.plugin.PluginRegistry;
import com.tinyeditor.services.lang.LanguageCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects the editor configuration for one user in one context.
 *
 * Read only: nothing in here writes to the configuration or any other store.
 */
public class ConfigurationService {
    private static final Logger logger = LoggerFactory.getLogger(ConfigurationService.class);

    private final ContextResolver contexts;
    private final ConfigStore config;
    private final PluginRegistry registry;
    private final PermissionChecker permissions;
    private final LanguageCatalog languages;

    public ConfigurationService(ContextResolver contexts,
                                ConfigStore config,
                                PluginRegistry registry,
                                PermissionChecker permissions,
                                LanguageCatalog languages) {
        this.contexts = contexts;
        this.config = config;
        this.registry = registry;
        this.permissions = permissions;
        this.languages = languages;
    }

    /**
     * @param contextLevel context level name, e.g. "course"
     * @param instanceId   id of the course, module, ... the context belongs to
     * @param user         the user the editor is loaded for
     */
    public ConfigurationResponse getConfiguration(String contextLevel, long instanceId, User user) {
        EditorContext context = contexts.resolve(contextLevel, instanceId);
        Object userId = user == null ? "?" : user.id();
        if (!permissions.canAccess(user, context)) {
            throw new PermissionDeniedException("User " + userId + " cannot access context " + context.id());
        }
        if (!registry.isEnabled()) {
            logger.warn("Editor plugins are not enabled yet. Serving context {} without plugin settings.", context.id());
        }

        boolean branding = parseBoolean(config.get(Configuration.EDITOR_NAMESPACE, "branding"), true);
        String extendedValidElements = config.get(Configuration.EDITOR_NAMESPACE, "extended_valid_elements", "");

        List<InstalledLanguage> installed = new ArrayList<>();
        for (Map.Entry<String, String> e : languages.listInstalledTranslations().entrySet()) {
            installed.add(new InstalledLanguage(e.getKey(), e.getValue()));
        }

        List<PluginBlock> blocks = new ArrayList<>();
        for (EditorPlugin plugin : registry.getPlugins()) {
            String name = plugin.getName();
            if (!config.isPluginEnabled(name)) {
                continue;
            }
            List<String> required = plugin.getRequiredCapabilities();
            if (!required.isEmpty() && !permissions.hasAnyCapability(user, required, context)) {
                logger.debug("Plugin {} hidden from user {} in context {}", name, userId, context.id());
                continue;
            }
            if (!plugin.isAvailable(context, user)) {
                logger.debug("Plugin {} not available in context {}", name, context.id());
                continue;
            }
            List<SettingEntry> settings = plugin.buildSettings(context, user);
            blocks.add(new PluginBlock(name, settings == null ? List.of() : settings));
        }

        return new ConfigurationResponse(context.id(), branding, extendedValidElements, installed, blocks);
    }

    static boolean parseBoolean(String raw, boolean defaultValue) {
        if (raw == null) return defaultValue;
        String clean = raw.trim();
        return clean.equals("1") || clean.equalsIgnoreCase("true");
    }
}
