package com.tinyeditor.core.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Configuration {
    public static final String EDITOR_NAMESPACE = "editor_tiny";
    public static final String CORE_NAMESPACE = "core";

    // --- Plugin switches ---
    // Key = editor plugin name, Value = enabled (true/false)
    public Map<String, Boolean> plugins = new LinkedHashMap<>();

    // --- Namespaced settings ---
    // Key = namespace (e.g. "tiny_recordrtc"), Value = settings of that namespace
    public Map<String, Map<String, String>> pluginConfigs = new LinkedHashMap<>();

    // --- Installed language packs ---
    // Key = language code, Value = display name
    public Map<String, String> languages = new LinkedHashMap<>();

    // --- AI providers ---
    public List<AiProviderInstance> aiProviders = new ArrayList<>();

    public Configuration() {
        languages.put("en", "English \u200E(en)\u200E");
        applyDefaults();
    }

    /**
     * Restores missing maps and core settings. Values already present are kept, so this
     * is safe to run on a configuration read from a partial or hand-edited file.
     */
    public void applyDefaults() {
        if (plugins == null) plugins = new LinkedHashMap<>();
        if (pluginConfigs == null) pluginConfigs = new LinkedHashMap<>();
        if (languages == null) languages = new LinkedHashMap<>();
        if (aiProviders == null) aiProviders = new ArrayList<>();
        aiProviders.removeIf(instance -> instance == null || instance.name == null);
        for (AiProviderInstance instance : aiProviders) {
            if (instance.actions == null) instance.actions = new LinkedHashMap<>();
        }

        setDefaultPluginSetting(EDITOR_NAMESPACE, "branding", "1");
        setDefaultPluginSetting(EDITOR_NAMESPACE, "extended_valid_elements", "");

        setDefaultPluginSetting(CORE_NAMESPACE, "maxbytes", "0");
        setDefaultPluginSetting(CORE_NAMESPACE, "uploadmaxfilesize", "2097152");
        setDefaultPluginSetting(CORE_NAMESPACE, "docroot", "https://docs.moodle.org");
        setDefaultPluginSetting(CORE_NAMESPACE, "docsversion", "500");
        setDefaultPluginSetting(CORE_NAMESPACE, "lang", "en");

        setDefaultPluginSetting("filter_tex", "active", "1");
    }

    public static class AiProviderInstance {
        public String name;
        public String provider;
        public boolean enabled;
        // Key = action name (e.g. "generate_text"), Value = enabled
        public Map<String, Boolean> actions = new LinkedHashMap<>();

        public AiProviderInstance() {
        }

        public AiProviderInstance(String name, String provider, boolean enabled) {
            this.name = name;
            this.provider = provider;
            this.enabled = enabled;
        }
    }

    public String getPluginSetting(String namespace, String key, String defaultValue) {
        Map<String, String> values = pluginConfigs.get(namespace);
        if (values == null)
            return defaultValue;
        return values.getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String namespace, String key, String value) {
        pluginConfigs.computeIfAbsent(namespace, k -> new LinkedHashMap<>()).put(key, value);
    }

    /**
     * Seeds a default without touching a value the admin already set.
     */
    public void setDefaultPluginSetting(String namespace, String key, String value) {
        pluginConfigs.computeIfAbsent(namespace, k -> new LinkedHashMap<>()).putIfAbsent(key, value);
    }

    public boolean isPluginEnabled(String pluginName) {
        Boolean enabled = plugins.get(pluginName);
        return enabled == null || enabled;
    }

    public void setPluginEnabled(String pluginName, boolean enabled) {
        plugins.put(pluginName, enabled);
    }
}
