package com.tinyeditor.core.config;

/**
 * Read access to the namespaced key/value settings and the plugin enable switches.
 */
public interface ConfigStore {

    /**
     * @return the raw value, or null if the key is not set
     */
    String get(String namespace, String key);

    default String get(String namespace, String key, String defaultValue) {
        String value = get(namespace, key);
        return value != null ? value : defaultValue;
    }

    /**
     * Plugins without an explicit switch count as enabled.
     */
    boolean isPluginEnabled(String pluginName);
}
