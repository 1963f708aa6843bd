package com.tinyeditor.common.model;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Everything the editor needs to boot in one context.
 * Field names follow the web service contract (all lower case).
 */
public record ConfigurationResponse(
        @SerializedName("contextid") long contextId,
        @SerializedName("branding") boolean branding,
        @SerializedName("extendedvalidelements") String extendedValidElements,
        @SerializedName("installedlanguages") List<InstalledLanguage> installedLanguages,
        @SerializedName("plugins") List<PluginBlock> plugins
) {
    public ConfigurationResponse {
        installedLanguages = List.copyOf(installedLanguages);
        plugins = List.copyOf(plugins);
    }

    public List<String> pluginNames() {
        return plugins.stream().map(PluginBlock::name).toList();
    }
}
