package com.tinyeditor.common.model;

import java.util.List;

/**
 * Settings contributed by one editor plugin.
 */
public record PluginBlock(
        String name,
        List<SettingEntry> settings
) {
    public PluginBlock {
        settings = List.copyOf(settings);
    }
}
