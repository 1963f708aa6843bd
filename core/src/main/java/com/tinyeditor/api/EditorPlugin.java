package com.tinyeditor.api;

import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.context.EditorContext;

import java.util.List;

public interface EditorPlugin {
    // Plugin name as the editor knows it (e.g. "recordrtc")
    String getName();

    // Version (e.g. "1.0.0")
    String getVersion();

    // Called once at start. Plugins seed their default settings and grab the services they need.
    default void onEnable(Kernel kernel) {
    }

    /**
     * Capabilities guarding the plugin. The user needs at least one of them in the
     * context, an empty list means everyone may use the plugin.
     */
    default List<String> getRequiredCapabilities() {
        return List.of();
    }

    /**
     * Plugin-specific availability on top of the capability check (e.g. missing API key).
     */
    default boolean isAvailable(EditorContext context, User user) {
        return true;
    }

    /**
     * Builds the settings handed to the editor, in a fixed order. Must not throw for missing
     * optional configuration.
     */
    List<SettingEntry> buildSettings(EditorContext context, User user);
}
