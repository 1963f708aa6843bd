package com.tinyplugins;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.context.EditorContext;

import java.util.List;

/**
 * Built-in editor plugins that need no settings from the server.
 */
public class BasicEditorPlugin implements EditorPlugin {
    private final String name;
    private final String version;

    public BasicEditorPlugin(String name, String version) {
        this.name = name;
        this.version = version;
    }

    public static BasicEditorPlugin accessibilityChecker() {
        return new BasicEditorPlugin("accessibilitychecker", "1.0.0");
    }

    public static BasicEditorPlugin autosave() {
        return new BasicEditorPlugin("autosave", "1.0.0");
    }

    public static BasicEditorPlugin html() {
        return new BasicEditorPlugin("html", "1.0.0");
    }

    public static BasicEditorPlugin link() {
        return new BasicEditorPlugin("link", "1.0.0");
    }

    public static BasicEditorPlugin media() {
        return new BasicEditorPlugin("media", "1.0.0");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public List<SettingEntry> buildSettings(EditorContext context, User user) {
        return List.of();
    }
}
