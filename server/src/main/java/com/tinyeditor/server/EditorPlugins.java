package com.tinyeditor.server;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.core.plugin.PluginRegistry;
import com.tinyplugins.BasicEditorPlugin;
import com.tinyplugins.aiplacement.AiPlacementPlugin;
import com.tinyplugins.equation.EquationPlugin;
import com.tinyplugins.h5p.H5pPlugin;
import com.tinyplugins.premium.PremiumPlugin;
import com.tinyplugins.recordrtc.RecordRtcPlugin;

import java.util.List;

/**
 * The editor plugins this server ships with, in the order the editor receives them.
 */
public final class EditorPlugins {

    private EditorPlugins() {
    }

    public static List<EditorPlugin> all() {
        return List.of(
                BasicEditorPlugin.accessibilityChecker(),
                new AiPlacementPlugin(),
                BasicEditorPlugin.autosave(),
                new EquationPlugin(),
                new H5pPlugin(),
                BasicEditorPlugin.html(),
                BasicEditorPlugin.link(),
                BasicEditorPlugin.media(),
                new PremiumPlugin(),
                new RecordRtcPlugin());
    }

    public static PluginRegistry createRegistry() {
        return new PluginRegistry(all());
    }
}
