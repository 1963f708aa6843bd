package com.tinyeditor.core.plugin;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed, ordered set of editor plugins. The order in which plugins are registered is
 * the order in which they reach the editor.
 */
public class PluginRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, EditorPlugin> registered = new LinkedHashMap<>();
    private final Map<String, EditorPlugin> activePlugins = new LinkedHashMap<>();
    private boolean enabled;

    public PluginRegistry(List<? extends EditorPlugin> plugins) {
        for (EditorPlugin plugin : plugins) {
            if (registered.containsKey(plugin.getName())) {
                logger.warn("Plugin {} is already registered. Skipping duplicate.", plugin.getName());
                continue;
            }
            registered.put(plugin.getName(), plugin);
        }
    }

    /**
     * Hands the kernel to every plugin once. A plugin failing here is left out for the
     * lifetime of the process.
     */
    public synchronized void enableAll(Kernel kernel) {
        if (enabled) return;
        enabled = true;

        Configuration config = kernel.getConfigManager().getConfig();
        for (EditorPlugin plugin : registered.values()) {
            String name = plugin.getName();
            if (!config.plugins.containsKey(name)) {
                logger.info("New plugin discovered: {}", name);
                config.setPluginEnabled(name, true);
            }
            try {
                logger.info("Loading plugin: {} v{}", name, plugin.getVersion());
                plugin.onEnable(kernel);
                activePlugins.put(name, plugin);
                if (!config.isPluginEnabled(name)) {
                    logger.info("Plugin {} is disabled in config.", name);
                }
            } catch (Exception e) {
                logger.error("Failed to enable plugin: " + name, e);
            }
        }
    }

    /**
     * @return the enabled plugins in registration order, empty until {@link #enableAll} ran
     */
    public synchronized List<EditorPlugin> getPlugins() {
        return Collections.unmodifiableList(new ArrayList<>(activePlugins.values()));
    }

    public synchronized EditorPlugin getPlugin(String name) {
        return activePlugins.get(name);
    }

    public synchronized boolean isEnabled() {
        return enabled;
    }

    public int size() {
        return registered.size();
    }
}
