package com.tinyplugins.premium;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.config.ConfigStore;
import com.tinyeditor.core.config.Configuration;
import com.tinyeditor.core.context.EditorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Bridge to the commercial editor plugins. Needs an API key, each premium plugin is
 * switched on separately under its own namespace ("tiny_premium_" + plugin).
 */
public class PremiumPlugin implements EditorPlugin {
    private static final Logger logger = LoggerFactory.getLogger(PremiumPlugin.class);

    public static final String NAMESPACE = "tiny_premium";
    public static final String CAP_ACCESS = "tiny/premium:accesspremium";

    private static final List<String> PREMIUM_PLUGINS = List.of(
            "a11ychecker",
            "advcode",
            "advtable",
            "autocorrect",
            "casechange",
            "checklist",
            "editimage",
            "export",
            "footnotes",
            "formatpainter",
            "inlinecss",
            "linkchecker",
            "markdown",
            "math",
            "pageembed",
            "permanentpen",
            "powerpaste",
            "revisionhistory",
            "tableofcontents",
            "tinycomments",
            "tinymcespellchecker",
            "typography");

    private ConfigStore config;

    @Override
    public String getName() {
        return "premium";
    }

    @Override
    public String getVersion() {
        return "1.1.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        Configuration configuration = kernel.getConfigManager().getConfig();
        configuration.setDefaultPluginSetting(NAMESPACE, "apikey", "");
        for (String plugin : PREMIUM_PLUGINS) {
            configuration.setDefaultPluginSetting(pluginNamespace(plugin), "enabled", "0");
        }
        this.config = kernel.getConfigManager();
        logger.info("Premium plugin enabled (v{}), {} premium plugins known", getVersion(), PREMIUM_PLUGINS.size());
    }

    public static List<String> getPlugins() {
        return PREMIUM_PLUGINS;
    }

    public static String pluginNamespace(String plugin) {
        return NAMESPACE + "_" + plugin;
    }

    @Override
    public List<String> getRequiredCapabilities() {
        return List.of(CAP_ACCESS);
    }

    @Override
    public boolean isAvailable(EditorContext context, User user) {
        return !config.get(NAMESPACE, "apikey", "").isBlank();
    }

    public List<String> getEnabledPlugins() {
        List<String> enabled = new ArrayList<>();
        for (String plugin : PREMIUM_PLUGINS) {
            if ("1".equals(config.get(pluginNamespace(plugin), "enabled"))) {
                enabled.add(plugin);
            }
        }
        return enabled;
    }

    @Override
    public List<SettingEntry> buildSettings(EditorContext context, User user) {
        return List.of(new SettingEntry("premiumplugins", String.join(",", getEnabledPlugins())));
    }
}
