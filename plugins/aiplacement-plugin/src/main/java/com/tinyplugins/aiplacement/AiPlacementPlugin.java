package com.tinyplugins.aiplacement;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.common.auth.PermissionChecker;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.context.EditorContext;
import com.tinyeditor.services.ai.AiManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * AI actions (text and image generation) inside the editor.
 */
public class AiPlacementPlugin implements EditorPlugin {
    private static final Logger logger = LoggerFactory.getLogger(AiPlacementPlugin.class);

    public static final String PLACEMENT = "aiplacement_editor";
    public static final String ACTION_TEXT = "generate_text";
    public static final String ACTION_IMAGE = "generate_image";
    public static final String CAP_TEXT = "aiplacement/editor:generate_text";
    public static final String CAP_IMAGE = "aiplacement/editor:generate_image";

    private AiManager aiManager;
    private PermissionChecker permissions;

    @Override
    public String getName() {
        return "aiplacement";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        var config = kernel.getConfigManager().getConfig();
        config.setDefaultPluginSetting(PLACEMENT, "enabled", "0");
        config.setDefaultPluginSetting(PLACEMENT, ACTION_TEXT, "1");
        config.setDefaultPluginSetting(PLACEMENT, ACTION_IMAGE, "1");
        this.aiManager = kernel.getAiManager();
        this.permissions = kernel.getCapabilityManager();
        logger.info("AI placement plugin enabled (v{})", getVersion());
    }

    @Override
    public List<String> getRequiredCapabilities() {
        return List.of(CAP_TEXT, CAP_IMAGE);
    }

    @Override
    public boolean isAvailable(EditorContext context, User user) {
        return aiManager.isPlacementEnabled(PLACEMENT)
                && (aiManager.isActionAvailable(PLACEMENT, ACTION_TEXT)
                || aiManager.isActionAvailable(PLACEMENT, ACTION_IMAGE));
    }

    @Override
    public List<SettingEntry> buildSettings(EditorContext context, User user) {
        List<SettingEntry> settings = new ArrayList<>();
        settings.add(SettingEntry.of("policyagreed", aiManager.hasUserAcceptedPolicy(user.id())));
        settings.add(SettingEntry.of(ACTION_TEXT, isActionAllowed(ACTION_TEXT, CAP_TEXT, context, user)));
        settings.add(SettingEntry.of(ACTION_IMAGE, isActionAllowed(ACTION_IMAGE, CAP_IMAGE, context, user)));
        return settings;
    }

    private boolean isActionAllowed(String action, String capability, EditorContext context, User user) {
        return aiManager.isActionAvailable(PLACEMENT, action) && permissions.hasCapability(user, capability, context);
    }
}
