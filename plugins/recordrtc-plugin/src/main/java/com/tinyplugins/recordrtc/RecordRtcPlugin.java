package com.tinyplugins.recordrtc;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.common.auth.PermissionChecker;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.config.ConfigStore;
import com.tinyeditor.core.config.Configuration;
import com.tinyeditor.core.context.EditorContext;
import com.tinyeditor.services.upload.UploadLimitService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * RecordRTC plugin: audio, video and screen recording inside the editor.
 *
 * Which recording types are offered depends on the configured allowed types and on
 * the record capabilities the user holds in the context.
 */
public class RecordRtcPlugin implements EditorPlugin {
    private static final Logger logger = LoggerFactory.getLogger(RecordRtcPlugin.class);

    public static final String NAMESPACE = "tiny_recordrtc";
    public static final String CAP_AUDIO = "tiny/recordrtc:recordaudio";
    public static final String CAP_VIDEO = "tiny/recordrtc:recordvideo";
    public static final String CAP_SCREEN = "tiny/recordrtc:recordscreen";

    static final String DEFAULT_WIDTH = "1280";
    static final String DEFAULT_HEIGHT = "720";

    private ConfigStore config;
    private PermissionChecker permissions;
    private UploadLimitService uploadLimits;

    @Override
    public String getName() {
        return "recordrtc";
    }

    @Override
    public String getVersion() {
        return "1.2.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        setupDefaultSettings(kernel.getConfigManager().getConfig());
        this.config = kernel.getConfigManager();
        this.permissions = kernel.getCapabilityManager();
        this.uploadLimits = kernel.getUploadLimitService();
        logger.info("RecordRTC plugin enabled (v{})", getVersion());
    }

    private void setupDefaultSettings(Configuration config) {
        config.setDefaultPluginSetting(NAMESPACE, "allowedtypes", "both");
        config.setDefaultPluginSetting(NAMESPACE, "allowedpausing", "0");
        config.setDefaultPluginSetting(NAMESPACE, "audiobitrate", "128000");
        config.setDefaultPluginSetting(NAMESPACE, "videobitrate", "2500000");
        config.setDefaultPluginSetting(NAMESPACE, "screenbitrate", "2500000");
        config.setDefaultPluginSetting(NAMESPACE, "audiotimelimit", "120");
        config.setDefaultPluginSetting(NAMESPACE, "videotimelimit", "120");
        config.setDefaultPluginSetting(NAMESPACE, "screentimelimit", "120");
        config.setDefaultPluginSetting(NAMESPACE, "screensize", DEFAULT_WIDTH + "," + DEFAULT_HEIGHT);
    }

    @Override
    public List<String> getRequiredCapabilities() {
        return List.of(CAP_AUDIO, CAP_VIDEO, CAP_SCREEN);
    }

    @Override
    public List<SettingEntry> buildSettings(EditorContext context, User user) {
        String allowedTypes = setting("allowedtypes", "both");
        Set<String> types = parseAllowedTypes(allowedTypes);
        String[] screenSize = parseScreenSize(setting("screensize", DEFAULT_WIDTH + "," + DEFAULT_HEIGHT));

        boolean video = types.contains("video") && permissions.hasCapability(user, CAP_VIDEO, context);
        boolean audio = types.contains("audio") && permissions.hasCapability(user, CAP_AUDIO, context);
        boolean screen = types.contains("screen") && permissions.hasCapability(user, CAP_SCREEN, context);

        List<SettingEntry> settings = new ArrayList<>();
        settings.add(SettingEntry.of("videoallowed", video));
        settings.add(SettingEntry.of("audioallowed", audio));
        settings.add(SettingEntry.of("screenallowed", screen));
        settings.add(new SettingEntry("pausingallowed", setting("allowedpausing", "0")));
        settings.add(new SettingEntry("allowedtypes", allowedTypes));
        settings.add(new SettingEntry("audiobitrate", setting("audiobitrate", "128000")));
        settings.add(new SettingEntry("videobitrate", setting("videobitrate", "2500000")));
        settings.add(new SettingEntry("screenbitrate", setting("screenbitrate", "2500000")));
        settings.add(new SettingEntry("audiotimelimit", setting("audiotimelimit", "120")));
        settings.add(new SettingEntry("videotimelimit", setting("videotimelimit", "120")));
        settings.add(new SettingEntry("screentimelimit", setting("screentimelimit", "120")));
        settings.add(SettingEntry.of("maxrecsize", uploadLimits.maxUploadSize(context)));
        settings.add(new SettingEntry("videoscreenwidth", screenSize[0]));
        settings.add(new SettingEntry("videoscreenheight", screenSize[1]));
        return settings;
    }

    private String setting(String key, String defaultValue) {
        return config.get(NAMESPACE, key, defaultValue);
    }

    /**
     * Expands "both" to audio and video, "all" to every type.
     */
    static Set<String> parseAllowedTypes(String raw) {
        Set<String> types = new LinkedHashSet<>();
        if (raw == null) return types;
        for (String part : raw.split(",")) {
            String type = part.trim().toLowerCase();
            switch (type) {
                case "both" -> {
                    types.add("audio");
                    types.add("video");
                }
                case "all" -> {
                    types.add("audio");
                    types.add("video");
                    types.add("screen");
                }
                case "audio", "video", "screen" -> types.add(type);
                default -> {
                    if (!type.isEmpty()) logger.warn("Ignoring unknown recording type: {}", type);
                }
            }
        }
        return types;
    }

    /**
     * Splits "width,height". Falls back to the default size when the value is malformed.
     */
    static String[] parseScreenSize(String raw) {
        if (raw != null) {
            String[] parts = raw.split(",");
            if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
                return new String[] { parts[0].trim(), parts[1].trim() };
            }
        }
        logger.warn("Malformed {}/screensize '{}'. Using {}x{}.", NAMESPACE, raw, DEFAULT_WIDTH, DEFAULT_HEIGHT);
        return new String[] { DEFAULT_WIDTH, DEFAULT_HEIGHT };
    }
}
