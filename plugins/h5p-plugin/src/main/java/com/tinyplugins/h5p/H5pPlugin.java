package com.tinyplugins.h5p;

import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.common.auth.PermissionChecker;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.context.EditorContext;

import java.util.List;

/**
 * Embedding of H5P content. Only offered to users who may embed.
 */
public class H5pPlugin implements EditorPlugin {
    public static final String CAP_EMBED = "tiny/h5p:addembed";
    public static final String CAP_DEPLOY = "moodle/h5p:deploy";

    private PermissionChecker permissions;

    @Override
    public String getName() {
        return "h5p";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.permissions = kernel.getCapabilityManager();
    }

    @Override
    public List<String> getRequiredCapabilities() {
        return List.of(CAP_EMBED);
    }

    @Override
    public List<SettingEntry> buildSettings(EditorContext context, User user) {
        return List.of(
                SettingEntry.of("embedallowed", permissions.hasCapability(user, CAP_EMBED, context)),
                SettingEntry.of("uploadallowed", permissions.hasCapability(user, CAP_DEPLOY, context)));
    }
}
