package com.tinyplugins.h5p;

import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.PluginBlock;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.context.EditorContext;
import com.tinyeditor.core.plugin.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class H5pPluginTest {

    @TempDir
    Path toolsDir;

    private Kernel kernel;
    private EditorContext course;

    @BeforeEach
    void setUp() {
        kernel = new Kernel(toolsDir.toFile(), new PluginRegistry(List.of(new H5pPlugin())));
        kernel.start();
        course = kernel.getContextManager().createCourse(2, 0);
    }

    private List<PluginBlock> pluginsFor(String role) {
        User user = kernel.getUserManager().createUser(role + "1", false);
        kernel.getCapabilityManager().assignRole(user.id(), role, course.id());
        return kernel.getConfigurationService().getConfiguration("course", 2, user).plugins();
    }

    @Test
    void testEditingTeacherMayEmbedAndUpload() {
        List<PluginBlock> plugins = pluginsFor("editingteacher");

        assertEquals(1, plugins.size());
        assertEquals(List.of(new SettingEntry("embedallowed", "1"), new SettingEntry("uploadallowed", "1")),
                plugins.get(0).settings());
    }

    @Test
    void testTeacherMayOnlyEmbed() {
        List<PluginBlock> plugins = pluginsFor("teacher");

        assertEquals(List.of(new SettingEntry("embedallowed", "1"), new SettingEntry("uploadallowed", "0")),
                plugins.get(0).settings());
    }

    @Test
    void testHiddenWithoutEmbedCapability() {
        assertTrue(pluginsFor("guest").isEmpty());
        assertTrue(pluginsFor("student").isEmpty());
    }

    @Test
    void testDisabledPluginIsLeftOut() {
        kernel.getConfigManager().getConfig().setPluginEnabled("h5p", false);

        assertTrue(pluginsFor("editingteacher").isEmpty());
    }
}
