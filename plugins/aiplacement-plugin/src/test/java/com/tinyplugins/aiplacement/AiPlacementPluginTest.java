package com.tinyplugins.aiplacement;

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

class AiPlacementPluginTest {

    @TempDir
    Path toolsDir;

    private Kernel kernel;
    private EditorContext course;
    private User teacher;

    @BeforeEach
    void setUp() {
        kernel = new Kernel(toolsDir.toFile(), new PluginRegistry(List.of(new AiPlacementPlugin())));
        kernel.start();
        course = kernel.getContextManager().createCourse(2, 0);
        teacher = kernel.getUserManager().createUser("teacher", false);
        kernel.getCapabilityManager().assignRole(teacher.id(), "editingteacher", course.id());

        kernel.getConfigManager().getConfig().setPluginSetting(AiPlacementPlugin.PLACEMENT, "enabled", "1");
        kernel.getAiManager().createProviderInstance("aiprovider_openai", "openai", true);
        kernel.getAiManager().setActionState("openai", AiPlacementPlugin.ACTION_TEXT, true);
        kernel.getAiManager().setActionState("openai", AiPlacementPlugin.ACTION_IMAGE, true);
    }

    private List<PluginBlock> plugins(User user) {
        return kernel.getConfigurationService().getConfiguration("course", 2, user).plugins();
    }

    @Test
    void testBothActionsOffered() {
        List<PluginBlock> plugins = plugins(teacher);

        assertEquals(1, plugins.size());
        assertEquals(List.of(
                new SettingEntry("policyagreed", "0"),
                new SettingEntry("generate_text", "1"),
                new SettingEntry("generate_image", "1")), plugins.get(0).settings());
    }

    @Test
    void testPolicyAcceptance() {
        kernel.getAiManager().acceptPolicy(teacher.id());

        assertEquals("1", plugins(teacher).get(0).settings().get(0).value());
    }

    @Test
    void testSingleActionSwitchedOffOnPlacement() {
        kernel.getConfigManager().getConfig()
                .setPluginSetting(AiPlacementPlugin.PLACEMENT, AiPlacementPlugin.ACTION_IMAGE, "0");

        List<SettingEntry> settings = plugins(teacher).get(0).settings();

        assertEquals("1", settings.get(1).value());
        assertEquals("0", settings.get(2).value());
    }

    @Test
    void testMissingCapabilityTurnsActionOff() {
        kernel.getCapabilityManager().revoke("editingteacher", AiPlacementPlugin.CAP_IMAGE);

        List<SettingEntry> settings = plugins(teacher).get(0).settings();

        assertEquals("1", settings.get(1).value());
        assertEquals("0", settings.get(2).value());
    }

    @Test
    void testAbsentWhenPlacementDisabled() {
        kernel.getConfigManager().getConfig().setPluginSetting(AiPlacementPlugin.PLACEMENT, "enabled", "0");

        assertTrue(plugins(teacher).isEmpty());
    }

    @Test
    void testAbsentWhenProviderDisabled() {
        kernel.getConfigManager().getConfig().aiProviders.get(0).enabled = false;

        assertTrue(plugins(teacher).isEmpty());
    }

    @Test
    void testHiddenFromStudents() {
        User student = kernel.getUserManager().createUser("student", false);
        kernel.getCapabilityManager().assignRole(student.id(), "student", course.id());

        assertTrue(plugins(student).isEmpty());
    }
}
