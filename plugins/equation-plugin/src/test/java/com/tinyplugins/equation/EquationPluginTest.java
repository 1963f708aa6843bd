package com.tinyplugins.equation;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.tinyeditor.common.auth.User;
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

class EquationPluginTest {

    @TempDir
    Path toolsDir;

    private Kernel kernel;
    private EquationPlugin plugin;
    private EditorContext course;
    private User user;

    @BeforeEach
    void setUp() {
        plugin = new EquationPlugin();
        kernel = new Kernel(toolsDir.toFile(), new PluginRegistry(List.of(plugin)));
        kernel.start();
        course = kernel.getContextManager().createCourse(2, 0);
        user = kernel.getUserManager().createUser("teacher", false);
    }

    private String value(String name) {
        return plugin.buildSettings(course, user).stream()
                .filter(e -> e.name().equals(name))
                .map(SettingEntry::value)
                .findFirst().orElseThrow();
    }

    @Test
    void testSettingOrder() {
        assertEquals(List.of("texfilter", "libraries", "texdocsurl"),
                plugin.buildSettings(course, user).stream().map(SettingEntry::name).toList());
    }

    @Test
    void testTexFilter() {
        assertEquals("1", value("texfilter"));

        kernel.getConfigManager().getConfig().setPluginSetting("filter_tex", "active", "0");
        assertEquals("0", value("texfilter"));
    }

    @Test
    void testLibrariesAreEncodedAsJson() {
        JsonArray groups = JsonParser.parseString(value("libraries")).getAsJsonArray();

        assertEquals(4, groups.size());
        JsonObject first = groups.get(0).getAsJsonObject();
        assertEquals("group1", first.get("key").getAsString());
        assertEquals("Operators", first.get("groupname").getAsString());
        assertTrue(first.get("active").getAsBoolean());
        assertEquals("\\cdot", first.getAsJsonArray("elements").get(0).getAsString());

        JsonObject third = groups.get(2).getAsJsonObject();
        assertEquals("group3", third.get("key").getAsString());
        assertEquals("Greek symbols", third.get("groupname").getAsString());
        assertFalse(third.has("active"), "Only the first group is marked active");
    }

    @Test
    void testLibraryGroupFromConfig() {
        kernel.getConfigManager().getConfig()
                .setPluginSetting(EquationPlugin.NAMESPACE, "librarygroup2", "\n\\to\n\\gets\n\n");

        JsonObject second = JsonParser.parseString(value("libraries")).getAsJsonArray().get(1).getAsJsonObject();
        JsonArray elements = second.getAsJsonArray("elements");

        assertEquals(2, elements.size());
        assertEquals("\\to", elements.get(0).getAsString());
        assertEquals("\\gets", elements.get(1).getAsString());
    }

    @Test
    void testSplitKeepsInnerBlankLines() {
        assertEquals(List.of("a", "", "b"), EquationPlugin.splitElements("  a\n\nb \n"));
    }

    @Test
    void testDocsUrl() {
        assertEquals("https://docs.moodle.org/500/en/Using_TeX_Notation", value("texdocsurl"));

        kernel.getConfigManager().getConfig().setPluginSetting("core", "lang", "de");
        assertEquals("https://docs.moodle.org/500/de/Using_TeX_Notation", value("texdocsurl"));
    }
}
