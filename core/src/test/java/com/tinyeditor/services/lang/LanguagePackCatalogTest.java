package com.tinyeditor.services.lang;

import com.tinyeditor.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LanguagePackCatalogTest extends TestBase {

    @Test
    void testEnglishIsInstalledByDefault() {
        Map<String, String> languages = kernel.getLanguageCatalog().listInstalledTranslations();

        assertEquals(List.of("en"), List.copyOf(languages.keySet()));
    }

    @Test
    void testSortedByDisplayName() {
        var config = kernel.getConfigManager().getConfig();
        config.languages.put("fr", "Français \u200E(fr)\u200E");
        config.languages.put("de", "Deutsch \u200E(de)\u200E");

        Map<String, String> languages = kernel.getLanguageCatalog().listInstalledTranslations();

        assertEquals(List.of("de", "en", "fr"), List.copyOf(languages.keySet()));
        assertEquals("Deutsch \u200E(de)\u200E", languages.get("de"));
    }

    @Test
    void testEmptyCatalogFallsBackToEnglish() {
        kernel.getConfigManager().getConfig().languages.clear();

        assertEquals(List.of("en"), List.copyOf(kernel.getLanguageCatalog().listInstalledTranslations().keySet()));
    }
}
