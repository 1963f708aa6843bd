package com.tinyeditor.services.lang;

import com.tinyeditor.core.config.ConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lists the language packs registered in the configuration, sorted by display name.
 */
public class LanguagePackCatalog implements LanguageCatalog {
    private static final Logger logger = LoggerFactory.getLogger(LanguagePackCatalog.class);
    private final ConfigManager configManager;

    public LanguagePackCatalog(ConfigManager configManager) {
        this.configManager = configManager;
    }

    @Override
    public Map<String, String> listInstalledTranslations() {
        Map<String, String> languages = configManager.getConfig().languages;
        if (languages == null || languages.isEmpty()) {
            logger.warn("No language packs configured. Falling back to English.");
            return Map.of("en", "English \u200E(en)\u200E");
        }

        List<Map.Entry<String, String>> entries = new ArrayList<>(languages.entrySet());
        Collator collator = Collator.getInstance(Locale.ROOT);
        entries.sort((a, b) -> {
            int byName = collator.compare(a.getValue(), b.getValue());
            return byName != 0 ? byName : a.getKey().compareTo(b.getKey());
        });

        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : entries) {
            result.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableMap(result);
    }
}
