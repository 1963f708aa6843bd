package com.tinyeditor.services.lang;

import java.util.Map;

public interface LanguageCatalog {

    /**
     * @return installed translations, language code to display name, in display order
     */
    Map<String, String> listInstalledTranslations();
}
