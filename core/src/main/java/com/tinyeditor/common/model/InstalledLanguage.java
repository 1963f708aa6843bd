package com.tinyeditor.common.model;

public record InstalledLanguage(String lang, String name) {}
