package com.tinyeditor.common.model;

/**
 * A single plugin setting. Values always travel as text.
 */
public record SettingEntry(String name, String value) {

    public static SettingEntry of(String name, boolean value) {
        return new SettingEntry(name, value ? "1" : "0");
    }

    public static SettingEntry of(String name, long value) {
        return new SettingEntry(name, String.valueOf(value));
    }
}
