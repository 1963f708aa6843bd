package com.tinyeditor.core.context;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

public enum ContextLevel {
    @SerializedName("system") SYSTEM("system"),
    @SerializedName("user") USER("user"),
    @SerializedName("coursecat") COURSECAT("coursecat"),
    @SerializedName("course") COURSE("course"),
    @SerializedName("module") MODULE("module"),
    @SerializedName("block") BLOCK("block");

    private final String shortName;

    ContextLevel(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * @return the level for a short name such as "course", or null if unknown
     */
    public static ContextLevel fromShortName(String name) {
        if (name == null) return null;
        String clean = name.trim().toLowerCase(Locale.ROOT);
        for (ContextLevel level : values()) {
            if (level.shortName.equals(clean)) return level;
        }
        return null;
    }
}
