package com.findly.search.query;

import java.util.Locale;

public enum TargetLanguage {
    NL,
    EN;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns null for values outside the supported set so callers can reject them.
     */
    public static TargetLanguage fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        int dash = normalized.indexOf('-');
        if (dash > 0) {
            normalized = normalized.substring(0, dash);
        }
        for (TargetLanguage language : values()) {
            if (language.name().equals(normalized)) {
                return language;
            }
        }
        return null;
    }
}
