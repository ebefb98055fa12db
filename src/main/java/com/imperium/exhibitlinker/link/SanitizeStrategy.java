package com.imperium.exhibitlinker.link;

import java.util.Locale;

/**
 * 文件名规范化的落地方式：改名，或复制一份新名字的文件。
 */
public enum SanitizeStrategy {
    RENAME,
    COPY;

    public static SanitizeStrategy fromString(String value) {
        if (value == null || value.isBlank()) {
            return RENAME;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "rename", "move" -> RENAME;
            case "copy" -> COPY;
            default -> throw new IllegalArgumentException("Unsupported sanitize strategy: " + value);
        };
    }
}
