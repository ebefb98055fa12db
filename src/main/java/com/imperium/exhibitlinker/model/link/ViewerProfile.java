package com.imperium.exhibitlinker.model.link;

import java.util.Locale;

/**
 * 目标 PDF 阅读器。两者都接受 #page=N，但 Chrome 会把含空格或句点的文件名误当成网络地址。
 */
public enum ViewerProfile {
    ACROBAT,
    CHROME;

    public static ViewerProfile fromString(String value) {
        if (value == null || value.isBlank()) {
            return ACROBAT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "chrome" -> CHROME;
            case "acrobat", "adobe" -> ACROBAT;
            default -> throw new IllegalArgumentException("Unsupported viewer: " + value);
        };
    }

    public String pageFragment(int page) {
        return "#page=" + page;
    }
}
