package com.imperium.exhibitlinker.ingest.parser;

import java.util.Locale;

/**
 * 支持的源文档格式。
 */
public enum DocumentFormat {
    PDF,
    TEXT,
    MARKDOWN;

    public static DocumentFormat fromFileName(String fileName) {
        String ext = fileName.contains(".")
                ? fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT)
                : "";
        return switch (ext) {
            case "pdf" -> PDF;
            case "txt" -> TEXT;
            case "md", "markdown" -> MARKDOWN;
            default -> throw new IllegalArgumentException("Unsupported file extension: ." + ext);
        };
    }

    public boolean isText() {
        return this != PDF;
    }
}
