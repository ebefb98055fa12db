package com.imperium.exhibitlinker.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 启动前加载工作目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 以便 application.yaml 中的 ${EXHIBITS_ROOT} 等占位符能解析到 .env 里的值。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    private static final String EXHIBITS_ROOT_KEY = "EXHIBITS_ROOT";

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    /**
     * @return 实际写入系统属性的键值
     */
    public static Map<String, String> load(Path envPath) {
        Map<String, String> loaded = new LinkedHashMap<>();
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] .env file not found at: " + envPath);
            return loaded;
        }
        try {
            List<String> lines = Files.readAllLines(envPath);
            for (String line : lines) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                var matcher = ENV_LINE.matcher(trimmed);
                if (matcher.matches()) {
                    String key = matcher.group(1).trim();
                    String value = unquote(matcher.group(2).trim());

                    // 路径类变量：展开 ~，去掉结尾分隔符，避免拼出 //Ex_1.pdf
                    if (key.endsWith("_ROOT") || EXHIBITS_ROOT_KEY.equals(key)) {
                        String normalized = normalizePath(value);
                        if (!normalized.equals(value)) {
                            System.out.println("[DotenvLoader] Normalized " + key + ": " + value + " -> " + normalized);
                        }
                        value = normalized;
                    }
                    System.setProperty(key, value);
                    loaded.put(key, value);
                    System.out.println("[DotenvLoader] Loaded: " + key + " = " + value);
                }
            }
        } catch (Exception e) {
            System.err.println("[DotenvLoader] Failed to load .env: " + e.getMessage());
        }
        return loaded;
    }

    static String normalizePath(String value) {
        if (value == null) {
            return "";
        }
        String v = value.trim();
        if (v.equals("~") || v.startsWith("~/") || v.startsWith("~\\")) {
            v = System.getProperty("user.home") + v.substring(1);
        }
        while (v.length() > 1 && (v.endsWith("/") || v.endsWith("\\")) && !v.matches("^[A-Za-z]:[/\\\\]$")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }

    private DotenvLoader() {}
}
