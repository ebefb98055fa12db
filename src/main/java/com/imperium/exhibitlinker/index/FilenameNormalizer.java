package com.imperium.exhibitlinker.index;

import com.imperium.exhibitlinker.model.citation.BatesNumber;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文件名与引用标签的规范化规则，索引与匹配两侧共用。
 */
public final class FilenameNormalizer {

    private static final Pattern SEPARATOR_RUN = Pattern.compile("[\\s\\p{Punct}\\u00A0]+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{Alnum}]+");
    private static final Pattern EXTENSION = Pattern.compile("\\.([A-Za-z0-9]{1,8})$");
    private static final Pattern EXHIBIT_KEYWORD = Pattern.compile("^(?:exhibit|exh|ex)_(.+)$");

    /** SMITH_003、SMITH003、SMITH_003-SMITH_006、SMITH_003 - 006 */
    private static final Pattern BATES_NAME = Pattern.compile(
            "^(?<prefix>[A-Z]+(?:_[A-Z]+)*)[_-]?(?<start>\\d{3,18})"
                    + "(?:\\s*(?:-|_|TO|THRU)\\s*(?:[A-Z]+(?:_[A-Z]+)*[_-]?)?(?<end>\\d{3,18}))?$");

    /**
     * 小写，空白与标点连续出现时折叠成一个下划线，去掉首尾下划线。
     * 传入的应是已去扩展名的部分。
     */
    public static String normalize(String stem) {
        if (stem == null) {
            return "";
        }
        String lower = stem.toLowerCase(Locale.ROOT);
        String collapsed = SEPARATOR_RUN.matcher(lower).replaceAll("_");
        return trimUnderscores(collapsed);
    }

    /** 去掉所有非字母数字，用于忽略残余标点差异（如 1-A 与 1A） */
    public static String compact(String value) {
        if (value == null) {
            return "";
        }
        return NON_ALNUM.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * 去掉规范化名开头的 ex / exh / exhibit 关键字；不是 Exhibit 命名时返回 null。
     */
    public static String exhibitKey(String normalizedName) {
        if (normalizedName == null) {
            return null;
        }
        Matcher m = EXHIBIT_KEYWORD.matcher(normalizedName);
        return m.matches() ? m.group(1) : null;
    }

    public static String extension(String fileName) {
        Matcher m = EXTENSION.matcher(fileName);
        return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "";
    }

    public static String stem(String fileName) {
        Matcher m = EXTENSION.matcher(fileName);
        return m.find() ? fileName.substring(0, m.start()) : fileName;
    }

    /**
     * 文件名（去扩展名）编码的 Bates 起止编号。
     *
     * @return 不是 Bates 命名返回空；end 可能为 null
     */
    public static Optional<BatesSpan> batesSpan(String stem) {
        if (stem == null || stem.isBlank()) {
            return Optional.empty();
        }
        Matcher m = BATES_NAME.matcher(stem.trim().toUpperCase(Locale.ROOT));
        if (!m.matches()) {
            return Optional.empty();
        }
        String prefix = m.group("prefix");
        BatesNumber start = new BatesNumber(prefix, m.group("start"), null);
        BatesNumber end = m.group("end") != null ? new BatesNumber(prefix, m.group("end"), null) : null;
        if (end != null && end.getNumber() < start.getNumber()) {
            end = null;
        }
        return Optional.of(new BatesSpan(start, end));
    }

    private static String trimUnderscores(String s) {
        int from = 0;
        int to = s.length();
        while (from < to && s.charAt(from) == '_') {
            from++;
        }
        while (to > from && s.charAt(to - 1) == '_') {
            to--;
        }
        return s.substring(from, to);
    }

    public record BatesSpan(BatesNumber start, BatesNumber end) {}

    private FilenameNormalizer() {}
}
