package com.imperium.exhibitlinker.model.citation;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bates 编号，如 SMITH_005、SMITH-0005、ABC_DEF_000123.0002。
 * <p>
 * 相等性只看前缀、数值和子文档后缀，补零位数与分隔符不影响：SMITH_005 与 SMITH-0005 指同一页戳。
 */
@Getter
@EqualsAndHashCode
public final class BatesNumber implements Comparable<BatesNumber> {

    /**
     * 正文与页面文本中的 Bates 记号：大写字母前缀、分隔符、3 位以上数字、可选 .NNNN 子文档后缀。
     * 前面不能紧跟字母或下划线，后面不能紧跟数字或小写字母；文本抽取粘连的页戳（SMITH_005SMITH_006）按两个记号识别。
     */
    public static final Pattern TOKEN = Pattern.compile(
            "(?<![A-Za-z_])(?<prefix>[A-Z]+(?:_[A-Z]+)*)[_-](?<digits>\\d{3,})"
                    + "(?:\\.(?<suffix>\\d{1,4})(?![0-9]))?(?![0-9a-z])");

    private static final Pattern EXACT = Pattern.compile(
            "(?<prefix>[A-Z]+(?:_[A-Z]+)*)[_-](?<digits>\\d{3,})(?:\\.(?<suffix>\\d{1,4}))?");

    private final String prefix;

    @EqualsAndHashCode.Exclude
    private final String digits;

    private final long number;

    private final String suffix;

    public BatesNumber(String prefix, String digits, String suffix) {
        this.prefix = prefix.toUpperCase(Locale.ROOT);
        this.digits = digits;
        this.number = Long.parseLong(digits);
        this.suffix = (suffix == null || suffix.isEmpty()) ? null : suffix;
    }

    /**
     * 从 {@link #TOKEN} 或同结构的匹配结果构造。
     */
    public static BatesNumber fromMatch(Matcher matcher) {
        return new BatesNumber(matcher.group("prefix"), matcher.group("digits"), matcher.group("suffix"));
    }

    /**
     * 整串解析（大小写不敏感），不是 Bates 形式时返回空。
     */
    public static Optional<BatesNumber> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = EXACT.matcher(text.trim().toUpperCase(Locale.ROOT));
        if (!m.matches() || m.group("digits").length() > 18) {
            return Optional.empty();
        }
        return Optional.of(fromMatch(m));
    }

    /** 规范标签：PREFIX_DIGITS[.SUFFIX]，保留原始补零位数 */
    public String label() {
        return prefix + "_" + digits + (suffix != null ? "." + suffix : "");
    }

    public boolean samePrefix(BatesNumber other) {
        return other != null && prefix.equals(other.prefix);
    }

    @Override
    public int compareTo(BatesNumber o) {
        int c = prefix.compareTo(o.prefix);
        if (c != 0) {
            return c;
        }
        c = Long.compare(number, o.number);
        if (c != 0) {
            return c;
        }
        return String.valueOf(suffix).compareTo(String.valueOf(o.suffix));
    }

    @Override
    public String toString() {
        return label();
    }
}
