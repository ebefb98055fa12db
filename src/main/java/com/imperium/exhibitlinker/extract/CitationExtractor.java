package com.imperium.exhibitlinker.extract;

import com.imperium.exhibitlinker.model.citation.BatesNumber;
import com.imperium.exhibitlinker.model.citation.Citation;
import com.imperium.exhibitlinker.model.citation.CitationKind;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从正文中识别 Exhibit 引用与 Bates 编号。
 * <p>
 * 返回的序列是惰性的、可重复遍历的：每次 iterator() 都从头重新扫描，按文档顺序产出。
 * 位置重叠时起点靠前者优先，同起点取较长者，等长时 Exhibit 形式优先。不按 label 去重。
 */
@Component
public class CitationExtractor {

    private static final String TITLE_STOP =
            "(?i:ex|exh|exhibit|at|and|or|to|the|of|in|on|for|from|with|by|vs|v)";

    /**
     * Ex. 1 Memo, at p. 9 / Exhibit A / Exh. 2B / Ex_3。
     * 标题由紧跟编号的大写开头单词组成，遇到下一个引用词、"at" 或连接词（And、To、The、Of 等）即止。
     */
    static final Pattern EXHIBIT = Pattern.compile(
            "\\b(?i:exhibit|exh\\.|ex\\.|ex(?=[\\s\\u00A0_]))[\\s\\u00A0_]*"
                    + "(?<id>\\d+[A-Za-z]?\\b|[A-Z]{1,3}\\b)"
                    + "(?<title>(?:[ \\t\\u00A0]+(?!" + TITLE_STOP + "\\b)[A-Z][A-Za-z0-9&'-]*\\b)*)"
                    + "(?:,?[ \\t\\u00A0]+at[ \\t\\u00A0]+(?i:p\\.|pp\\.|pg\\.|page)[ \\t\\u00A0]*(?<page>\\d+))?");

    private static final Pattern BLANKS = Pattern.compile("[\\s\\u00A0]+");

    private static final int MAX_PAGE_DIGITS = 9;

    public Iterable<Citation> extract(String text) {
        return extract(text, Set.of());
    }

    /**
     * @param batesPrefixes 只接受这些前缀的 Bates 编号；为空表示不限
     */
    public Iterable<Citation> extract(String text, Collection<String> batesPrefixes) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        Set<String> prefixes = new LinkedHashSet<>();
        if (batesPrefixes != null) {
            for (String p : batesPrefixes) {
                if (p != null && !p.isBlank()) {
                    prefixes.add(p.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return () -> new CitationIterator(text, prefixes);
    }

    static Citation exhibitCitation(Matcher m) {
        String id = m.group("id").toUpperCase(Locale.ROOT);
        String title = m.group("title");
        String label = id;
        if (title != null && !title.isBlank()) {
            label = id + " " + BLANKS.matcher(title.trim()).replaceAll(" ");
        }
        Integer pageHint = null;
        String page = m.group("page");
        if (page != null && page.length() <= MAX_PAGE_DIGITS) {
            pageHint = Integer.parseInt(page);
        }
        return Citation.builder()
                .kind(CitationKind.EXHIBIT)
                .rawText(m.group())
                .label(label)
                .identifier(id)
                .pageHint(pageHint)
                .sourceOffset(m.start())
                .build();
    }

    static Citation batesCitation(Matcher m) {
        BatesNumber bates = BatesNumber.fromMatch(m);
        return Citation.builder()
                .kind(CitationKind.BATES)
                .rawText(m.group())
                .label(bates.label())
                .identifier(bates.label())
                .sourceOffset(m.start())
                .bates(bates)
                .build();
    }

    private static final class CitationIterator implements Iterator<Citation> {

        private final Set<String> prefixes;
        private final Matcher exhibit;
        private final Matcher bates;
        private final int length;

        private int position;
        private Citation nextExhibit;
        private Citation nextBates;
        private boolean exhibitDone;
        private boolean batesDone;

        private CitationIterator(String text, Set<String> prefixes) {
            this.prefixes = prefixes;
            this.exhibit = EXHIBIT.matcher(text);
            this.bates = BatesNumber.TOKEN.matcher(text);
            this.length = text.length();
        }

        @Override
        public boolean hasNext() {
            advance();
            return nextExhibit != null || nextBates != null;
        }

        @Override
        public Citation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Citation chosen;
            if (nextBates == null) {
                chosen = nextExhibit;
            } else if (nextExhibit == null) {
                chosen = nextBates;
            } else {
                chosen = preferred(nextExhibit, nextBates);
            }
            position = chosen.getEndOffset();
            return chosen;
        }

        private static Citation preferred(Citation ex, Citation bt) {
            if (ex.getSourceOffset() != bt.getSourceOffset()) {
                return ex.getSourceOffset() < bt.getSourceOffset() ? ex : bt;
            }
            return bt.getRawText().length() > ex.getRawText().length() ? bt : ex;
        }

        /** 丢弃起点落在已产出引用之内的候选，并补齐两种形式各自的下一个候选 */
        private void advance() {
            if (nextExhibit != null && nextExhibit.getSourceOffset() < position) {
                nextExhibit = null;
            }
            if (nextBates != null && nextBates.getSourceOffset() < position) {
                nextBates = null;
            }
            if (nextExhibit == null && !exhibitDone) {
                nextExhibit = findExhibit();
            }
            if (nextBates == null && !batesDone) {
                nextBates = findBates();
            }
        }

        private Citation findExhibit() {
            if (position <= length && exhibit.find(position)) {
                return exhibitCitation(exhibit);
            }
            exhibitDone = true;
            return null;
        }

        private Citation findBates() {
            int from = position;
            while (from <= length && bates.find(from)) {
                if (bates.group("digits").length() <= 18
                        && (prefixes.isEmpty() || prefixes.contains(bates.group("prefix")))) {
                    return batesCitation(bates);
                }
                from = bates.end();
            }
            batesDone = true;
            return null;
        }
    }
}
