package com.imperium.exhibitlinker.match;

import com.imperium.exhibitlinker.index.FileIndex;
import com.imperium.exhibitlinker.index.FilenameNormalizer;
import com.imperium.exhibitlinker.model.citation.BatesNumber;
import com.imperium.exhibitlinker.model.citation.Citation;
import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.index.PdfScan;
import com.imperium.exhibitlinker.model.link.Match;
import com.imperium.exhibitlinker.model.link.MatchConfidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 引用 × 文件索引 → Match，每条引用恰好一个结果。
 * <p>
 * Exhibit 引用依次尝试 EXACT、NORMALIZED、FUZZY；Bates 引用依次尝试页面包含、文件名相等、
 * 以及无法扫描文件的范围推断，不做模糊匹配。任一层出现多个不同候选时判为未解析，不猜测。
 */
public class CitationMatcher {

    private static final Logger log = LoggerFactory.getLogger(CitationMatcher.class);

    private final FileIndex index;
    private final double fuzzyThreshold;
    private final double tieEpsilon;

    public CitationMatcher(FileIndex index, double fuzzyThreshold, double tieEpsilon) {
        this.index = index;
        this.fuzzyThreshold = fuzzyThreshold;
        this.tieEpsilon = tieEpsilon;
    }

    public Match match(Citation citation) {
        Match match = switch (citation.getKind()) {
            case EXHIBIT -> matchExhibit(citation);
            case BATES -> matchBates(citation);
        };
        if (match.isResolved()) {
            log.debug("{} -> {} ({})", citation.getRawText(), match.getFile().getRelativeKey(), match.getConfidence());
        } else {
            log.debug("{} unresolved: {}", citation.getRawText(), match.getUnresolvedReason());
        }
        return match;
    }

    // ---------- Exhibit ----------

    private Match matchExhibit(Citation citation) {
        if (index.isEmpty()) {
            return Match.unresolved(citation, "Exhibits folder is empty");
        }
        String label = FilenameNormalizer.normalize(citation.getLabel());
        String id = FilenameNormalizer.normalize(citation.getIdentifier());

        List<CandidateFile> exact = filter(f -> label.equals(f.getExhibitKey()) || label.equals(f.getNormalizedName()));
        if (!exact.isEmpty()) {
            return pick(citation, exact, MatchConfidence.EXACT);
        }

        List<List<CandidateFile>> normalizedTiers = new ArrayList<>();
        normalizedTiers.add(filter(f -> sameCompact(label, f)));
        normalizedTiers.add(filter(f -> startsWithKey(f, label)));
        if (!id.equals(label)) {
            normalizedTiers.add(filter(f -> sameCompact(id, f)));
            normalizedTiers.add(filter(f -> startsWithKey(f, id)));
        }
        for (List<CandidateFile> tier : normalizedTiers) {
            if (!tier.isEmpty()) {
                return pick(citation, tier, MatchConfidence.NORMALIZED);
            }
        }
        return fuzzy(citation, label);
    }

    private static boolean sameCompact(String value, CandidateFile f) {
        String compact = FilenameNormalizer.compact(value);
        return !compact.isEmpty() && compact.equals(FilenameNormalizer.compact(f.matchKey()));
    }

    private static boolean startsWithKey(CandidateFile f, String value) {
        return f.getExhibitKey() != null && !value.isEmpty() && f.getExhibitKey().startsWith(value + "_");
    }

    private Match fuzzy(Citation citation, String label) {
        if (label.isEmpty()) {
            return Match.unresolved(citation, "Empty exhibit label");
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        for (CandidateFile f : index.getFiles()) {
            scores.computeIfAbsent(f.matchKey(), key -> EditDistance.similarity(label, key));
        }
        List<Map.Entry<String, Double>> ranked = new ArrayList<>(scores.entrySet());
        ranked.sort(Map.Entry.<String, Double>comparingByValue().reversed());
        Map.Entry<String, Double> top = ranked.get(0);
        if (top.getValue() < fuzzyThreshold) {
            return Match.unresolved(citation, String.format("No file matches exhibit label '%s' (best '%s' at %.2f)",
                    citation.getLabel(), top.getKey(), top.getValue()));
        }
        if (ranked.size() > 1 && top.getValue() - ranked.get(1).getValue() <= tieEpsilon) {
            return Match.unresolved(citation, String.format("Ambiguous fuzzy match for '%s': '%s' and '%s' at %.2f",
                    citation.getLabel(), top.getKey(), ranked.get(1).getKey(), top.getValue()));
        }
        List<CandidateFile> candidates = filter(f -> f.matchKey().equals(top.getKey()));
        return pick(citation, candidates, MatchConfidence.FUZZY);
    }

    /**
     * 同一层多个候选：逻辑名相同（只是格式不同）时优先 PDF；仍不唯一则判为歧义。
     */
    private Match pick(Citation citation, List<CandidateFile> candidates, MatchConfidence confidence) {
        if (candidates.size() == 1) {
            return Match.of(citation, candidates.get(0), confidence);
        }
        long keys = candidates.stream().map(CandidateFile::matchKey).distinct().count();
        if (keys == 1) {
            List<CandidateFile> pdfs = candidates.stream().filter(CandidateFile::isPdf).toList();
            if (pdfs.size() == 1) {
                return Match.of(citation, pdfs.get(0), confidence);
            }
        }
        return Match.unresolved(citation, "Ambiguous: " + candidates.stream()
                .map(CandidateFile::getRelativeKey)
                .toList());
    }

    // ---------- Bates ----------

    private Match matchBates(Citation citation) {
        BatesNumber cited = citation.getBates();
        if (cited == null) {
            return Match.unresolved(citation, "Not a Bates number: " + citation.getRawText());
        }

        for (CandidateFile f : containmentOrder(cited)) {
            PdfScan scan = index.batesRange(f);
            if (scan.contains(cited)) {
                return Match.of(citation, f, MatchConfidence.BATES_CONTAINMENT);
            }
        }

        String label = FilenameNormalizer.normalize(cited.label());
        List<CandidateFile> exact = filter(f -> label.equals(f.getNormalizedName())
                || (cited.equals(f.getBatesStart()) && f.getBatesEnd() == null));
        if (!exact.isEmpty()) {
            return pick(citation, exact, MatchConfidence.EXACT);
        }

        CandidateFile nearest = index.getFiles().stream()
                .filter(f -> coversNominally(f, cited))
                .filter(f -> !scannable(f))
                .max(Comparator.comparingLong(f -> f.getBatesStart().getNumber()))
                .orElse(null);
        if (nearest != null) {
            return Match.of(citation, nearest, MatchConfidence.NORMALIZED);
        }
        return Match.unresolved(citation, "Bates label " + cited.label() + " not found in any file");
    }

    /**
     * 同前缀且起始编号不大于被引编号的 Bates 命名 PDF，起始编号最接近者在前；
     * 其后是其余 Bates 命名 PDF（按路径顺序），覆盖拼接了其他前缀子文档的情况。
     */
    List<CandidateFile> containmentOrder(BatesNumber cited) {
        List<CandidateFile> named = index.batesNamedPdfs();
        List<CandidateFile> preferred = named.stream()
                .filter(f -> f.getBatesStart().samePrefix(cited) && f.getBatesStart().getNumber() <= cited.getNumber())
                .sorted(Comparator.comparingLong((CandidateFile f) -> f.getBatesStart().getNumber()).reversed())
                .toList();
        List<CandidateFile> order = new ArrayList<>(preferred);
        for (CandidateFile f : named) {
            if (!preferred.contains(f)) {
                order.add(f);
            }
        }
        return order;
    }

    private static boolean coversNominally(CandidateFile f, BatesNumber cited) {
        BatesNumber start = f.getBatesStart();
        if (start == null || !start.samePrefix(cited) || start.getNumber() > cited.getNumber()) {
            return false;
        }
        return f.getBatesEnd() == null || cited.getNumber() <= f.getBatesEnd().getNumber();
    }

    /** 能否靠页面文本定位：PDF、扫描成功且带文本层 */
    private boolean scannable(CandidateFile f) {
        if (!f.isPdf()) {
            return false;
        }
        PdfScan scan = index.batesRange(f);
        return !scan.isFailed() && !scan.allLabels().isEmpty();
    }

    private List<CandidateFile> filter(Predicate<CandidateFile> predicate) {
        return index.getFiles().stream().filter(predicate).toList();
    }
}
