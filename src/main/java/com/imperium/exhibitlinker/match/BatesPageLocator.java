package com.imperium.exhibitlinker.match;

import com.imperium.exhibitlinker.model.citation.BatesNumber;
import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.index.PdfScan;
import com.imperium.exhibitlinker.model.link.Match;
import com.imperium.exhibitlinker.model.link.MatchConfidence;
import com.imperium.exhibitlinker.model.link.PageScanState;
import com.imperium.exhibitlinker.pdf.PdfPageScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 为已解析的 Match 确定目标页。
 * <p>
 * Bates 页面包含匹配：按页序查找第一页出现被引编号的页面，
 * NOT_STARTED → SCANNING → FOUND | EXHAUSTED_NO_MATCH；找不到时退化为文档级链接。
 * 带 pageHint 的 Exhibit 引用直接取 pageHint，夹在 [1, 页数] 内。非 PDF 目标没有页码。
 */
public class BatesPageLocator {

    private static final Logger log = LoggerFactory.getLogger(BatesPageLocator.class);

    private final PdfPageScanner scanner;

    public BatesPageLocator(PdfPageScanner scanner) {
        this.scanner = scanner;
    }

    public Match locate(Match match) {
        if (!match.isResolved() || !match.getFile().isPdf()) {
            return match;
        }
        return switch (match.getCitation().getKind()) {
            case BATES -> locateBates(match);
            case EXHIBIT -> locateHint(match);
        };
    }

    private Match locateBates(Match match) {
        if (match.getConfidence() != MatchConfidence.BATES_CONTAINMENT) {
            return match;
        }
        BatesNumber cited = match.getCitation().getBates();
        CandidateFile file = match.getFile();
        Match scanning = match.toBuilder().scanState(PageScanState.SCANNING).build();

        PdfScan scan = scanner.scanBates(file.getPath());
        for (int i = 0; i < scan.getPageCount(); i++) {
            if (scan.labelsOnPage(i).contains(cited)) {
                log.debug("{} found on page {} of {}", cited, i + 1, file.getFileName());
                return scanning.toBuilder()
                        .scanState(PageScanState.FOUND)
                        .resolvedPage(i + 1)
                        .build();
            }
        }
        log.debug("{} not found on any page of {}", cited, file.getFileName());
        return scanning.toBuilder()
                .scanState(PageScanState.EXHAUSTED_NO_MATCH)
                .build();
    }

    private Match locateHint(Match match) {
        Integer hint = match.getCitation().getPageHint();
        if (hint == null) {
            return match;
        }
        PdfScan scan = scanner.pageCount(match.getFile().getPath());
        if (scan.isFailed() || scan.getPageCount() <= 0) {
            return match;
        }
        int page = Math.min(Math.max(hint, 1), scan.getPageCount());
        if (page != hint) {
            log.debug("Page hint {} clamped to {} for {}", hint, page, match.getFile().getFileName());
        }
        return match.toBuilder().resolvedPage(page).build();
    }
}
