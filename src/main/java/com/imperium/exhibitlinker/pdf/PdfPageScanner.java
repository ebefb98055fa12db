package com.imperium.exhibitlinker.pdf;

import com.imperium.exhibitlinker.model.citation.BatesNumber;
import com.imperium.exhibitlinker.model.index.PdfScan;
import com.imperium.exhibitlinker.policy.IoRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * 单次运行内的 PDF 扫描缓存：每个文件最多完整扫描一次，结果在本次运行内复用。
 * 非线程安全，运行是单线程顺序执行的。
 */
public class PdfPageScanner {

    private static final Logger log = LoggerFactory.getLogger(PdfPageScanner.class);

    private final PdfPageSource pageSource;
    private final IoRetryPolicy retryPolicy;
    private final Map<Path, PdfScan> scans = new LinkedHashMap<>();

    public PdfPageScanner(PdfPageSource pageSource, IoRetryPolicy retryPolicy) {
        this.pageSource = pageSource;
        this.retryPolicy = retryPolicy;
    }

    /**
     * 逐页抽取文本并收集页面上出现的全部 Bates 编号。
     */
    public PdfScan scanBates(Path pdf) {
        PdfScan cached = scans.get(pdf);
        if (cached != null && (cached.hasLabels() || cached.isFailed())) {
            return cached;
        }
        PdfScan scan;
        try {
            List<Set<BatesNumber>> pageLabels = retryPolicy.call("Scan " + pdf.getFileName(), () -> readLabels(pdf));
            scan = PdfScan.labelled(pdf, pageLabels);
            log.debug("Scanned {}: {} page(s), {} Bates label(s)", pdf.getFileName(), scan.getPageCount(),
                    scan.allLabels().size());
        } catch (IOException | RuntimeException e) {
            log.warn("PDF scan failed for {}: {}", pdf, e.getMessage());
            scan = PdfScan.failed(pdf, e.getMessage());
        }
        scans.put(pdf, scan);
        return scan;
    }

    /**
     * 只需要页数时使用；已有完整扫描结果则直接复用。
     */
    public PdfScan pageCount(Path pdf) {
        PdfScan cached = scans.get(pdf);
        if (cached != null) {
            return cached;
        }
        PdfScan scan;
        try {
            int count = retryPolicy.call("Open " + pdf.getFileName(), () -> {
                try (PdfPages pages = pageSource.open(pdf)) {
                    return pages.pageCount();
                }
            });
            scan = PdfScan.counted(pdf, count);
        } catch (IOException | RuntimeException e) {
            log.warn("Cannot read page count of {}: {}", pdf, e.getMessage());
            scan = PdfScan.failed(pdf, e.getMessage());
        }
        scans.put(pdf, scan);
        return scan;
    }

    /** 本次运行中扫描失败的文件，按首次失败顺序 */
    public List<PdfScan> failures() {
        return scans.values().stream().filter(PdfScan::isFailed).toList();
    }

    /** 已扫描过的文件数，测试与日志用 */
    public int scannedFileCount() {
        return scans.size();
    }

    private List<Set<BatesNumber>> readLabels(Path pdf) throws IOException {
        try (PdfPages pages = pageSource.open(pdf)) {
            int count = pages.pageCount();
            List<Set<BatesNumber>> result = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                result.add(labelsIn(pages.pageText(i)));
            }
            return result;
        }
    }

    static Set<BatesNumber> labelsIn(String pageText) {
        Set<BatesNumber> labels = new LinkedHashSet<>();
        if (pageText == null || pageText.isEmpty()) {
            return labels;
        }
        Matcher m = BatesNumber.TOKEN.matcher(pageText);
        while (m.find()) {
            if (m.group("digits").length() <= 18) {
                labels.add(BatesNumber.fromMatch(m));
            }
        }
        return labels;
    }
}
