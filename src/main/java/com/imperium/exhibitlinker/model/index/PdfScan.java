package com.imperium.exhibitlinker.model.index;

import com.imperium.exhibitlinker.model.citation.BatesNumber;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 一个 PDF 的页面扫描结果（即该文件的 Bates 范围），每次运行每个文件最多扫描一次。
 * <p>
 * pageLabels 按页序保存每页出现的 Bates 编号；只统计页数时为 null。
 * 拼接过子文档的 PDF 可能跨多个前缀。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class PdfScan {

    private final Path file;

    /** 页数；失败时为 0 */
    private final int pageCount;

    private final List<Set<BatesNumber>> pageLabels;

    /** 失败原因；成功时为 null */
    private final String failure;

    public static PdfScan labelled(Path file, List<Set<BatesNumber>> pageLabels) {
        return new PdfScan(file, pageLabels.size(), List.copyOf(pageLabels), null);
    }

    public static PdfScan counted(Path file, int pageCount) {
        return new PdfScan(file, pageCount, null, null);
    }

    public static PdfScan failed(Path file, String failure) {
        return new PdfScan(file, 0, null, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }

    public boolean hasLabels() {
        return pageLabels != null;
    }

    public boolean contains(BatesNumber label) {
        if (pageLabels == null) {
            return false;
        }
        for (Set<BatesNumber> page : pageLabels) {
            if (page.contains(label)) {
                return true;
            }
        }
        return false;
    }

    /** 第 pageIndex 页（0 起）上的编号 */
    public Set<BatesNumber> labelsOnPage(int pageIndex) {
        if (pageLabels == null || pageIndex < 0 || pageIndex >= pageLabels.size()) {
            return Collections.emptySet();
        }
        return pageLabels.get(pageIndex);
    }

    /** 整个文件出现过的编号（去重，按页序） */
    public Set<BatesNumber> allLabels() {
        Set<BatesNumber> all = new LinkedHashSet<>();
        if (pageLabels != null) {
            pageLabels.forEach(all::addAll);
        }
        return all;
    }
}
