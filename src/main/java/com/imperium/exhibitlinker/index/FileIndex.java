package com.imperium.exhibitlinker.index;

import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.index.PdfScan;
import com.imperium.exhibitlinker.model.report.LinkIssue;
import com.imperium.exhibitlinker.pdf.PdfPageScanner;

import java.nio.file.Path;
import java.util.List;

/**
 * 一次运行的只读文件索引。Bates 范围按需通过 {@link PdfPageScanner} 扫描并缓存。
 */
public class FileIndex {

    private final Path root;
    private final List<CandidateFile> files;
    private final List<LinkIssue> warnings;
    private final PdfPageScanner scanner;

    public FileIndex(Path root, List<CandidateFile> files, List<LinkIssue> warnings, PdfPageScanner scanner) {
        this.root = root;
        this.files = List.copyOf(files);
        this.warnings = List.copyOf(warnings);
        this.scanner = scanner;
    }

    public Path getRoot() {
        return root;
    }

    /** 按 relativeKey 排序 */
    public List<CandidateFile> getFiles() {
        return files;
    }

    public List<LinkIssue> getWarnings() {
        return warnings;
    }

    public PdfPageScanner getScanner() {
        return scanner;
    }

    public List<CandidateFile> batesNamedPdfs() {
        return files.stream()
                .filter(f -> f.isPdf() && f.isBatesNamed())
                .toList();
    }

    /**
     * 文件的 Bates 范围；首次访问时扫描。
     */
    public PdfScan batesRange(CandidateFile file) {
        return scanner.scanBates(file.getPath());
    }

    public PdfScan pageCount(CandidateFile file) {
        return scanner.pageCount(file.getPath());
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }
}
