package com.imperium.exhibitlinker.index;

import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.report.IssueType;
import com.imperium.exhibitlinker.model.report.LinkIssue;
import com.imperium.exhibitlinker.pdf.PdfPageScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * 递归遍历 exhibits 根目录，构建候选文件索引。
 * <p>
 * 不可读的文件与目录跳过并记为 INDEX_BUILD_FAILURE，不中断运行。
 */
@Component
public class FileIndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(FileIndexBuilder.class);

    public FileIndex build(Path root, PdfPageScanner scanner) {
        return build(root, List.of(), scanner);
    }

    /**
     * @param excluded 不进入索引的文件（如源文档本身、上次生成的输出）
     */
    public FileIndex build(Path root, Collection<Path> excluded, PdfPageScanner scanner) {
        List<CandidateFile> files = new ArrayList<>();
        List<LinkIssue> warnings = new ArrayList<>();
        if (root == null || !Files.isDirectory(root)) {
            warnings.add(LinkIssue.builder()
                    .type(IssueType.INDEX_BUILD_FAILURE)
                    .file(String.valueOf(root))
                    .message("Exhibits folder does not exist or is not a directory")
                    .build());
            log.warn("Exhibits folder not usable: {}", root);
            return new FileIndex(root, files, warnings, scanner);
        }
        Path base = root.toAbsolutePath().normalize();
        Set<Path> skip = new HashSet<>();
        for (Path p : excluded) {
            skip.add(p.toAbsolutePath().normalize());
        }

        try {
            Files.walkFileTree(base, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(base) && isHidden(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    Path abs = file.toAbsolutePath().normalize();
                    String name = abs.getFileName().toString();
                    if (!attrs.isRegularFile() || isHidden(name) || skip.contains(abs)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (!Files.isReadable(abs)) {
                        warnings.add(warning(base, abs, "File is not readable"));
                        return FileVisitResult.CONTINUE;
                    }
                    files.add(toCandidate(base, abs));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Skipping {}: {}", file, exc.getMessage());
                    warnings.add(warning(base, file.toAbsolutePath().normalize(), exc.getMessage()));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Exhibits folder walk aborted at {}: {}", base, e.getMessage());
            warnings.add(LinkIssue.builder()
                    .type(IssueType.INDEX_BUILD_FAILURE)
                    .file(base.toString())
                    .message("Folder walk failed: " + e.getMessage())
                    .build());
        }

        files.sort(Comparator.comparing(CandidateFile::getRelativeKey));
        log.info("Indexed {} file(s) under {} ({} warning(s))", files.size(), base, warnings.size());
        return new FileIndex(base, files, warnings, scanner);
    }

    static CandidateFile toCandidate(Path root, Path file) {
        String fileName = file.getFileName().toString();
        String stem = FilenameNormalizer.stem(fileName);
        String normalized = FilenameNormalizer.normalize(stem);
        CandidateFile.CandidateFileBuilder builder = CandidateFile.builder()
                .path(file)
                .relativeKey(relativeKey(root, file))
                .fileName(fileName)
                .extension(FilenameNormalizer.extension(fileName))
                .normalizedName(normalized)
                .exhibitKey(FilenameNormalizer.exhibitKey(normalized));
        FilenameNormalizer.batesSpan(stem).ifPresent(span -> builder
                .batesStart(span.start())
                .batesEnd(span.end()));
        return builder.build();
    }

    public static String relativeKey(Path root, Path file) {
        StringJoiner joiner = new StringJoiner("/");
        for (Path part : root.relativize(file)) {
            joiner.add(part.toString());
        }
        return joiner.toString();
    }

    private static boolean isHidden(String name) {
        return name.startsWith(".") || name.startsWith("~$");
    }

    private static LinkIssue warning(Path root, Path file, String message) {
        String key = file.startsWith(root) ? relativeKey(root, file) : file.toString();
        return LinkIssue.builder()
                .type(IssueType.INDEX_BUILD_FAILURE)
                .file(key)
                .message(message)
                .build();
    }
}
