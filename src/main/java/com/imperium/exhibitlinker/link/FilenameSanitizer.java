package com.imperium.exhibitlinker.link;

import com.imperium.exhibitlinker.exception.LinkerException;
import com.imperium.exhibitlinker.exception.SanitizationConflictException;
import com.imperium.exhibitlinker.index.FilenameNormalizer;
import com.imperium.exhibitlinker.policy.IoRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 把文件名中的空格与句点（扩展名的点除外）换成下划线，使 Chrome 的 PDF 阅读器能正确打开。
 * <p>
 * 先生成完整计划并检查冲突，有冲突时不做任何改动；执行中途失败则按逆序回滚已完成的操作。
 */
public class FilenameSanitizer {

    private static final Logger log = LoggerFactory.getLogger(FilenameSanitizer.class);

    private static final Pattern SPACES_AND_DOTS = Pattern.compile("[\\s\\u00A0.]+");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_{2,}");
    private static final Pattern EXHIBIT_NAME = Pattern.compile("^(?i:exhibit|exh|ex)[\\s\\u00A0._].*");

    private final IoRetryPolicy retryPolicy;
    private final FileOperations fileOperations;

    public FilenameSanitizer(IoRetryPolicy retryPolicy) {
        this(retryPolicy, FileOperations.DEFAULT);
    }

    FilenameSanitizer(IoRetryPolicy retryPolicy, FileOperations fileOperations) {
        this.retryPolicy = retryPolicy;
        this.fileOperations = fileOperations;
    }

    /**
     * Ex. 1 Memo.pdf → Ex_1_Memo.pdf；无需改动时原样返回。
     */
    public static String sanitize(String fileName) {
        String stem = FilenameNormalizer.stem(fileName);
        String ext = fileName.substring(stem.length());
        String cleaned = SPACES_AND_DOTS.matcher(stem).replaceAll("_");
        cleaned = UNDERSCORE_RUN.matcher(cleaned).replaceAll("_");
        while (cleaned.endsWith("_")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        if (cleaned.isEmpty()) {
            return fileName;
        }
        return cleaned + ext;
    }

    /** 文件名以 ex / exh / exhibit 关键字开头 */
    public static boolean looksLikeExhibit(String fileName) {
        return EXHIBIT_NAME.matcher(fileName).matches();
    }

    /** Chrome 可能误读的文件名：主名含空格或句点 */
    public static boolean isChromeUnsafe(String fileName) {
        return !sanitize(fileName).equals(fileName);
    }

    /**
     * 为给定文件生成改名计划，名字已合规的文件不进入计划。
     *
     * @throws SanitizationConflictException 两个文件规范化后同名，或目标名已被其他文件占用
     */
    public RenamePlan plan(Collection<Path> files) {
        Set<Path> sources = new LinkedHashSet<>();
        for (Path f : files) {
            sources.add(f.toAbsolutePath().normalize());
        }

        List<Rename> renames = new ArrayList<>();
        List<Path> unchanged = new ArrayList<>();
        Map<String, List<Path>> byTarget = new LinkedHashMap<>();
        for (Path source : sources) {
            String name = source.getFileName().toString();
            String sanitized = sanitize(name);
            if (sanitized.equals(name)) {
                unchanged.add(source);
                continue;
            }
            Path target = source.resolveSibling(sanitized);
            renames.add(new Rename(source, target));
            byTarget.computeIfAbsent(target.toString().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(source);
        }

        List<String> conflicts = new ArrayList<>();
        for (List<Path> group : byTarget.values()) {
            if (group.size() > 1) {
                conflicts.add(group.stream().map(p -> p.getFileName().toString()).toList()
                        + " -> " + sanitize(group.get(0).getFileName().toString()));
            }
        }
        for (Rename r : renames) {
            if (occupiedByOther(r)) {
                conflicts.add(r.target().getFileName() + " already exists");
            }
        }
        if (!conflicts.isEmpty()) {
            log.warn("Sanitization aborted, {} conflict(s): {}", conflicts.size(), conflicts);
            throw new SanitizationConflictException(conflicts);
        }
        return new RenamePlan(renames, unchanged);
    }

    private static boolean occupiedByOther(Rename r) {
        if (!Files.exists(r.target())) {
            return false;
        }
        try {
            return !Files.isSameFile(r.source(), r.target());
        } catch (IOException e) {
            log.debug("Cannot compare {} and {}: {}", r.source(), r.target(), e.getMessage());
            return true;
        }
    }

    /**
     * 执行计划：全部成功，或者全部回滚。
     *
     * @return 原路径 → 新路径
     */
    public Map<Path, Path> apply(RenamePlan plan, SanitizeStrategy strategy) {
        Map<Path, Path> done = new LinkedHashMap<>();
        List<Rename> completed = new ArrayList<>();
        for (Rename r : plan.renames()) {
            try {
                retryPolicy.run("Sanitize " + r.source().getFileName(), () -> {
                    if (strategy == SanitizeStrategy.COPY) {
                        fileOperations.copy(r.source(), r.target());
                    } else {
                        fileOperations.move(r.source(), r.target());
                    }
                });
            } catch (IOException e) {
                log.error("Sanitizing {} failed, rolling back {} operation(s): {}",
                        r.source().getFileName(), completed.size(), e.getMessage());
                rollback(completed, strategy);
                throw new LinkerException(LinkerException.SANITIZATION_FAILED,
                        "Could not sanitize " + r.source().getFileName() + ": " + e.getMessage(), e);
            }
            completed.add(r);
            done.put(r.source(), r.target());
            log.info("{} {} -> {}", strategy == SanitizeStrategy.COPY ? "Copied" : "Renamed",
                    r.source().getFileName(), r.target().getFileName());
        }
        return done;
    }

    private void rollback(List<Rename> completed, SanitizeStrategy strategy) {
        for (int i = completed.size() - 1; i >= 0; i--) {
            Rename r = completed.get(i);
            try {
                if (strategy == SanitizeStrategy.COPY) {
                    fileOperations.delete(r.target());
                } else {
                    fileOperations.move(r.target(), r.source());
                }
            } catch (IOException e) {
                log.error("Rollback of {} failed: {}", r.target(), e.getMessage());
            }
        }
    }

    public record Rename(Path source, Path target) {}

    /** renames 只含需要改名的文件；unchanged 为已合规的文件 */
    public record RenamePlan(List<Rename> renames, List<Path> unchanged) {

        public boolean isEmpty() {
            return renames.isEmpty();
        }

        public Path targetOf(Path source) {
            Path key = source.toAbsolutePath().normalize();
            for (Rename r : renames) {
                if (r.source().equals(key)) {
                    return r.target();
                }
            }
            return key;
        }
    }

    /** 文件操作，测试中可替换以模拟中途失败 */
    interface FileOperations {

        FileOperations DEFAULT = new FileOperations() {
            @Override
            public void move(Path source, Path target) throws IOException {
                Files.move(source, target);
            }

            @Override
            public void copy(Path source, Path target) throws IOException {
                Files.copy(source, target);
            }

            @Override
            public void delete(Path target) throws IOException {
                Files.deleteIfExists(target);
            }
        };

        void move(Path source, Path target) throws IOException;

        void copy(Path source, Path target) throws IOException;

        void delete(Path target) throws IOException;
    }
}
