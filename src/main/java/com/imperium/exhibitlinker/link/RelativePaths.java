package com.imperium.exhibitlinker.link;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * 源文档目录到目标文件的相对路径，只由两个绝对路径决定，两者一起搬迁后结果不变。
 */
public final class RelativePaths {

    private static final Logger log = LoggerFactory.getLogger(RelativePaths.class);

    public static String between(Path sourceDir, Path target) {
        Path from = sourceDir.toAbsolutePath().normalize();
        Path to = target.toAbsolutePath().normalize();
        if (!Objects.equals(from.getRoot(), to.getRoot())) {
            log.warn("No common root between {} and {}, using absolute path", from, to);
            return forwardSlashes(to);
        }
        return forwardSlashes(from.relativize(to));
    }

    static String forwardSlashes(Path path) {
        StringJoiner joiner = new StringJoiner("/");
        Path root = path.getRoot();
        for (Path part : path) {
            joiner.add(part.toString());
        }
        if (root == null) {
            return joiner.toString();
        }
        String rootText = root.toString().replace('\\', '/');
        return rootText.endsWith("/") ? rootText + joiner : rootText + "/" + joiner;
    }

    private RelativePaths() {}
}
