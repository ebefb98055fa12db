package com.imperium.exhibitlinker.output.impl;

import com.imperium.exhibitlinker.link.RelativePaths;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.action.PDAction;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把导出 PDF 中指向本机绝对路径的 file:/// 链接改写成相对 PDF 所在目录的链接，
 * 并把被转义成 %23page= 的页码片段还原为 #page=。
 */
@Component
public class PdfLinkRelativizer {

    private static final Logger log = LoggerFactory.getLogger(PdfLinkRelativizer.class);

    private static final String ENCODED_FRAGMENT = "%23page=";
    private static final Pattern FILE_URI = Pattern.compile("^file:/{2,3}(?<path>[^#]+)(?<fragment>#page=\\d+)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOWS_DRIVE = Pattern.compile("^[A-Za-z](?::|%3A)/.*");

    /**
     * @param pdf    要处理的 PDF
     * @param output 输出路径；为 null 时原地替换
     */
    public Result relativize(Path pdf, Path output) throws IOException {
        Path target = output != null ? output : pdf;
        Path baseDir = target.toAbsolutePath().normalize().getParent();
        int rewritten = 0;
        int fragmentsRepaired = 0;
        int remaining = 0;

        Path temp = Files.createTempFile(baseDir, ".relativize-", ".pdf");
        try {
            try (PDDocument doc = Loader.loadPDF(pdf.toFile())) {
                for (PDPage page : doc.getPages()) {
                    for (PDAnnotation annotation : page.getAnnotations()) {
                        if (!(annotation instanceof PDAnnotationLink link)) {
                            continue;
                        }
                        PDAction action = link.getAction();
                        if (!(action instanceof PDActionURI uriAction) || uriAction.getURI() == null) {
                            continue;
                        }
                        String uri = uriAction.getURI();
                        String fixed = uri;
                        if (fixed.contains(ENCODED_FRAGMENT)) {
                            fixed = fixed.replace(ENCODED_FRAGMENT, "#page=");
                            fragmentsRepaired++;
                        }
                        String relative = toRelative(fixed, baseDir);
                        if (relative != null) {
                            fixed = relative;
                            rewritten++;
                        } else if (fixed.regionMatches(true, 0, "file:", 0, 5)) {
                            remaining++;
                        }
                        if (!fixed.equals(uri)) {
                            log.debug("Link {} -> {}", uri, fixed);
                            uriAction.setURI(fixed);
                        }
                    }
                }
                doc.save(temp.toFile());
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("Relativized {}: {} link(s) rewritten, {} fragment(s) repaired, {} absolute link(s) left",
                target.getFileName(), rewritten, fragmentsRepaired, remaining);
        return new Result(target, rewritten, fragmentsRepaired, remaining);
    }

    /**
     * file:///C:/cases/Ex_1.pdf#page=3 → ../Ex_1.pdf#page=3；不是 file 链接或无法换算时返回 null。
     */
    static String toRelative(String uri, Path baseDir) {
        Matcher m = FILE_URI.matcher(uri);
        if (!m.matches()) {
            return null;
        }
        String rawPath = m.group("path");
        String fragment = m.group("fragment") != null ? m.group("fragment") : "";
        String decoded = URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
        Path absolute;
        try {
            if (WINDOWS_DRIVE.matcher(rawPath).matches() && !isWindows()) {
                return null;
            }
            absolute = Paths.get(decoded.startsWith("/") || WINDOWS_DRIVE.matcher(decoded).matches()
                    ? decoded
                    : "/" + decoded);
        } catch (RuntimeException e) {
            log.debug("Cannot convert {}: {}", uri, e.getMessage());
            return null;
        }
        if (!absolute.isAbsolute()) {
            return null;
        }
        return RelativePaths.between(baseDir, absolute) + fragment;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }

    public record Result(Path output, int linksRewritten, int fragmentsRepaired, int absoluteLinksRemaining) {
    }
}
