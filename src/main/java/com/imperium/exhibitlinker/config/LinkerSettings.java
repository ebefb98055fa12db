package com.imperium.exhibitlinker.config;

import com.imperium.exhibitlinker.exception.LinkerException;
import com.imperium.exhibitlinker.link.SanitizeStrategy;
import com.imperium.exhibitlinker.model.dto.request.LinkRunRequest;
import com.imperium.exhibitlinker.model.link.ViewerProfile;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * app.linker.* 配置，带取值范围约束；{@link #resolve} 叠加请求中的覆盖项。
 */
@Component
public class LinkerSettings {

    private final String exhibitsRoot;
    private final boolean sanitizeFilenames;
    private final String sanitizeStrategy;
    private final double fuzzyThreshold;
    private final double fuzzyTieEpsilon;
    private final int maxPageScanRetries;
    private final long retryBackoffMs;
    private final String viewer;
    private final List<String> batesPrefixes;
    private final String outputSuffix;

    public LinkerSettings(
            @Value("${app.linker.exhibits-root:}") String exhibitsRoot,
            @Value("${app.linker.sanitize-filenames:false}") boolean sanitizeFilenames,
            @Value("${app.linker.sanitize-strategy:rename}") String sanitizeStrategy,
            @Value("${app.linker.fuzzy-threshold:0.8}") double fuzzyThreshold,
            @Value("${app.linker.fuzzy-tie-epsilon:0.02}") double fuzzyTieEpsilon,
            @Value("${app.linker.max-page-scan-retries:3}") int maxPageScanRetries,
            @Value("${app.linker.retry-backoff-ms:100}") long retryBackoffMs,
            @Value("${app.linker.viewer:acrobat}") String viewer,
            @Value("${app.linker.bates-prefixes:}") String batesPrefixes,
            @Value("${app.linker.output-suffix:_linked}") String outputSuffix) {
        this.exhibitsRoot = exhibitsRoot == null ? "" : exhibitsRoot.trim();
        this.sanitizeFilenames = sanitizeFilenames;
        this.sanitizeStrategy = sanitizeStrategy;
        this.fuzzyThreshold = clamp(fuzzyThreshold, 0.0, 1.0);
        this.fuzzyTieEpsilon = clamp(fuzzyTieEpsilon, 0.0, 1.0);
        this.maxPageScanRetries = Math.max(0, Math.min(10, maxPageScanRetries));
        this.retryBackoffMs = Math.max(1L, Math.min(10_000L, retryBackoffMs));
        this.viewer = viewer;
        this.batesPrefixes = splitList(batesPrefixes);
        this.outputSuffix = (outputSuffix == null || outputSuffix.isBlank()) ? "_linked" : outputSuffix.trim();
    }

    /**
     * @param document 源文档；exhibits 根目录两处都没配置时取其所在目录
     */
    public LinkRunOptions resolve(LinkRunRequest request, Path document) {
        String root = firstNonBlank(request.getExhibitsRoot(), exhibitsRoot);
        List<String> requestedPrefixes = cleanList(request.getBatesPrefixes());
        Path rootPath = root != null ? Paths.get(root) : document.toAbsolutePath().normalize().getParent();
        try {
            return LinkRunOptions.builder()
                    .exhibitsRoot(rootPath.toAbsolutePath().normalize())
                    .outputPath(isBlank(request.getOutputPath()) ? null : Paths.get(request.getOutputPath()))
                    .writeOutput(request.getWriteOutput() == null || request.getWriteOutput())
                    .sanitizeFilenames(request.getSanitizeFilenames() != null
                            ? request.getSanitizeFilenames() : sanitizeFilenames)
                    .sanitizeStrategy(SanitizeStrategy.fromString(
                            firstNonBlank(request.getSanitizeStrategy(), sanitizeStrategy)))
                    .dryRun(Boolean.TRUE.equals(request.getDryRun()))
                    .fuzzyThreshold(request.getFuzzyThreshold() != null
                            ? clamp(request.getFuzzyThreshold(), 0.0, 1.0) : fuzzyThreshold)
                    .fuzzyTieEpsilon(request.getFuzzyTieEpsilon() != null
                            ? clamp(request.getFuzzyTieEpsilon(), 0.0, 1.0) : fuzzyTieEpsilon)
                    .maxPageScanRetries(request.getMaxPageScanRetries() != null
                            ? Math.max(0, Math.min(10, request.getMaxPageScanRetries())) : maxPageScanRetries)
                    .retryBackoffMs(retryBackoffMs)
                    .viewer(ViewerProfile.fromString(firstNonBlank(request.getViewer(), viewer)))
                    .batesPrefixes(requestedPrefixes.isEmpty() ? batesPrefixes : requestedPrefixes)
                    .outputSuffix(outputSuffix)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new LinkerException(LinkerException.INVALID_ARGUMENT, e.getMessage(), e);
        }
    }

    public SanitizeStrategy defaultStrategy() {
        return SanitizeStrategy.fromString(sanitizeStrategy);
    }

    public int getMaxPageScanRetries() {
        return maxPageScanRetries;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public List<String> getBatesPrefixes() {
        return batesPrefixes;
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    private static List<String> splitList(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> !isBlank(v))
                .map(String::trim)
                .toList();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String firstNonBlank(String a, String b) {
        if (!isBlank(a)) return a.trim();
        if (!isBlank(b)) return b.trim();
        return null;
    }
}
