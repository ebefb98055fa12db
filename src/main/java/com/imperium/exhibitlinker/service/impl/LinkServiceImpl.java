package com.imperium.exhibitlinker.service.impl;

import com.imperium.exhibitlinker.config.LinkRunOptions;
import com.imperium.exhibitlinker.config.LinkerSettings;
import com.imperium.exhibitlinker.exception.LinkerException;
import com.imperium.exhibitlinker.exception.SourceDocumentException;
import com.imperium.exhibitlinker.extract.CitationExtractor;
import com.imperium.exhibitlinker.index.FileIndex;
import com.imperium.exhibitlinker.index.FileIndexBuilder;
import com.imperium.exhibitlinker.index.FilenameNormalizer;
import com.imperium.exhibitlinker.ingest.parser.SourceDocumentReader;
import com.imperium.exhibitlinker.ingest.parser.SourceText;
import com.imperium.exhibitlinker.link.FilenameSanitizer;
import com.imperium.exhibitlinker.link.LinkBuilder;
import com.imperium.exhibitlinker.link.SanitizeStrategy;
import com.imperium.exhibitlinker.match.BatesPageLocator;
import com.imperium.exhibitlinker.match.CitationMatcher;
import com.imperium.exhibitlinker.model.citation.Citation;
import com.imperium.exhibitlinker.model.dto.request.LinkRunRequest;
import com.imperium.exhibitlinker.model.dto.request.RelativizePdfRequest;
import com.imperium.exhibitlinker.model.dto.request.SanitizeFolderRequest;
import com.imperium.exhibitlinker.model.dto.response.LinkDto;
import com.imperium.exhibitlinker.model.dto.response.LinkRunResponse;
import com.imperium.exhibitlinker.model.dto.response.RelativizePdfResponse;
import com.imperium.exhibitlinker.model.dto.response.RenameDto;
import com.imperium.exhibitlinker.model.dto.response.SanitizeFolderResponse;
import com.imperium.exhibitlinker.model.index.PdfScan;
import com.imperium.exhibitlinker.model.link.LinkTarget;
import com.imperium.exhibitlinker.model.link.Match;
import com.imperium.exhibitlinker.model.link.PlacedLink;
import com.imperium.exhibitlinker.model.link.ViewerProfile;
import com.imperium.exhibitlinker.model.report.IssueType;
import com.imperium.exhibitlinker.model.report.LinkIssue;
import com.imperium.exhibitlinker.output.HyperlinkWriter;
import com.imperium.exhibitlinker.output.impl.PdfLinkRelativizer;
import com.imperium.exhibitlinker.pdf.PdfPageScanner;
import com.imperium.exhibitlinker.pdf.PdfPageSource;
import com.imperium.exhibitlinker.policy.IoRetryPolicy;
import com.imperium.exhibitlinker.service.LinkService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * 单线程顺序执行的链接运行。各次运行互不共享可变状态，只通过运行 ID 登记取消标志。
 */
@Service
public class LinkServiceImpl implements LinkService {

    private static final Logger log = LoggerFactory.getLogger(LinkServiceImpl.class);

    private final SourceDocumentReader sourceDocumentReader;
    private final CitationExtractor citationExtractor;
    private final FileIndexBuilder fileIndexBuilder;
    private final LinkBuilder linkBuilder;
    private final PdfPageSource pdfPageSource;
    private final List<HyperlinkWriter> writers;
    private final PdfLinkRelativizer pdfLinkRelativizer;
    private final LinkerSettings settings;

    private final Map<String, AtomicBoolean> runs = new ConcurrentHashMap<>();

    public LinkServiceImpl(
            SourceDocumentReader sourceDocumentReader,
            CitationExtractor citationExtractor,
            FileIndexBuilder fileIndexBuilder,
            LinkBuilder linkBuilder,
            PdfPageSource pdfPageSource,
            List<HyperlinkWriter> writers,
            PdfLinkRelativizer pdfLinkRelativizer,
            LinkerSettings settings) {
        this.sourceDocumentReader = sourceDocumentReader;
        this.citationExtractor = citationExtractor;
        this.fileIndexBuilder = fileIndexBuilder;
        this.linkBuilder = linkBuilder;
        this.pdfPageSource = pdfPageSource;
        this.writers = writers;
        this.pdfLinkRelativizer = pdfLinkRelativizer;
        this.settings = settings;
    }

    @Override
    public LinkRunResponse run(LinkRunRequest request, String runId) {
        Path document = Paths.get(request.getDocumentPath()).toAbsolutePath().normalize();
        if (!Files.isRegularFile(document)) {
            throw new SourceDocumentException("Source document not found: " + document);
        }
        LinkRunOptions options = settings.resolve(request, document);
        AtomicBoolean cancelFlag = new AtomicBoolean(false);
        if (runs.putIfAbsent(runId, cancelFlag) != null) {
            throw new LinkerException(LinkerException.INVALID_ARGUMENT, "Run " + runId + " is already in progress");
        }
        try {
            return execute(document, options, runId, cancelFlag);
        } finally {
            runs.remove(runId);
        }
    }

    @Override
    public boolean cancel(String runId) {
        AtomicBoolean flag = runId != null ? runs.get(runId) : null;
        if (flag == null) {
            log.info("Cancel requested for unknown run {}", runId);
            return false;
        }
        flag.set(true);
        log.info("Cancel requested for run {}", runId);
        return true;
    }

    private LinkRunResponse execute(Path document, LinkRunOptions options, String runId, AtomicBoolean cancelFlag) {
        IoRetryPolicy retryPolicy = options.retryPolicy();
        SourceText source = readSource(document, retryPolicy);
        HyperlinkWriter writer = writers.stream()
                .filter(w -> w.supports(source.getFormat()))
                .findFirst()
                .orElseThrow(() -> new SourceDocumentException("No writer for " + source.getFormat()));
        Path output = outputPath(document, options, writer);
        if (output.equals(document)) {
            throw new LinkerException(LinkerException.INVALID_ARGUMENT, "Output path must differ from the source document");
        }

        List<LinkIssue> issues = new ArrayList<>();
        PdfPageScanner scanner = new PdfPageScanner(pdfPageSource, retryPolicy);
        FileIndex index = fileIndexBuilder.build(options.getExhibitsRoot(), List.of(document, output), scanner);
        issues.addAll(index.getWarnings());

        CitationMatcher matcher = new CitationMatcher(index, options.getFuzzyThreshold(), options.getFuzzyTieEpsilon());
        BatesPageLocator locator = new BatesPageLocator(scanner);

        List<Match> matches = new ArrayList<>();
        int citationsFound = 0;
        boolean cancelled = false;
        for (Citation citation : citationExtractor.extract(source.getFullText(), options.getBatesPrefixes())) {
            if (cancelFlag.get()) {
                cancelled = true;
                log.info("Run {} cancelled after {} citation(s)", runId, citationsFound);
                break;
            }
            citationsFound++;
            Match match = locator.locate(matcher.match(citation));
            matches.add(match);
            if (!match.isResolved()) {
                issues.add(LinkIssue.builder()
                        .type(IssueType.UNRESOLVED_CITATION)
                        .sourceOffset(citation.getSourceOffset())
                        .rawText(citation.getRawText())
                        .message(match.getUnresolvedReason())
                        .build());
            }
        }
        if (citationsFound == 0 && !cancelled) {
            issues.add(LinkIssue.builder()
                    .type(IssueType.NO_CITATIONS_FOUND)
                    .file(document.getFileName().toString())
                    .message("No exhibit or Bates citations found in the document")
                    .build());
        }
        for (PdfScan failed : scanner.failures()) {
            issues.add(LinkIssue.builder()
                    .type(IssueType.PAGE_SCAN_FAILURE)
                    .file(relativeToRoot(index.getRoot(), failed.getFile()))
                    .message(failed.getFailure())
                    .build());
        }

        List<Match> resolved = matches.stream().filter(Match::isResolved).toList();

        // 改名必须在生成任何链接之前全部完成
        Map<Path, Path> renamed = Map.of();
        List<RenameDto> renames = new ArrayList<>();
        if (options.isSanitizeFilenames() && !resolved.isEmpty()) {
            if (cancelled) {
                log.info("Run {} cancelled, sanitization skipped", runId);
            } else {
                FilenameSanitizer sanitizer = new FilenameSanitizer(retryPolicy);
                Set<Path> referenced = new LinkedHashSet<>();
                resolved.forEach(m -> referenced.add(m.getFile().getPath()));
                FilenameSanitizer.RenamePlan plan = sanitizer.plan(referenced);
                plan.renames().forEach(r -> renames.add(renameDto(index.getRoot(), r.source(), r.target())));
                if (!options.isDryRun() && !plan.isEmpty()) {
                    renamed = sanitizer.apply(plan, options.getSanitizeStrategy());
                }
            }
        }

        Path linkBase = output.getParent();
        List<PlacedLink> placed = new ArrayList<>();
        List<LinkDto> links = new ArrayList<>();
        Set<Path> unsafeReported = new LinkedHashSet<>();
        for (Match match : resolved) {
            LinkTarget target = linkBuilder.build(match, linkBase, options.getViewer(), renamed);
            Citation citation = match.getCitation();
            placed.add(new PlacedLink(citation.getSourceOffset(), citation.getRawText(), target));
            links.add(toDto(match, target, index.getRoot()));
            if (options.getViewer() == ViewerProfile.CHROME
                    && FilenameSanitizer.isChromeUnsafe(target.getTargetFile().getFileName().toString())
                    && unsafeReported.add(target.getTargetFile())) {
                issues.add(LinkIssue.builder()
                        .type(IssueType.CHROME_UNSAFE_FILENAME)
                        .file(relativeToRoot(index.getRoot(), target.getTargetFile()))
                        .message("Chrome may not open links to file names with spaces or periods; enable sanitizeFilenames")
                        .build());
            }
        }

        String outputDocument = null;
        if (options.isWriteOutput() && !options.isDryRun() && !placed.isEmpty()) {
            try {
                writer.write(source, placed, output);
                outputDocument = output.toString();
            } catch (IOException e) {
                log.error("Writing {} failed: {}", output, e.getMessage());
                throw new LinkerException(LinkerException.OUTPUT_FAILED, "Could not write " + output + ": " + e.getMessage(), e);
            }
        }

        log.info("Run {} finished: {} citation(s), {} link(s), {} issue(s){}", runId, citationsFound, placed.size(),
                issues.size(), cancelled ? " (cancelled)" : "");
        return LinkRunResponse.builder()
                .runId(runId)
                .sourceDocument(document.toString())
                .outputDocument(outputDocument)
                .exhibitsRoot(String.valueOf(index.getRoot()))
                .citationsFound(citationsFound)
                .linksCreated(placed.size())
                .unresolved(matches.size() - resolved.size())
                .cancelled(cancelled)
                .dryRun(options.isDryRun())
                .links(links)
                .issues(issues)
                .renames(renames)
                .build();
    }

    private SourceText readSource(Path document, IoRetryPolicy retryPolicy) {
        try {
            return retryPolicy.call("Read " + document.getFileName(), () -> sourceDocumentReader.read(document));
        } catch (IOException e) {
            log.warn("Source document unreadable: {}", e.getMessage());
            throw new SourceDocumentException("Cannot read source document " + document + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new SourceDocumentException(e.getMessage(), e);
        }
    }

    private static Path outputPath(Path document, LinkRunOptions options, HyperlinkWriter writer) {
        if (options.getOutputPath() != null) {
            return options.getOutputPath().toAbsolutePath().normalize();
        }
        String stem = FilenameNormalizer.stem(document.getFileName().toString());
        return document.resolveSibling(stem + options.getOutputSuffix() + writer.outputExtension());
    }

    private static LinkDto toDto(Match match, LinkTarget target, Path root) {
        Citation citation = match.getCitation();
        return LinkDto.builder()
                .sourceOffset(citation.getSourceOffset())
                .rawText(citation.getRawText())
                .kind(citation.getKind().name())
                .label(citation.getLabel())
                .file(relativeToRoot(root, target.getTargetFile()))
                .href(target.href())
                .relativePath(target.getRelativePath())
                .pageFragment(target.getPageFragment())
                .page(match.getResolvedPage())
                .confidence(match.getConfidence().name())
                .tooltip(target.getTooltip())
                .build();
    }

    private static String relativeToRoot(Path root, Path file) {
        if (root != null && file.startsWith(root)) {
            return FileIndexBuilder.relativeKey(root, file);
        }
        return file.toString();
    }

    private static RenameDto renameDto(Path root, Path from, Path to) {
        return RenameDto.builder()
                .from(relativeToRoot(root, from))
                .to(relativeToRoot(root, to))
                .build();
    }

    @Override
    public SanitizeFolderResponse sanitizeFolder(SanitizeFolderRequest request) {
        Path folder = Paths.get(request.getFolderPath()).toAbsolutePath().normalize();
        if (!Files.isDirectory(folder)) {
            throw new LinkerException(LinkerException.INVALID_ARGUMENT, "Folder does not exist: " + folder);
        }
        SanitizeStrategy strategy;
        try {
            strategy = request.getStrategy() != null && !request.getStrategy().isBlank()
                    ? SanitizeStrategy.fromString(request.getStrategy())
                    : settings.defaultStrategy();
        } catch (IllegalArgumentException e) {
            throw new LinkerException(LinkerException.INVALID_ARGUMENT, e.getMessage(), e);
        }
        boolean dryRun = request.getDryRun() == null || request.getDryRun();

        List<Path> exhibits;
        try (Stream<Path> stream = Files.list(folder)) {
            exhibits = stream
                    .filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .filter(p -> FilenameSanitizer.looksLikeExhibit(p.getFileName().toString()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new LinkerException(LinkerException.INVALID_ARGUMENT, "Cannot read folder " + folder + ": " + e.getMessage(), e);
        }

        FilenameSanitizer sanitizer = new FilenameSanitizer(
                new IoRetryPolicy(settings.getMaxPageScanRetries(), settings.getRetryBackoffMs()));
        FilenameSanitizer.RenamePlan plan = sanitizer.plan(exhibits);
        if (!dryRun && !plan.isEmpty()) {
            sanitizer.apply(plan, strategy);
        }
        log.info("{}sanitized {}: {} rename(s), {} unchanged", dryRun ? "[dry run] " : "", folder,
                plan.renames().size(), plan.unchanged().size());
        return SanitizeFolderResponse.builder()
                .folder(folder.toString())
                .dryRun(dryRun)
                .strategy(strategy.name().toLowerCase(Locale.ROOT))
                .renames(plan.renames().stream()
                        .map(r -> renameDto(folder, r.source(), r.target()))
                        .toList())
                .unchanged(plan.unchanged().stream()
                        .map(p -> p.getFileName().toString())
                        .toList())
                .build();
    }

    @Override
    public RelativizePdfResponse relativizePdfLinks(RelativizePdfRequest request) {
        Path pdf = Paths.get(request.getPdfPath()).toAbsolutePath().normalize();
        if (!Files.isRegularFile(pdf) || !"pdf".equals(FilenameNormalizer.extension(pdf.getFileName().toString()))) {
            throw new LinkerException(LinkerException.INVALID_ARGUMENT, "Not a PDF file: " + pdf);
        }
        Path output = request.getOutputPath() != null && !request.getOutputPath().isBlank()
                ? Paths.get(request.getOutputPath()).toAbsolutePath().normalize()
                : null;
        try {
            PdfLinkRelativizer.Result result = pdfLinkRelativizer.relativize(pdf, output);
            return RelativizePdfResponse.builder()
                    .output(result.output().toString())
                    .linksRewritten(result.linksRewritten())
                    .fragmentsRepaired(result.fragmentsRepaired())
                    .absoluteLinksRemaining(result.absoluteLinksRemaining())
                    .build();
        } catch (IOException e) {
            log.warn("Relativize failed for {}: {}", pdf, e.getMessage());
            throw new LinkerException(LinkerException.OUTPUT_FAILED, "Could not rewrite links in " + pdf + ": " + e.getMessage(), e);
        }
    }
}
