package com.imperium.exhibitlinker.output.impl;

import com.imperium.exhibitlinker.pdf.TestPdfs;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class PdfLinkRelativizerTest {

    @TempDir
    Path tempDir;

    private final PdfLinkRelativizer relativizer = new PdfLinkRelativizer();

    @Test
    void relativize_rewritesAbsoluteFileLinks() throws IOException {
        Path exhibit = tempDir.resolve("exhibits/Ex_1.pdf").toAbsolutePath();
        Path pdf = TestPdfs.withLinks(tempDir.resolve("briefs/brief_linked.pdf"),
                "file://" + exhibit + "%23page=3",
                "https://example.com/docket",
                "file:///C:/Cases/Other/Ex_2.pdf");

        PdfLinkRelativizer.Result result = relativizer.relativize(pdf, null);

        assertThat(result.output()).isEqualTo(pdf);
        assertThat(result.linksRewritten()).isEqualTo(1);
        assertThat(result.fragmentsRepaired()).isEqualTo(1);
        assertThat(result.absoluteLinksRemaining()).isEqualTo(1);
        assertThat(uris(pdf)).containsExactly(
                "../exhibits/Ex_1.pdf#page=3",
                "https://example.com/docket",
                "file:///C:/Cases/Other/Ex_2.pdf");
    }

    @Test
    void relativize_toSeparateOutputLeavesInputUntouched() throws IOException {
        Path exhibit = tempDir.resolve("Ex_1.pdf").toAbsolutePath();
        Path pdf = TestPdfs.withLinks(tempDir.resolve("brief.pdf"), "file://" + exhibit);
        Path output = tempDir.resolve("brief_relative.pdf");

        PdfLinkRelativizer.Result result = relativizer.relativize(pdf, output);

        assertThat(result.output()).isEqualTo(output);
        assertThat(uris(output)).containsExactly("Ex_1.pdf");
        assertThat(uris(pdf)).containsExactly("file://" + exhibit);
        try (Stream<Path> leftovers = Files.list(tempDir)) {
            assertThat(leftovers.map(p -> p.getFileName().toString()))
                    .noneMatch(name -> name.startsWith(".relativize-"));
        }
    }

    @Test
    void toRelative_decodesEscapedCharacters() {
        assertThat(PdfLinkRelativizer.toRelative("file:///tmp/case/Ex%201%20Memo.pdf#page=2", Path.of("/tmp/case/briefs")))
                .isEqualTo("../Ex 1 Memo.pdf#page=2");
    }

    @Test
    void toRelative_ignoresOtherSchemes() {
        assertThat(PdfLinkRelativizer.toRelative("https://example.com/Ex_1.pdf", Path.of("/tmp"))).isNull();
        assertThat(PdfLinkRelativizer.toRelative("Ex_1.pdf#page=2", Path.of("/tmp"))).isNull();
    }

    private static List<String> uris(Path pdf) throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf.toFile())) {
            return doc.getPage(0).getAnnotations().stream()
                    .filter(PDAnnotationLink.class::isInstance)
                    .map(a -> ((PDActionURI) ((PDAnnotationLink) a).getAction()).getURI())
                    .toList();
        }
    }
}
