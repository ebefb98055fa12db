package com.imperium.exhibitlinker.match;

import com.imperium.exhibitlinker.extract.CitationExtractor;
import com.imperium.exhibitlinker.index.FileIndex;
import com.imperium.exhibitlinker.index.FileIndexBuilder;
import com.imperium.exhibitlinker.model.citation.Citation;
import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.link.Match;
import com.imperium.exhibitlinker.model.link.MatchConfidence;
import com.imperium.exhibitlinker.pdf.FakePdfPageSource;
import com.imperium.exhibitlinker.pdf.PdfPageScanner;
import com.imperium.exhibitlinker.policy.IoRetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CitationMatcherTest {

    @TempDir
    Path root;

    private final CitationExtractor extractor = new CitationExtractor();
    private FakePdfPageSource pages;

    @BeforeEach
    void setUp() {
        pages = new FakePdfPageSource();
    }

    // ---------- Exhibit ----------

    @Test
    void exhibit_exactNameWins() throws IOException {
        touch("Ex_1 Memo.pdf");
        touch("Ex_2 Contract.pdf");

        Match match = matcher().match(citation("See Ex. 1 Memo."));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.EXACT);
        assertThat(match.getFile().getFileName()).isEqualTo("Ex_1 Memo.pdf");
        assertThat(match.getResolvedPage()).isNull();
    }

    @Test
    void exhibit_casingAndPunctuationDoNotMatter() throws IOException {
        touch("EXHIBIT 1 - MEMO.pdf");

        Match match = matcher().match(citation("Ex. 1 Memo"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.EXACT);
    }

    @Test
    void exhibit_bareIdentifierMatchesTitledFile() throws IOException {
        touch("Ex_1 Memo.pdf");
        touch("Ex_2 Contract.pdf");

        Match match = matcher().match(citation("Exhibit 2"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.NORMALIZED);
        assertThat(match.getFile().getFileName()).isEqualTo("Ex_2 Contract.pdf");
    }

    @Test
    void exhibit_wrongTitleFallsBackToIdentifier() throws IOException {
        touch("Ex_1 Memo.pdf");
        touch("Ex_2 Contract.pdf");

        Match match = matcher().match(citation("Ex. 1 Agreement"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.NORMALIZED);
        assertThat(match.getFile().getFileName()).isEqualTo("Ex_1 Memo.pdf");
    }

    @Test
    void exhibit_compactFormIgnoresResidualPunctuation() throws IOException {
        touch("Ex_1-A.pdf");

        Match match = matcher().match(citation("Exhibit 1A"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.NORMALIZED);
        assertThat(match.getFile().getFileName()).isEqualTo("Ex_1-A.pdf");
    }

    @Test
    void exhibit_pdfPreferredOverOtherFormatsOfSameName() throws IOException {
        touch("Ex_3 Report.docx");
        touch("Ex_3 Report.pdf");

        Match match = matcher().match(citation("Ex. 3 Report"));

        assertThat(match.isResolved()).isTrue();
        assertThat(match.getFile().getExtension()).isEqualTo("pdf");
    }

    @Test
    void exhibit_twoDistinctCandidatesAreAmbiguous() throws IOException {
        touch("Ex_5 Letter.pdf");
        touch("Ex_5 Invoice.pdf");

        Match match = matcher().match(citation("Ex. 5"));

        assertThat(match.isResolved()).isFalse();
        assertThat(match.getUnresolvedReason()).startsWith("Ambiguous").contains("Ex_5 Invoice.pdf", "Ex_5 Letter.pdf");
    }

    @Test
    void exhibit_samePdfNameInTwoFoldersIsAmbiguous() throws IOException {
        touch("Ex_4 Letter.pdf");
        touch("old/Ex_4 Letter.pdf");

        Match match = matcher().match(citation("Ex. 4 Letter"));

        assertThat(match.isResolved()).isFalse();
        assertThat(match.getUnresolvedReason()).contains("old/Ex_4 Letter.pdf");
    }

    @Test
    void exhibit_typoResolvedByFuzzyMatch() throws IOException {
        touch("Ex_1 Memo.pdf");
        touch("7 Depositon Transcript.pdf");

        Match match = matcher().match(citation("Ex. 7 Deposition Transcript"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.FUZZY);
        assertThat(match.getFile().getFileName()).isEqualTo("7 Depositon Transcript.pdf");
    }

    @Test
    void exhibit_fuzzyTieIsNotGuessed() throws IOException {
        touch("9 Invoicey.pdf");
        touch("9 Invoicez.pdf");

        Match match = matcher().match(citation("Ex. 9 Invoices"));

        assertThat(match.isResolved()).isFalse();
        assertThat(match.getUnresolvedReason()).startsWith("Ambiguous fuzzy match");
    }

    @Test
    void exhibit_belowThresholdIsUnresolved() throws IOException {
        touch("Ex_1 Memo.pdf");

        Match match = matcher().match(citation("Ex. 42 Settlement Agreement"));

        assertThat(match.isResolved()).isFalse();
        assertThat(match.getUnresolvedReason()).startsWith("No file matches exhibit label '42 Settlement Agreement'");
    }

    @Test
    void exhibit_emptyFolder() {
        Match match = matcher().match(citation("Ex. 1"));

        assertThat(match.getUnresolvedReason()).isEqualTo("Exhibits folder is empty");
    }

    // ---------- Bates ----------

    @Test
    void bates_foundInsideNearestStartingPdf() throws IOException {
        batesPdfs();

        Match match = matcher().match(citation("SMITH_005"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.BATES_CONTAINMENT);
        assertThat(match.getFile().getFileName()).isEqualTo("SMITH_003.pdf");
        assertThat(pages.opens(root.resolve("SMITH_003.pdf"))).isEqualTo(1);
        assertThat(pages.opens(root.resolve("SMITH_001.pdf"))).isZero();
        assertThat(pages.opens(root.resolve("SMITH_010.pdf"))).isZero();
    }

    @Test
    void bates_otherPrefixInsideConcatenatedPdf() throws IOException {
        batesPdfs();

        Match match = matcher().match(citation("JONES_000123.0002"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.BATES_CONTAINMENT);
        assertThat(match.getFile().getFileName()).isEqualTo("SMITH_003.pdf");
    }

    @Test
    void bates_scansEachPdfOncePerRun() throws IOException {
        batesPdfs();
        CitationMatcher matcher = matcher();

        matcher.match(citation("SMITH_004"));
        matcher.match(citation("SMITH_005"));
        matcher.match(citation("SMITH-0005"));

        assertThat(pages.opens(root.resolve("SMITH_003.pdf"))).isEqualTo(1);
    }

    @Test
    void bates_notOnAnyPage() throws IOException {
        batesPdfs();

        Match match = matcher().match(citation("SMITH_099"));

        assertThat(match.isResolved()).isFalse();
        assertThat(match.getUnresolvedReason()).isEqualTo("Bates label SMITH_099 not found in any file");
    }

    @Test
    void bates_nonPdfNamedAfterLabel() throws IOException {
        touch("SMITH_020.docx");

        Match match = matcher().match(citation("SMITH_020"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.EXACT);
        assertThat(match.getFile().getFileName()).isEqualTo("SMITH_020.docx");
    }

    @Test
    void bates_unreadablePdfResolvedByNamedRange() throws IOException {
        Path broken = touch("SMITH_030-SMITH_040.pdf");
        pages.failing(broken, new IOException("Header doesn't contain versioninfo"));

        Match match = matcher().match(citation("SMITH_035"));

        assertThat(match.getConfidence()).isEqualTo(MatchConfidence.NORMALIZED);
        assertThat(match.getFile().getFileName()).isEqualTo("SMITH_030-SMITH_040.pdf");
    }

    @Test
    void containmentOrder_nearestSamePrefixFirst() throws IOException {
        batesPdfs();

        CitationMatcher matcher = matcher();

        assertThat(matcher.containmentOrder(citation("SMITH_005").getBates()))
                .extracting(CandidateFile::getFileName)
                .containsExactly("SMITH_003.pdf", "SMITH_001.pdf", "SMITH_010.pdf");
    }

    private void batesPdfs() throws IOException {
        pages.pdf(touch("SMITH_001.pdf"), "SMITH_001", "SMITH_002");
        pages.pdf(touch("SMITH_003.pdf"), "SMITH_003", "SMITH_004\nJONES_000123.0002", "SMITH_005");
        pages.pdf(touch("SMITH_010.pdf"), "SMITH_010");
    }

    private CitationMatcher matcher() {
        PdfPageScanner scanner = new PdfPageScanner(pages, IoRetryPolicy.noRetry());
        FileIndex index = new FileIndexBuilder().build(root, scanner);
        return new CitationMatcher(index, 0.8, 0.02);
    }

    private Citation citation(String text) {
        return extractor.extract(text).iterator().next();
    }

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.write(file, new byte[]{1});
    }
}
