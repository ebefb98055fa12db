package com.imperium.exhibitlinker.link;

import com.imperium.exhibitlinker.model.citation.BatesNumber;
import com.imperium.exhibitlinker.model.citation.Citation;
import com.imperium.exhibitlinker.model.citation.CitationKind;
import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.link.LinkTarget;
import com.imperium.exhibitlinker.model.link.Match;
import com.imperium.exhibitlinker.model.link.MatchConfidence;
import com.imperium.exhibitlinker.model.link.PageScanState;
import com.imperium.exhibitlinker.model.link.ViewerProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinkBuilderTest {

    @TempDir
    Path tempDir;

    private final LinkBuilder builder = new LinkBuilder();

    @Test
    void batesMatch_linksToPageWithTooltip() {
        Path pdf = tempDir.resolve("exhibits/SMITH_003.pdf");
        Match match = Match.of(bates("SMITH_005"), file(pdf, "pdf"), MatchConfidence.BATES_CONTAINMENT)
                .toBuilder()
                .resolvedPage(3)
                .scanState(PageScanState.FOUND)
                .build();

        LinkTarget target = builder.build(match, tempDir.resolve("briefs"), ViewerProfile.ACROBAT);

        assertThat(target.getRelativePath()).isEqualTo("../exhibits/SMITH_003.pdf");
        assertThat(target.getPageFragment()).isEqualTo("#page=3");
        assertThat(target.href()).isEqualTo("../exhibits/SMITH_003.pdf#page=3");
        assertThat(target.getDisplayText()).isEqualTo("SMITH_005");
        assertThat(target.getTooltip()).isEqualTo("Link to SMITH_003.pdf page 3 (Bates SMITH_005)");
    }

    @Test
    void exhibitWithoutPage_isDocumentLink() {
        Path pdf = tempDir.resolve("Ex_1 Memo.pdf");
        Match match = Match.of(exhibit("Ex. 1 Memo", "1 Memo"), file(pdf, "pdf"), MatchConfidence.EXACT);

        LinkTarget target = builder.build(match, tempDir, ViewerProfile.CHROME);

        assertThat(target.getPageFragment()).isNull();
        assertThat(target.href()).isEqualTo("Ex_1 Memo.pdf");
        assertThat(target.getTooltip()).isEqualTo("Link to Ex_1 Memo.pdf");
    }

    @Test
    void nonPdf_neverCarriesFragment() {
        Path docx = tempDir.resolve("Ex_3 Notes.docx");
        Match match = Match.of(exhibit("Ex. 3", "3"), file(docx, "docx"), MatchConfidence.NORMALIZED)
                .toBuilder()
                .resolvedPage(2)
                .build();

        assertThat(builder.build(match, tempDir, ViewerProfile.ACROBAT).getPageFragment()).isNull();
    }

    @Test
    void renamedFile_linksToNewName() {
        Path original = tempDir.resolve("Ex. 1 Memo.pdf");
        Path renamed = tempDir.resolve("Ex_1_Memo.pdf");
        Match match = Match.of(exhibit("Ex. 1 Memo", "1 Memo"), file(original, "pdf"), MatchConfidence.EXACT);

        LinkTarget target = builder.build(match, tempDir, ViewerProfile.CHROME, Map.of(original, renamed));

        assertThat(target.getRelativePath()).isEqualTo("Ex_1_Memo.pdf");
        assertThat(target.getTargetFile()).isEqualTo(renamed);
    }

    @Test
    void unresolvedMatch_isRejected() {
        Match match = Match.unresolved(exhibit("Ex. 9", "9"), "No file");

        assertThatThrownBy(() -> builder.build(match, tempDir, ViewerProfile.ACROBAT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Ex. 9");
    }

    private static CandidateFile file(Path path, String extension) {
        return CandidateFile.builder()
                .path(path)
                .relativeKey(path.getFileName().toString())
                .fileName(path.getFileName().toString())
                .extension(extension)
                .build();
    }

    private static Citation exhibit(String raw, String label) {
        return Citation.builder()
                .kind(CitationKind.EXHIBIT)
                .rawText(raw)
                .label(label)
                .identifier(label)
                .build();
    }

    private static Citation bates(String raw) {
        BatesNumber number = BatesNumber.parse(raw).orElseThrow();
        return Citation.builder()
                .kind(CitationKind.BATES)
                .rawText(raw)
                .label(number.label())
                .identifier(number.label())
                .bates(number)
                .build();
    }
}
