package com.imperium.exhibitlinker.index;

import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.report.IssueType;
import com.imperium.exhibitlinker.pdf.FakePdfPageSource;
import com.imperium.exhibitlinker.pdf.PdfPageScanner;
import com.imperium.exhibitlinker.policy.IoRetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileIndexBuilderTest {

    @TempDir
    Path root;

    private final FileIndexBuilder builder = new FileIndexBuilder();
    private PdfPageScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new PdfPageScanner(new FakePdfPageSource(), IoRetryPolicy.noRetry());
    }

    @Test
    void build_indexesNestedFilesAndSkipsHiddenOnes() throws IOException {
        touch("Ex_1 Memo.pdf");
        touch("SMITH_003-SMITH_006.pdf");
        touch("sub/Ex. 2 Contract.docx");
        touch(".hidden.pdf");
        touch("~$Ex_2 Contract.docx");
        touch(".git/Ex_9.pdf");
        Path brief = touch("brief.md");

        FileIndex index = builder.build(root, List.of(brief), scanner);

        assertThat(index.getFiles()).extracting(CandidateFile::getRelativeKey)
                .containsExactly("Ex_1 Memo.pdf", "SMITH_003-SMITH_006.pdf", "sub/Ex. 2 Contract.docx");
        assertThat(index.getWarnings()).isEmpty();
        assertThat(index.size()).isEqualTo(3);
    }

    @Test
    void build_derivesNamesForMatching() throws IOException {
        touch("Ex_1 Memo.pdf");
        touch("SMITH_003-SMITH_006.pdf");
        touch("sub/Ex. 2 Contract.docx");

        List<CandidateFile> files = builder.build(root, scanner).getFiles();

        CandidateFile memo = files.get(0);
        assertThat(memo.getNormalizedName()).isEqualTo("ex_1_memo");
        assertThat(memo.getExhibitKey()).isEqualTo("1_memo");
        assertThat(memo.isPdf()).isTrue();
        assertThat(memo.isBatesNamed()).isFalse();
        assertThat(memo.getPath()).isEqualTo(root.resolve("Ex_1 Memo.pdf").toAbsolutePath().normalize());

        CandidateFile range = files.get(1);
        assertThat(range.getBatesStart().label()).isEqualTo("SMITH_003");
        assertThat(range.getBatesEnd().getNumber()).isEqualTo(6);
        assertThat(range.getExhibitKey()).isNull();
        assertThat(range.matchKey()).isEqualTo("smith_003_smith_006");

        CandidateFile contract = files.get(2);
        assertThat(contract.getExtension()).isEqualTo("docx");
        assertThat(contract.getExhibitKey()).isEqualTo("2_contract");
    }

    @Test
    void batesNamedPdfs_onlyPdfsWithBatesNames() throws IOException {
        touch("SMITH_003.pdf");
        touch("SMITH_010.docx");
        touch("Ex_1.pdf");

        FileIndex index = builder.build(root, scanner);

        assertThat(index.batesNamedPdfs()).extracting(CandidateFile::getFileName).containsExactly("SMITH_003.pdf");
    }

    @Test
    void missingRoot_yieldsEmptyIndexWithWarning() {
        FileIndex index = builder.build(root.resolve("nope"), scanner);

        assertThat(index.isEmpty()).isTrue();
        assertThat(index.getWarnings()).singleElement()
                .satisfies(w -> assertThat(w.getType()).isEqualTo(IssueType.INDEX_BUILD_FAILURE));
    }

    @Test
    void relativeKey_usesForwardSlashes() {
        assertThat(FileIndexBuilder.relativeKey(root, root.resolve("a").resolve("b").resolve("Ex_1.pdf")))
                .isEqualTo("a/b/Ex_1.pdf");
    }

    private Path touch(String relative) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.write(file, new byte[]{1});
    }
}
