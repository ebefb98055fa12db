package com.imperium.exhibitlinker.link;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RelativePathsTest {

    @TempDir
    Path tempDir;

    @Test
    void between_siblingFolder() {
        Path sourceDir = tempDir.resolve("case/briefs");
        Path target = tempDir.resolve("case/exhibits/Ex_1 Memo.pdf");

        assertThat(RelativePaths.between(sourceDir, target)).isEqualTo("../exhibits/Ex_1 Memo.pdf");
    }

    @Test
    void between_nestedFolder() {
        Path sourceDir = tempDir.resolve("case");
        Path target = tempDir.resolve("case/exhibits/bates/SMITH_003.pdf");

        assertThat(RelativePaths.between(sourceDir, target)).isEqualTo("exhibits/bates/SMITH_003.pdf");
    }

    @Test
    void between_unchangedWhenWholeTreeMoves() {
        Path before = tempDir.resolve("old/case");
        Path after = tempDir.resolve("archive/2026/case");

        assertThat(RelativePaths.between(before.resolve("briefs"), before.resolve("exhibits/Ex_2.pdf")))
                .isEqualTo(RelativePaths.between(after.resolve("briefs"), after.resolve("exhibits/Ex_2.pdf")));
    }

    @Test
    void between_normalizesDotSegments() {
        Path sourceDir = tempDir.resolve("case/briefs/./drafts/..");
        Path target = tempDir.resolve("case/exhibits/../exhibits/Ex_1.pdf");

        assertThat(RelativePaths.between(sourceDir, target)).isEqualTo("../exhibits/Ex_1.pdf");
    }
}
