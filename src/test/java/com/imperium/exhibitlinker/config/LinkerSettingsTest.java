package com.imperium.exhibitlinker.config;

import com.imperium.exhibitlinker.exception.LinkerException;
import com.imperium.exhibitlinker.link.SanitizeStrategy;
import com.imperium.exhibitlinker.model.dto.request.LinkRunRequest;
import com.imperium.exhibitlinker.model.link.ViewerProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinkerSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void defaults_comeFromConfiguration() {
        LinkerSettings settings = new LinkerSettings("", true, "copy", 0.75, 0.05, 4, 50, "chrome", "SMITH, JONES", "_links");

        LinkRunOptions options = settings.resolve(request(), tempDir.resolve("brief.md"));

        assertThat(options.getExhibitsRoot()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(options.isSanitizeFilenames()).isTrue();
        assertThat(options.getSanitizeStrategy()).isEqualTo(SanitizeStrategy.COPY);
        assertThat(options.getFuzzyThreshold()).isEqualTo(0.75);
        assertThat(options.getMaxPageScanRetries()).isEqualTo(4);
        assertThat(options.getViewer()).isEqualTo(ViewerProfile.CHROME);
        assertThat(options.getBatesPrefixes()).containsExactly("SMITH", "JONES");
        assertThat(options.getOutputSuffix()).isEqualTo("_links");
        assertThat(options.isWriteOutput()).isTrue();
        assertThat(options.isDryRun()).isFalse();
    }

    @Test
    void requestOverridesConfiguration() {
        LinkerSettings settings = new LinkerSettings(tempDir.resolve("configured").toString(), false, "rename",
                0.8, 0.02, 2, 1, "acrobat", "", "_linked");
        LinkRunRequest request = request();
        request.setExhibitsRoot(tempDir.resolve("override").toString());
        request.setFuzzyThreshold(0.9);
        request.setViewer("Chrome");
        request.setBatesPrefixes(List.of("ABC"));
        request.setWriteOutput(false);

        LinkRunOptions options = settings.resolve(request, tempDir.resolve("brief.md"));

        assertThat(options.getExhibitsRoot()).isEqualTo(tempDir.resolve("override").toAbsolutePath().normalize());
        assertThat(options.getFuzzyThreshold()).isEqualTo(0.9);
        assertThat(options.getViewer()).isEqualTo(ViewerProfile.CHROME);
        assertThat(options.getBatesPrefixes()).containsExactly("ABC");
        assertThat(options.isWriteOutput()).isFalse();
    }

    @Test
    void blankRequestPrefixes_areDropped() {
        LinkerSettings settings = new LinkerSettings("", false, "rename", 0.8, 0.02, 2, 1, "acrobat", "JONES", "_linked");
        LinkRunRequest request = request();
        request.setBatesPrefixes(Arrays.asList(" SMITH ", null, ""));

        assertThat(settings.resolve(request, tempDir.resolve("brief.md")).getBatesPrefixes())
                .containsExactly("SMITH");

        request.setBatesPrefixes(Arrays.asList(null, " "));

        assertThat(settings.resolve(request, tempDir.resolve("brief.md")).getBatesPrefixes())
                .containsExactly("JONES");
    }

    @Test
    void outOfRangeConfigurationIsClamped() {
        LinkerSettings settings = new LinkerSettings("", false, "rename", 1.7, -0.1, 99, 0, "acrobat", "", " ");

        LinkRunOptions options = settings.resolve(request(), tempDir.resolve("brief.md"));

        assertThat(options.getFuzzyThreshold()).isEqualTo(1.0);
        assertThat(options.getFuzzyTieEpsilon()).isEqualTo(0.0);
        assertThat(options.getMaxPageScanRetries()).isEqualTo(10);
        assertThat(options.getRetryBackoffMs()).isEqualTo(1L);
        assertThat(options.getOutputSuffix()).isEqualTo("_linked");
    }

    @Test
    void unknownStrategy_isInvalidArgument() {
        LinkerSettings settings = new LinkerSettings("", false, "rename", 0.8, 0.02, 2, 1, "acrobat", "", "_linked");
        LinkRunRequest request = request();
        request.setSanitizeStrategy("shred");

        assertThatThrownBy(() -> settings.resolve(request, tempDir.resolve("brief.md")))
                .isInstanceOfSatisfying(LinkerException.class,
                        e -> assertThat(e.getCode()).isEqualTo(LinkerException.INVALID_ARGUMENT))
                .hasMessageContaining("shred");
    }

    private static LinkRunRequest request() {
        LinkRunRequest request = new LinkRunRequest();
        request.setDocumentPath("brief.md");
        return request;
    }
}
