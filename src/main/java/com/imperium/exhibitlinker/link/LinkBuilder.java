package com.imperium.exhibitlinker.link;

import com.imperium.exhibitlinker.model.citation.CitationKind;
import com.imperium.exhibitlinker.model.index.CandidateFile;
import com.imperium.exhibitlinker.model.link.LinkTarget;
import com.imperium.exhibitlinker.model.link.Match;
import com.imperium.exhibitlinker.model.link.ViewerProfile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Match → LinkTarget。目标路径先经过规范化改名映射，再相对源文档目录计算。
 */
@Component
public class LinkBuilder {

    public LinkTarget build(Match match, Path sourceDir, ViewerProfile viewer) {
        return build(match, sourceDir, viewer, Map.of());
    }

    /**
     * @param renamed 本次运行已落地的改名（原路径 → 新路径）
     */
    public LinkTarget build(Match match, Path sourceDir, ViewerProfile viewer, Map<Path, Path> renamed) {
        if (!match.isResolved()) {
            throw new IllegalArgumentException("Unresolved citation has no link target: "
                    + match.getCitation().getRawText());
        }
        CandidateFile file = match.getFile();
        Path target = renamed.getOrDefault(file.getPath(), file.getPath());
        String fileName = target.getFileName().toString();

        String fragment = null;
        if (file.isPdf() && match.getResolvedPage() != null) {
            fragment = viewer.pageFragment(match.getResolvedPage());
        }
        return LinkTarget.builder()
                .relativePath(RelativePaths.between(sourceDir, target))
                .pageFragment(fragment)
                .displayText(match.getCitation().getRawText())
                .tooltip(tooltip(match, fileName))
                .targetFile(target)
                .build();
    }

    static String tooltip(Match match, String fileName) {
        StringBuilder sb = new StringBuilder("Link to ").append(fileName);
        if (match.getResolvedPage() != null) {
            sb.append(" page ").append(match.getResolvedPage());
        }
        if (match.getCitation().getKind() == CitationKind.BATES) {
            sb.append(" (Bates ").append(match.getCitation().getLabel()).append(")");
        }
        return sb.toString();
    }
}
