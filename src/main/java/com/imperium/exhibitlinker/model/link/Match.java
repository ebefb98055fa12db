package com.imperium.exhibitlinker.model.link;

import com.imperium.exhibitlinker.model.citation.Citation;
import com.imperium.exhibitlinker.model.index.CandidateFile;
import lombok.Builder;
import lombok.Value;

/**
 * 一条引用在文件索引上的解析结果。每条引用恰好一个 Match，file 为 null 表示未解析。
 */
@Value
@Builder(toBuilder = true)
public class Match {

    Citation citation;

    CandidateFile file;

    MatchConfidence confidence;

    /** 1 起的页码；只有页码定位成功时才有值 */
    Integer resolvedPage;

    @Builder.Default
    PageScanState scanState = PageScanState.NOT_STARTED;

    /** 未解析原因 */
    String unresolvedReason;

    public boolean isResolved() {
        return file != null;
    }

    public static Match unresolved(Citation citation, String reason) {
        return Match.builder()
                .citation(citation)
                .unresolvedReason(reason)
                .build();
    }

    public static Match of(Citation citation, CandidateFile file, MatchConfidence confidence) {
        return Match.builder()
                .citation(citation)
                .file(file)
                .confidence(confidence)
                .build();
    }
}
