package com.imperium.exhibitlinker.ingest.parser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * 源文档的全文。引用的 sourceOffset 都以 fullText 为准。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceText {

    private Path path;

    private DocumentFormat format;

    /** 抽取出的完整正文，换行统一为 \n，不做 trim */
    private String fullText;
}
