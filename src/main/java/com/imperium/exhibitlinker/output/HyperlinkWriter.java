package com.imperium.exhibitlinker.output;

import com.imperium.exhibitlinker.ingest.parser.DocumentFormat;
import com.imperium.exhibitlinker.ingest.parser.SourceText;
import com.imperium.exhibitlinker.model.link.PlacedLink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 把解析好的链接写进源文档的副本。源文档本身不改动。
 */
public interface HyperlinkWriter {

    boolean supports(DocumentFormat format);

    /** 输出文件的扩展名（含点） */
    String outputExtension();

    /**
     * @param source 源文档及其全文，links 的 sourceOffset 以该全文为准
     * @param links  按 sourceOffset 升序，互不重叠
     * @param output 输出文件路径
     * @return 实际写入的链接数
     */
    int write(SourceText source, List<PlacedLink> links, Path output) throws IOException;
}
