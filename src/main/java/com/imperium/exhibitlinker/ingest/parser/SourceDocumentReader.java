package com.imperium.exhibitlinker.ingest.parser;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 读取源文档（PDF、TXT、MD）的全文。
 */
public interface SourceDocumentReader {

    /**
     * @param path 源文档路径，按扩展名选择解析方式
     * @return 全文；格式不支持时抛 {@link IllegalArgumentException}
     * @throws IOException 文件不可读或 PDF 损坏
     */
    SourceText read(Path path) throws IOException;
}
