package com.imperium.exhibitlinker.pdf;

import java.io.IOException;
import java.nio.file.Path;

/**
 * PDF 页面文本读取。只读，从不修改 PDF 本身。
 */
public interface PdfPageSource {

    /**
     * 打开 PDF，调用方负责关闭返回的句柄。
     *
     * @throws IOException 文件不可读、被占用或已损坏
     */
    PdfPages open(Path pdf) throws IOException;
}
