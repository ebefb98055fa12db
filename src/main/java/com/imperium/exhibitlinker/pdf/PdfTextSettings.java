package com.imperium.exhibitlinker.pdf;

import org.apache.pdfbox.text.PDFTextStripper;

/**
 * 所有文本抽取共用的 stripper 设置。源文档读取与链接注解写入必须得到相同的文本，
 * 引用的 sourceOffset 才能对回页面上的字形。
 */
public final class PdfTextSettings {

    public static final String LINE_SEPARATOR = "\n";

    public static <T extends PDFTextStripper> T apply(T stripper) {
        stripper.setLineSeparator(LINE_SEPARATOR);
        stripper.setSortByPosition(true);
        return stripper;
    }

    private PdfTextSettings() {}
}
