package com.imperium.exhibitlinker.pdf;

import java.io.Closeable;
import java.io.IOException;

/**
 * 已打开的 PDF。
 */
public interface PdfPages extends Closeable {

    int pageCount();

    /**
     * @param pageIndex 0 起的页序号
     */
    String pageText(int pageIndex) throws IOException;
}
