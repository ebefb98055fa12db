package com.imperium.exhibitlinker.pdf.impl;

import com.imperium.exhibitlinker.pdf.PdfPageSource;
import com.imperium.exhibitlinker.pdf.PdfPages;
import com.imperium.exhibitlinker.pdf.PdfTextSettings;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 基于 PDFBox 的逐页文本读取。
 */
@Component
public class PdfBoxPageSource implements PdfPageSource {

    @Override
    public PdfPages open(Path pdf) throws IOException {
        PDDocument doc = Loader.loadPDF(pdf.toFile());
        return new PdfBoxPages(doc);
    }

    private static final class PdfBoxPages implements PdfPages {

        private final PDDocument doc;
        private final PDFTextStripper stripper;

        private PdfBoxPages(PDDocument doc) {
            this.doc = doc;
            this.stripper = PdfTextSettings.apply(new PDFTextStripper());
        }

        @Override
        public int pageCount() {
            return doc.getNumberOfPages();
        }

        @Override
        public String pageText(int pageIndex) throws IOException {
            if (pageIndex < 0 || pageIndex >= doc.getNumberOfPages()) {
                throw new IllegalArgumentException("Page index out of range: " + pageIndex);
            }
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            return stripper.getText(doc);
        }

        @Override
        public void close() throws IOException {
            doc.close();
        }
    }
}
