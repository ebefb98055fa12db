package com.imperium.exhibitlinker.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 测试用 PDF：每个参数一页，页内按 \n 分行。
 */
public final class TestPdfs {

    public static Path write(Path file, String... pages) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (PDDocument doc = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String text : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(font, 12);
                    cs.newLineAtOffset(72, 720);
                    for (String line : text.split("\n")) {
                        cs.showText(line);
                        cs.newLineAtOffset(0, -16);
                    }
                    cs.endText();
                }
            }
            doc.save(file.toFile());
        }
        return file;
    }

    /** pages 页，第 i 页（1 起）的文本为 "Page i" */
    public static Path numbered(Path file, int pages) throws IOException {
        String[] texts = new String[pages];
        for (int i = 0; i < pages; i++) {
            texts[i] = "Page " + (i + 1);
        }
        return write(file, texts);
    }

    /** 单页 PDF，页面上带若干 URI 链接注解 */
    public static Path withLinks(Path file, String... uris) throws IOException {
        write(file, "Linked exhibits");
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try (PDDocument doc = Loader.loadPDF(file.toFile())) {
            PDPage page = doc.getPage(0);
            List<PDAnnotation> annotations = new ArrayList<>(page.getAnnotations());
            float y = 700;
            for (String uri : uris) {
                PDActionURI action = new PDActionURI();
                action.setURI(uri);
                PDAnnotationLink link = new PDAnnotationLink();
                link.setRectangle(new PDRectangle(72, y, 100, 14));
                link.setAction(action);
                annotations.add(link);
                y -= 20;
            }
            page.setAnnotations(annotations);
            doc.save(temp.toFile());
        }
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        return file;
    }

    private TestPdfs() {}
}
