package com.imperium.exhibitlinker.ingest.parser.impl;

import com.imperium.exhibitlinker.ingest.parser.DocumentFormat;
import com.imperium.exhibitlinker.ingest.parser.SourceDocumentReader;
import com.imperium.exhibitlinker.ingest.parser.SourceText;
import com.imperium.exhibitlinker.pdf.PdfTextSettings;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 支持 PDF、TXT、MD 的源文档读取实现。
 */
@Service
public class SourceDocumentReaderImpl implements SourceDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(SourceDocumentReaderImpl.class);

    @Override
    public SourceText read(Path path) throws IOException {
        DocumentFormat format = DocumentFormat.fromFileName(path.getFileName().toString());
        String text = switch (format) {
            case PDF -> readPdf(path);
            case TEXT, MARKDOWN -> readText(path);
        };
        log.debug("Read {} ({}, {} chars)", path.getFileName(), format, text.length());
        return SourceText.builder()
                .path(path)
                .format(format)
                .fullText(text)
                .build();
    }

    private String readPdf(Path path) throws IOException {
        try (PDDocument doc = Loader.loadPDF(path.toFile())) {
            PDFTextStripper stripper = PdfTextSettings.apply(new PDFTextStripper());
            return stripper.getText(doc);
        } catch (IOException e) {
            log.warn("PDF parse failed: {}", e.getMessage());
            throw e;
        }
    }

    private String readText(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return normalizeLineBreaks(text);
    }

    static String normalizeLineBreaks(String s) {
        if (s == null) return "";
        return s.replace("\r\n", "\n").replace("\r", "\n");
    }
}
