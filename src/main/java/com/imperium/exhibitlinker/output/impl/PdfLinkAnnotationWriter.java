package com.imperium.exhibitlinker.output.impl;

import com.imperium.exhibitlinker.ingest.parser.DocumentFormat;
import com.imperium.exhibitlinker.ingest.parser.SourceText;
import com.imperium.exhibitlinker.model.link.PlacedLink;
import com.imperium.exhibitlinker.output.HyperlinkWriter;
import com.imperium.exhibitlinker.pdf.PdfTextSettings;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.action.PDActionURI;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationLink;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDBorderStyleDictionary;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PDF 源文档：在引用文字所在位置加上可点击的链接注解，另存为新文件。
 * <p>
 * 用与读取源文档相同的文本抽取设置重新抽取一遍，记下每个输出字符对应的字形位置，
 * 再把引用的字符区间换算成页面矩形；跨行的引用每行一个矩形。
 */
@Component
public class PdfLinkAnnotationWriter implements HyperlinkWriter {

    private static final Logger log = LoggerFactory.getLogger(PdfLinkAnnotationWriter.class);

    /** 抽取文本与引用位置不一致时，在该范围内就近查找原文 */
    private static final int OFFSET_WINDOW = 5;

    private static final float PADDING = 1f;

    @Override
    public boolean supports(DocumentFormat format) {
        return format == DocumentFormat.PDF;
    }

    @Override
    public String outputExtension() {
        return ".pdf";
    }

    @Override
    public int write(SourceText source, List<PlacedLink> links, Path output) throws IOException {
        try (PDDocument doc = Loader.loadPDF(source.getPath().toFile())) {
            GlyphMappingStripper stripper = PdfTextSettings.apply(new GlyphMappingStripper());
            String text = stripper.extract(doc);

            int written = 0;
            for (PlacedLink link : links) {
                int start = locate(text, link);
                if (start < 0) {
                    log.warn("Cannot place link for '{}' at offset {}", link.rawText(), link.sourceOffset());
                    continue;
                }
                List<LineBox> boxes = stripper.boxes(start, start + link.rawText().length());
                if (boxes.isEmpty()) {
                    log.warn("No glyphs under '{}' at offset {}", link.rawText(), link.sourceOffset());
                    continue;
                }
                for (LineBox box : boxes) {
                    addLink(doc.getPage(box.pageIndex()), box, link);
                }
                written++;
            }
            doc.save(output.toFile());
            log.info("Wrote {} of {} link(s) to {}", written, links.size(), output);
            return written;
        }
    }

    static int locate(String text, PlacedLink link) {
        int offset = link.sourceOffset();
        String raw = link.rawText();
        if (offset >= 0 && offset + raw.length() <= text.length() && text.startsWith(raw, offset)) {
            return offset;
        }
        int from = Math.max(0, offset - OFFSET_WINDOW);
        int found = text.indexOf(raw, from);
        return (found >= 0 && found <= offset + OFFSET_WINDOW) ? found : -1;
    }

    private static void addLink(PDPage page, LineBox box, PlacedLink link) throws IOException {
        PDRectangle crop = page.getCropBox();
        float pageHeight = box.pageHeight();
        PDRectangle rect = new PDRectangle(
                crop.getLowerLeftX() + box.minX() - PADDING,
                crop.getLowerLeftY() + pageHeight - box.bottom() - PADDING,
                box.maxX() - box.minX() + 2 * PADDING,
                box.bottom() - box.top() + 2 * PADDING);

        PDActionURI action = new PDActionURI();
        action.setURI(link.target().href());

        PDBorderStyleDictionary border = new PDBorderStyleDictionary();
        border.setWidth(0);

        PDAnnotationLink annotation = new PDAnnotationLink();
        annotation.setRectangle(rect);
        annotation.setBorderStyle(border);
        annotation.setAction(action);
        annotation.setContents(link.target().getTooltip());

        List<PDAnnotation> annotations = new ArrayList<>(page.getAnnotations());
        annotations.add(annotation);
        page.setAnnotations(annotations);
    }

    /** 一行上的链接区域，坐标为自上而下的文本坐标 */
    record LineBox(int pageIndex, float pageHeight, float minX, float maxX, float top, float bottom) {
    }

    /**
     * 抽取文本的同时记录每个输出字符对应的字形。
     */
    static final class GlyphMappingStripper extends PDFTextStripper {

        private final Map<Integer, Glyph> glyphs = new HashMap<>();
        private StringWriter buffer;

        String extract(PDDocument doc) throws IOException {
            buffer = new StringWriter();
            writeText(doc, buffer);
            return buffer.toString();
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            int base = buffer.getBuffer().length();
            int n = text.length();
            int m = textPositions.size();
            if (m > 0) {
                for (int i = 0; i < n; i++) {
                    int idx = (n == m) ? i : Math.min(m - 1, (int) ((long) i * m / n));
                    glyphs.put(base + i, new Glyph(getCurrentPageNo() - 1, textPositions.get(idx)));
                }
            }
            super.writeString(text, textPositions);
        }

        List<LineBox> boxes(int start, int end) {
            List<LineBox> boxes = new ArrayList<>();
            LineBox current = null;
            float currentBaseline = 0;
            for (int offset = start; offset < end; offset++) {
                Glyph g = glyphs.get(offset);
                if (g == null) {
                    continue;
                }
                TextPosition p = g.position();
                float height = Math.max(p.getHeightDir(), 1f);
                float x = p.getXDirAdj();
                float baseline = p.getYDirAdj();
                boolean sameLine = current != null && current.pageIndex() == g.pageIndex()
                        && Math.abs(baseline - currentBaseline) <= height / 2;
                if (!sameLine) {
                    if (current != null) {
                        boxes.add(current);
                    }
                    current = new LineBox(g.pageIndex(), p.getPageHeight(), x, x + p.getWidthDirAdj(),
                            baseline - height, baseline);
                    currentBaseline = baseline;
                } else {
                    current = new LineBox(current.pageIndex(), current.pageHeight(),
                            Math.min(current.minX(), x),
                            Math.max(current.maxX(), x + p.getWidthDirAdj()),
                            Math.min(current.top(), baseline - height),
                            Math.max(current.bottom(), baseline));
                }
            }
            if (current != null) {
                boxes.add(current);
            }
            return boxes;
        }

        private record Glyph(int pageIndex, TextPosition position) {
        }
    }
}
