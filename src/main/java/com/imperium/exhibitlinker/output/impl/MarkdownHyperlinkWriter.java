package com.imperium.exhibitlinker.output.impl;

import com.imperium.exhibitlinker.ingest.parser.DocumentFormat;
import com.imperium.exhibitlinker.ingest.parser.SourceText;
import com.imperium.exhibitlinker.model.link.LinkTarget;
import com.imperium.exhibitlinker.model.link.PlacedLink;
import com.imperium.exhibitlinker.output.HyperlinkWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 文本类源文档：把每处引用替换成 Markdown 链接 [原文](相对路径#page=N "提示")。
 */
@Component
public class MarkdownHyperlinkWriter implements HyperlinkWriter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownHyperlinkWriter.class);

    @Override
    public boolean supports(DocumentFormat format) {
        return format.isText();
    }

    @Override
    public String outputExtension() {
        return ".md";
    }

    @Override
    public int write(SourceText source, List<PlacedLink> links, Path output) throws IOException {
        String linked = render(source.getFullText(), links);
        Files.writeString(output, linked, StandardCharsets.UTF_8);
        log.info("Wrote {} link(s) to {}", links.size(), output);
        return links.size();
    }

    /**
     * 从后往前替换，前面链接的位置不受影响。
     */
    static String render(String text, List<PlacedLink> links) {
        List<PlacedLink> ordered = new ArrayList<>(links);
        ordered.sort(Comparator.comparingInt(PlacedLink::sourceOffset).reversed());
        StringBuilder sb = new StringBuilder(text);
        for (PlacedLink link : ordered) {
            String actual = text.substring(link.sourceOffset(), link.endOffset());
            if (!actual.equals(link.rawText())) {
                throw new IllegalStateException("Text at offset " + link.sourceOffset()
                        + " is '" + actual + "', expected '" + link.rawText() + "'");
            }
            sb.replace(link.sourceOffset(), link.endOffset(), markdownLink(link.rawText(), link.target()));
        }
        return sb.toString();
    }

    static String markdownLink(String text, LinkTarget target) {
        String href = target.href();
        String destination = (href.contains(" ") || href.contains("(") || href.contains(")"))
                ? "<" + href + ">"
                : href;
        StringBuilder sb = new StringBuilder()
                .append('[').append(escapeText(text)).append("](").append(destination);
        if (target.getTooltip() != null && !target.getTooltip().isBlank()) {
            sb.append(" \"").append(target.getTooltip().replace("\"", "\\\"")).append('"');
        }
        return sb.append(')').toString();
    }

    private static String escapeText(String text) {
        return text.replace("[", "\\[").replace("]", "\\]");
    }
}
