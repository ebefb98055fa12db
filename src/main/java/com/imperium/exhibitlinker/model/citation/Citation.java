package com.imperium.exhibitlinker.model.citation;

import lombok.Builder;
import lombok.Value;

/**
 * 正文中识别出的一条引用。
 * <p>
 * rawText 总是原样出现在 sourceOffset 处；label 由 rawText 确定性导出。
 * 同一 Exhibit 被多次引用时每处各有一条记录。
 */
@Value
@Builder
public class Citation {

    CitationKind kind;

    /** 匹配到的原文片段，也是链接的显示文本 */
    String rawText;

    /** 规范化标识，如 "1 Memo"、"A"、"SMITH_005" */
    String label;

    /** 不带标题词的裸标识，如 "1"；Bates 引用与 label 相同 */
    String identifier;

    /** "at p. 9" 声明的页码（1 起），没有则为 null */
    Integer pageHint;

    /** 在文档文本中的字符位置 */
    int sourceOffset;

    /** Bates 引用解析后的编号，Exhibit 引用为 null */
    BatesNumber bates;

    public int getEndOffset() {
        return sourceOffset + rawText.length();
    }
}
