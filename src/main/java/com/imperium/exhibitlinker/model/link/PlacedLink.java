package com.imperium.exhibitlinker.model.link;

/**
 * 交给输出写入方的 (位置, 原文, 链接目标) 三元组。
 */
public record PlacedLink(int sourceOffset, String rawText, LinkTarget target) {

    public int endOffset() {
        return sourceOffset + rawText.length();
    }
}
