package com.imperium.exhibitlinker.model.citation;

/**
 * 引用的语法种类。集合固定，匹配与页码定位阶段按 switch 穷举处理。
 */
public enum CitationKind {

    /** Ex. 1 / Exhibit A / Exh. 2B */
    EXHIBIT,

    /** SMITH_005 */
    BATES
}
