package com.imperium.exhibitlinker.model.link;

/**
 * 匹配命中的策略，按尝试顺序排列。
 */
public enum MatchConfidence {

    /** 规范化标签与文件名（或 exhibitKey）完全相同 */
    EXACT,

    /** Bates 编号出现在某个 PDF 的页面扫描结果中 */
    BATES_CONTAINMENT,

    /** 忽略标点差异或按前缀命中 */
    NORMALIZED,

    /** 编辑距离相似度过阈值且无并列 */
    FUZZY
}
