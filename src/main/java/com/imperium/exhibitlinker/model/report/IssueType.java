package com.imperium.exhibitlinker.model.report;

/**
 * 运行报告中的非致命问题类别。致命情况（源文档不可读、重命名冲突）走异常。
 */
public enum IssueType {

    /** 文档中没有任何引用，仅提示 */
    NO_CITATIONS_FOUND,

    /** 某条引用三种策略都没匹配上，或候选有歧义 */
    UNRESOLVED_CITATION,

    /** 目录遍历或文件读取失败，文件被跳过 */
    INDEX_BUILD_FAILURE,

    /** PDF 无法读取或损坏，链接降级为文档级 */
    PAGE_SCAN_FAILURE,

    /** Chrome 模式下目标文件名含空格或句点且未做规范化 */
    CHROME_UNSAFE_FILENAME
}
