package com.imperium.exhibitlinker.model.link;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * 一条已解析引用最终输出的链接目标。
 */
@Value
@Builder
public class LinkTarget {

    /** 从源文档所在目录到目标文件的相对路径，使用 / 分隔 */
    String relativePath;

    /** 如 #page=3；文档级链接为 null */
    String pageFragment;

    String displayText;

    /** 悬停提示，如 "Link to SMITH_003.pdf page 3 (Bates SMITH_005)" */
    String tooltip;

    /** 目标文件的绝对路径（规范化重命名之后） */
    Path targetFile;

    public String href() {
        return pageFragment != null ? relativePath + pageFragment : relativePath;
    }
}
