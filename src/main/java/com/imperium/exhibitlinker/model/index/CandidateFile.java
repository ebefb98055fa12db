package com.imperium.exhibitlinker.model.index;

import com.imperium.exhibitlinker.model.citation.BatesNumber;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Exhibit 目录下扫描到的一个文件。每次运行构建一次，之后只读。
 */
@Value
@Builder
public class CandidateFile {

    /** 绝对路径（已 normalize） */
    Path path;

    /** 相对 exhibits 根目录的路径，分隔符统一为 / */
    String relativeKey;

    String fileName;

    /** 小写扩展名，不含点；没有扩展名时为空串 */
    String extension;

    /** 去扩展名、小写、空白与标点折叠为下划线后的名字，如 ex_1_memo */
    String normalizedName;

    /** 去掉开头 ex/exh/exhibit 关键字后的名字，如 1_memo；非 Exhibit 命名为 null */
    String exhibitKey;

    /** 文件名中编码的 Bates 起始编号，如 SMITH_003.pdf */
    BatesNumber batesStart;

    /** 文件名中编码的 Bates 结束编号，如 SMITH_003-SMITH_006.pdf；多数文件没有 */
    BatesNumber batesEnd;

    public boolean isPdf() {
        return "pdf".equals(extension);
    }

    public boolean isBatesNamed() {
        return batesStart != null;
    }

    /** 匹配时使用的名字：优先 exhibitKey */
    public String matchKey() {
        return exhibitKey != null ? exhibitKey : normalizedName;
    }
}
