package com.imperium.exhibitlinker.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条已生成的链接。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "已生成的链接")
public class LinkDto {

    private int sourceOffset;

    @Schema(description = "引用原文，即链接显示文本", example = "Ex. 1 Memo, at p. 9")
    private String rawText;

    @Schema(description = "EXHIBIT 或 BATES")
    private String kind;

    @Schema(description = "规范化标识", example = "1 Memo")
    private String label;

    @Schema(description = "目标文件（相对 exhibits 根目录，改名后）")
    private String file;

    @Schema(description = "写入文档的链接地址", example = "Ex_1_Memo.pdf#page=9")
    private String href;

    private String relativePath;

    private String pageFragment;

    private Integer page;

    @Schema(description = "EXACT / BATES_CONTAINMENT / NORMALIZED / FUZZY")
    private String confidence;

    private String tooltip;
}
