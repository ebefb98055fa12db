package com.imperium.exhibitlinker.model.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 运行结束时汇总上报的单条问题。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "运行问题")
public class LinkIssue {

    private IssueType type;

    @Schema(description = "相关引用在文档中的位置")
    private Integer sourceOffset;

    @Schema(description = "相关引用原文")
    private String rawText;

    @Schema(description = "相关文件（相对 exhibits 根目录）")
    private String file;

    private String message;
}
