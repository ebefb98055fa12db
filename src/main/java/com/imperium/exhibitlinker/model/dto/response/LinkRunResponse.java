package com.imperium.exhibitlinker.model.dto.response;

import com.imperium.exhibitlinker.model.report.LinkIssue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 一次链接运行的结果与问题汇总。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "链接运行结果")
public class LinkRunResponse {

    private String runId;

    @Schema(description = "源文档路径")
    private String sourceDocument;

    @Schema(description = "写出的带链接文档；未写出时为 null")
    private String outputDocument;

    private String exhibitsRoot;

    @Schema(description = "识别出的引用数")
    private int citationsFound;

    @Schema(description = "生成的链接数")
    private int linksCreated;

    @Schema(description = "未解析的引用数")
    private int unresolved;

    @Schema(description = "运行是否被取消（已生成的链接仍然有效）")
    private boolean cancelled;

    @Schema(description = "是否只报告改名计划")
    private boolean dryRun;

    private List<LinkDto> links;

    private List<LinkIssue> issues;

    @Schema(description = "文件名规范化（dryRun 时为计划）")
    private List<RenameDto> renames;
}
