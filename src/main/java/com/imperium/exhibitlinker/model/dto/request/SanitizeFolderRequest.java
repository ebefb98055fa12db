package com.imperium.exhibitlinker.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 规范化一个目录下所有 Exhibit 命名文件的文件名。
 */
@Data
@Schema(description = "目录文件名规范化请求")
public class SanitizeFolderRequest {

    @NotBlank(message = "folderPath is required")
    @Size(max = 4096)
    @Schema(description = "目录路径（不递归）", requiredMode = Schema.RequiredMode.REQUIRED)
    private String folderPath;

    @Schema(description = "只报告改名计划，默认 true")
    private Boolean dryRun;

    @Schema(description = "rename 或 copy", example = "rename")
    private String strategy;
}
