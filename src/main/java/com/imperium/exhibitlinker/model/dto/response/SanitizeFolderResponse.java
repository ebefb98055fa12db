package com.imperium.exhibitlinker.model.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "目录文件名规范化结果")
public class SanitizeFolderResponse {

    private String folder;

    private boolean dryRun;

    private String strategy;

    @Schema(description = "已执行（或计划执行）的改名")
    private List<RenameDto> renames;

    @Schema(description = "无需改动的 Exhibit 文件")
    private List<String> unchanged;
}
