package com.imperium.exhibitlinker.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * 对一份源文档执行一次链接运行。未填写的选项取 app.linker.* 的配置值。
 */
@Data
@Schema(description = "链接运行请求")
public class LinkRunRequest {

    @NotBlank(message = "documentPath is required")
    @Size(max = 4096)
    @Schema(description = "源文档路径（PDF/TXT/MD）", requiredMode = Schema.RequiredMode.REQUIRED,
            example = "/cases/smith/brief.pdf")
    private String documentPath;

    @Size(max = 4096)
    @Schema(description = "Exhibits 目录；为空时用配置值，配置也为空时用源文档所在目录")
    private String exhibitsRoot;

    @Size(max = 4096)
    @Schema(description = "输出文件路径；为空时写到源文档旁，文件名加 _linked 后缀")
    private String outputPath;

    @Schema(description = "是否写出带链接的文档，默认 true")
    private Boolean writeOutput;

    @Schema(description = "是否规范化被引用的文件名（空格、句点换成下划线）")
    private Boolean sanitizeFilenames;

    @Schema(description = "规范化方式：rename 或 copy", example = "rename")
    private String sanitizeStrategy;

    @Schema(description = "只报告改名计划，不改动文件")
    private Boolean dryRun;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "模糊匹配相似度阈值", example = "0.8")
    private Double fuzzyThreshold;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Schema(description = "模糊匹配并列判定的相似度差", example = "0.02")
    private Double fuzzyTieEpsilon;

    @Min(0)
    @Max(10)
    @Schema(description = "被占用文件的重试次数", example = "3")
    private Integer maxPageScanRetries;

    @Schema(description = "目标阅读器：acrobat 或 chrome", example = "acrobat")
    private String viewer;

    @Schema(description = "只识别这些前缀的 Bates 编号", example = "[\"SMITH\"]")
    private List<@NotBlank(message = "batesPrefixes must not contain blank entries") String> batesPrefixes;
}
