package com.imperium.exhibitlinker.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "PDF 链接相对化请求")
public class RelativizePdfRequest {

    @NotBlank(message = "pdfPath is required")
    @Size(max = 4096)
    @Schema(description = "要处理的 PDF", requiredMode = Schema.RequiredMode.REQUIRED)
    private String pdfPath;

    @Size(max = 4096)
    @Schema(description = "输出路径；为空时原地替换")
    private String outputPath;
}
