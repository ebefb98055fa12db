package com.imperium.exhibitlinker.model.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "PDF 链接相对化结果")
public class RelativizePdfResponse {

    private String output;

    @Schema(description = "改写成相对路径的链接数")
    private int linksRewritten;

    @Schema(description = "还原的 %23page= 片段数")
    private int fragmentsRepaired;

    @Schema(description = "仍为绝对路径的 file 链接数")
    private int absoluteLinksRemaining;
}
