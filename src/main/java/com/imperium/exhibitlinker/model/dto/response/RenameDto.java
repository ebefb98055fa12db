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
@Schema(description = "文件名规范化")
public class RenameDto {

    @Schema(example = "Ex. 1 Memo.pdf")
    private String from;

    @Schema(example = "Ex_1_Memo.pdf")
    private String to;
}
