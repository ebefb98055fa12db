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
@Schema(description = "取消运行结果")
public class CancelRunResponse {

    private String runId;

    @Schema(description = "是否找到正在执行的运行并已请求取消")
    private boolean accepted;
}
