package com.imperium.exhibitlinker.controller;

import com.imperium.exhibitlinker.config.RunIdSupport;
import com.imperium.exhibitlinker.model.dto.request.LinkRunRequest;
import com.imperium.exhibitlinker.model.dto.request.RelativizePdfRequest;
import com.imperium.exhibitlinker.model.dto.request.SanitizeFolderRequest;
import com.imperium.exhibitlinker.model.dto.response.CancelRunResponse;
import com.imperium.exhibitlinker.model.dto.response.LinkRunResponse;
import com.imperium.exhibitlinker.model.dto.response.RelativizePdfResponse;
import com.imperium.exhibitlinker.model.dto.response.SanitizeFolderResponse;
import com.imperium.exhibitlinker.service.LinkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 链接运行与文件维护接口。
 */
@RestController
@RequestMapping("/api/v0")
@Tag(name = "Links", description = "引用解析与相对链接生成")
public class LinkController {

    private final LinkService linkService;

    public LinkController(LinkService linkService) {
        this.linkService = linkService;
    }

    /**
     * 对一份源文档执行链接运行。运行 ID 取 X-Run-Id 请求头，未提供时生成。
     */
    @PostMapping(value = "/links/runs", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "执行链接运行", description = "识别引用、匹配 exhibits 目录中的文件、定位页码并写出带链接的文档")
    public ResponseEntity<LinkRunResponse> run(@Valid @RequestBody LinkRunRequest request,
            HttpServletRequest httpRequest) {
        String runId = RunIdSupport.resolve(httpRequest);
        return ResponseEntity.ok(linkService.run(request, runId));
    }

    @PostMapping("/links/runs/{runId}/cancel")
    @Operation(summary = "取消运行", description = "在处理下一条引用之前停止；已生成的链接仍然返回，文件名规范化不再执行")
    public ResponseEntity<CancelRunResponse> cancel(
            @Parameter(description = "运行 ID", required = true) @PathVariable String runId) {
        boolean accepted = linkService.cancel(runId);
        return ResponseEntity.ok(CancelRunResponse.builder()
                .runId(runId)
                .accepted(accepted)
                .build());
    }

    @PostMapping(value = "/exhibits/sanitize", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "规范化 Exhibit 文件名", description = "空格与句点换成下划线；默认只报告计划（dryRun=true）")
    public ResponseEntity<SanitizeFolderResponse> sanitize(@Valid @RequestBody SanitizeFolderRequest request) {
        return ResponseEntity.ok(linkService.sanitizeFolder(request));
    }

    @PostMapping(value = "/pdf/relativize", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "PDF 链接相对化", description = "把 file:/// 绝对链接改写为相对 PDF 所在目录的链接，并还原 %23page=")
    public ResponseEntity<RelativizePdfResponse> relativize(@Valid @RequestBody RelativizePdfRequest request) {
        return ResponseEntity.ok(linkService.relativizePdfLinks(request));
    }
}
