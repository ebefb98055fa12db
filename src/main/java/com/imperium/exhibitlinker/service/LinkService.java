package com.imperium.exhibitlinker.service;

import com.imperium.exhibitlinker.model.dto.request.LinkRunRequest;
import com.imperium.exhibitlinker.model.dto.request.RelativizePdfRequest;
import com.imperium.exhibitlinker.model.dto.request.SanitizeFolderRequest;
import com.imperium.exhibitlinker.model.dto.response.LinkRunResponse;
import com.imperium.exhibitlinker.model.dto.response.RelativizePdfResponse;
import com.imperium.exhibitlinker.model.dto.response.SanitizeFolderResponse;

/**
 * 链接运行：读取源文档 → 识别引用 → 建索引 → 匹配与定位页码 → 规范化文件名 → 生成链接 → 写出。
 */
public interface LinkService {

    /**
     * 对一份源文档执行一次完整运行。单条引用的失败只进入结果的 issues，不中断运行。
     *
     * @param request 源文档与选项覆盖
     * @param runId   运行 ID，供 {@link #cancel(String)} 使用
     * @return 运行结果；被取消时包含取消前已生成的链接
     */
    LinkRunResponse run(LinkRunRequest request, String runId);

    /**
     * 请求取消正在执行的运行，在处理下一条引用之前生效。
     *
     * @return 找到该运行时返回 true
     */
    boolean cancel(String runId);

    /**
     * 规范化目录下（不递归）所有 Exhibit 命名文件的文件名，默认只报告计划。
     */
    SanitizeFolderResponse sanitizeFolder(SanitizeFolderRequest request);

    /**
     * 把 PDF 中的 file:/// 绝对链接改写为相对链接。
     */
    RelativizePdfResponse relativizePdfLinks(RelativizePdfRequest request);
}
