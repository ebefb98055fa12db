package com.imperium.exhibitlinker.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 每个请求一个运行 ID：取 X-Run-Id 请求头或新生成，放进 MDC 并回写响应头。
 */
@Component
public class RunIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String runId = request.getHeader(RunIdSupport.HEADER_RUN_ID);
        if (runId == null || runId.isBlank()) {
            runId = RunIdSupport.newRunId();
        }
        request.setAttribute(RunIdSupport.ATTR_RUN_ID, runId);
        response.setHeader(RunIdSupport.HEADER_RUN_ID, runId);
        MDC.put(RunIdSupport.ATTR_RUN_ID, runId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RunIdSupport.ATTR_RUN_ID);
        }
    }
}
