package com.imperium.exhibitlinker.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

public final class RunIdSupport {

    public static final String HEADER_RUN_ID = "X-Run-Id";
    public static final String ATTR_RUN_ID = "runId";

    private RunIdSupport() {
    }

    public static String newRunId() {
        return "run_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return newRunId();
        }
        Object attr = request.getAttribute(ATTR_RUN_ID);
        if (attr instanceof String value && !value.isBlank()) {
            return value;
        }
        String headerValue = request.getHeader(HEADER_RUN_ID);
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue;
        }
        String generated = newRunId();
        request.setAttribute(ATTR_RUN_ID, generated);
        return generated;
    }
}
