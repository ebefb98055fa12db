package com.imperium.exhibitlinker.exception;

import lombok.Getter;

/**
 * 运行级致命错误，code 对应接口 error.code。
 */
@Getter
public class LinkerException extends RuntimeException {

    public static final String INVALID_ARGUMENT = "invalid_argument";
    public static final String SOURCE_UNREADABLE = "source_unreadable";
    public static final String SANITIZATION_CONFLICT = "sanitization_conflict";
    public static final String SANITIZATION_FAILED = "sanitization_failed";
    public static final String OUTPUT_FAILED = "output_failed";

    private final String code;

    public LinkerException(String code, String message) {
        super(message);
        this.code = code;
    }

    public LinkerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
