package com.imperium.exhibitlinker.exception;

/**
 * 源文档无法读取，整次运行失败。
 */
public class SourceDocumentException extends LinkerException {

    public SourceDocumentException(String message) {
        super(SOURCE_UNREADABLE, message);
    }

    public SourceDocumentException(String message, Throwable cause) {
        super(SOURCE_UNREADABLE, message, cause);
    }
}
