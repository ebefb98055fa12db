package com.imperium.exhibitlinker.exception;

import lombok.Getter;

import java.util.List;

/**
 * 规范化后的文件名冲突。抛出时尚未改动任何文件。
 */
@Getter
public class SanitizationConflictException extends LinkerException {

    private final List<String> conflicts;

    public SanitizationConflictException(List<String> conflicts) {
        super(SANITIZATION_CONFLICT, "Sanitized file names collide: " + String.join("; ", conflicts));
        this.conflicts = List.copyOf(conflicts);
    }
}
