package com.imperium.exhibitlinker.exception;

import lombok.Getter;

import java.io.IOException;

/**
 * 被锁定或暂时不可用的文件在重试用尽后仍失败。
 */
@Getter
public class TransientIoException extends IOException {

    private final int attempts;

    public TransientIoException(String operation, int attempts, IOException cause) {
        super(operation + " failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
        this.attempts = attempts;
    }
}
