package com.lingplug.api.exception;

/**
 * LingPlug 基础异常
 *
 * @author LingPlug
 */
public class LingPlugException extends RuntimeException {

    public LingPlugException(String message) {
        super(message);
    }

    public LingPlugException(String message, Throwable cause) {
        super(message, cause);
    }
}
