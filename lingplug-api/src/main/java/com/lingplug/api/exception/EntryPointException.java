package com.lingplug.api.exception;

/**
 * 入口点（entry point）构造或解析异常
 *
 * @author LingPlug
 */
public class EntryPointException extends LingPlugException {

    public EntryPointException(String message) {
        super(message);
    }

    public EntryPointException(String message, Throwable cause) {
        super(message, cause);
    }
}
