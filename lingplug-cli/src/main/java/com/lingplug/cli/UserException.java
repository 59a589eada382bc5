package com.lingplug.cli;

/**
 * 用户输入导致的错误，只打印消息，不打印堆栈
 */
public class UserException extends Exception {

    private final int exitCode;

    public UserException(int exitCode, String message) {
        super(message);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
