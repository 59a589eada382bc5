package com.lingplug.cli;

/**
 * 命令行退出码
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int ERROR = 1;
    public static final int USAGE = 64;

    private ExitCodes() {
    }
}
