package com.lingplug.core.build;

import com.lingplug.api.exception.LingPlugException;

/**
 * 入口点声明文件的生成方式
 */
public enum EntrypointBuildMode {

    /**
     * 构建时自动发现插件并写入 classes 目录
     */
    BUILD_HOOK("build-hook"),

    /**
     * 由开发者手动生成静态文件并纳入版本管理
     */
    MANUAL("manual");

    private final String value;

    EntrypointBuildMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 同时接受 {@code build-hook} 与 {@code BUILD_HOOK} 两种写法
     */
    public static EntrypointBuildMode fromValue(String value) {
        for (EntrypointBuildMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new LingPlugException("unknown entrypoint build mode: " + value);
    }
}
