package com.lingplug.api.exception;

import lombok.Getter;

/**
 * 同一 group 内出现重复的入口点名称
 * 这是构建期配置错误，不应在运行时恢复
 *
 * @author LingPlug
 */
@Getter
public class DuplicateEntryPointException extends EntryPointException {

    private final String group;
    private final String name;

    public DuplicateEntryPointException(String group, String name) {
        super("Duplicate entry point " + group + " " + name);
        this.group = group;
        this.name = name;
    }
}
