package com.lingplug.api.entrypoint;

import java.util.Objects;

/**
 * 入口点：(group, name, value) 三元组，描述去哪里加载插件代码
 * <p>
 * group 即插件命名空间；name 在 group 内唯一；value 是一个不透明的定位符，
 * 通常为 {@code com.example.MyPlugin} 或 {@code com.example.Plugins:MEMBER}。
 * </p>
 */
public record EntryPoint(String group, String name, String value) {

    public EntryPoint {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    /**
     * @return {@code name=value} 形式
     */
    public String toPair() {
        return name + "=" + value;
    }

    @Override
    public String toString() {
        return "EntryPoint[" + group + "] " + name + " = " + value;
    }
}
