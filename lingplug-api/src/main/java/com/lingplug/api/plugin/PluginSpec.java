package com.lingplug.api.plugin;

import lombok.Getter;
import lombok.NonNull;

import java.util.Objects;

/**
 * 插件规格：用命名空间 + 名称唯一标识一个插件，并持有能创建插件实例的工厂
 * <p>
 * 最简单的情况下工厂就是插件类本身。入口点可以直接指向一个 PluginSpec，
 * 也可以指向一个自带命名空间和名称的插件类，由 PluginSpecResolver 动态构造 PluginSpec。
 * </p>
 */
@Getter
public final class PluginSpec {

    private final String namespace;
    private final String name;
    private final PluginFactory factory;

    public PluginSpec(@NonNull String namespace, @NonNull String name, @NonNull PluginFactory factory) {
        this.namespace = namespace;
        this.name = name;
        this.factory = factory;
    }

    /**
     * 以插件类为工厂创建规格
     */
    public static PluginSpec of(String namespace, String name, Class<? extends Plugin> pluginType) {
        return new PluginSpec(namespace, name, new ClassPluginFactory(pluginType));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginSpec that)) return false;
        return namespace.equals(that.namespace)
                && name.equals(that.name)
                && factory.equals(that.factory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name, factory);
    }

    @Override
    public String toString() {
        return String.format("PluginSpec(%s.%s = %s)", namespace, name, factory);
    }
}
