package com.lingplug.api.plugin;

/**
 * 插件工厂：无参地创建一个 Plugin 实例
 */
@FunctionalInterface
public interface PluginFactory {

    Plugin create() throws Exception;

    /**
     * 工厂的代码位置标识，格式为 {@code 类名} 或 {@code 类名:静态成员}
     * 匿名工厂返回 null，此时无法序列化为入口点
     */
    default String getLocator() {
        return null;
    }

    /**
     * 定义该工厂的类型，用于定位插件来自哪个 classpath 条目
     */
    default Class<?> getDeclaringType() {
        return getClass();
    }
}
