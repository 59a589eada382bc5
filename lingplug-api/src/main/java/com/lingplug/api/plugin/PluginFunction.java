package com.lingplug.api.plugin;

/**
 * 可以被暴露为插件的普通函数
 */
@FunctionalInterface
public interface PluginFunction {

    Object apply(Object... args) throws Exception;
}
