package com.lingplug.api.plugin;

/**
 * 函数插件的自定义加载逻辑
 */
@FunctionalInterface
public interface LoadRoutine {

    Object load(LoadArguments arguments) throws Exception;
}
