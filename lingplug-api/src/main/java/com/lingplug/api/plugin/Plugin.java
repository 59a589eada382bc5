package com.lingplug.api.plugin;

/**
 * 插件契约
 * <p>
 * 插件在运行时被动态发现和实例化，真正的初始化工作推迟到 {@link #load(LoadArguments)} 中完成。
 * 某一类插件与管理它的 PluginManager 之间约定 load 参数的含义。
 * </p>
 *
 * @author LingPlug
 */
public interface Plugin {

    /**
     * 加载前的启用检查
     *
     * @return false 表示插件应被禁用
     */
    default boolean shouldLoad() {
        return true;
    }

    /**
     * 由 PluginManager 在加载插件时调用
     *
     * @param arguments PluginManager 配置的加载参数
     * @return 加载结果，会被记录在容器中
     */
    default Object load(LoadArguments arguments) throws Exception {
        return null;
    }
}
