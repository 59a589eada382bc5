package com.lingplug.api.listener;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.plugin.LoadArguments;
import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginSpec;

/**
 * 插件生命周期监听器
 * <p>
 * 挂到 PluginManager 上以响应插件生命周期的每一次状态迁移，所有方法默认空实现。
 * 在 {@link #onInitAfter} 或 {@link #onLoadBefore} 中抛出
 * {@link com.lingplug.api.exception.PluginDisabledException} 可以否决该插件；
 * 其他异常会被记录日志后忽略。
 * </p>
 *
 * @author LingPlug
 */
public interface PluginLifecycleListener {

    /**
     * 入口点无法解析为 PluginSpec
     */
    default void onResolveException(String namespace, EntryPoint entryPoint, Throwable exception) {
        // Default empty implementation
    }

    default void onResolveAfter(PluginSpec spec) {
        // Default empty implementation
    }

    default void onInitException(PluginSpec spec, Throwable exception) {
        // Default empty implementation
    }

    default void onInitAfter(PluginSpec spec, Plugin plugin) {
        // Default empty implementation
    }

    /**
     * 即将调用插件的 load 方法
     *
     * @param arguments 即将传给 load 的参数
     */
    default void onLoadBefore(PluginSpec spec, Plugin plugin, LoadArguments arguments) {
        // Default empty implementation
    }

    default void onLoadAfter(PluginSpec spec, Plugin plugin, Object result) {
        // Default empty implementation
    }

    default void onLoadException(PluginSpec spec, Plugin plugin, Throwable exception) {
        // Default empty implementation
    }
}
