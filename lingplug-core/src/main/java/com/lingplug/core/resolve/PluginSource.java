package com.lingplug.core.resolve;

import com.lingplug.api.plugin.FunctionPluginRegistration;
import com.lingplug.api.plugin.PluginSpec;

/**
 * 可以解析出 PluginSpec 的来源对象
 * 只支持三种来源：现成的 PluginSpec、插件类、函数插件注册
 */
public sealed interface PluginSource {

    /**
     * 对任意对象分类
     */
    static PluginSource of(Object source) {
        if (source instanceof PluginSpec spec) {
            return new SpecSource(spec);
        }
        if (source instanceof Class<?> type) {
            return new ClassSource(type);
        }
        if (source instanceof FunctionPluginRegistration registration) {
            return new FunctionSource(registration);
        }
        return new Unsupported(source);
    }

    record SpecSource(PluginSpec spec) implements PluginSource {
    }

    record ClassSource(Class<?> type) implements PluginSource {
    }

    record FunctionSource(FunctionPluginRegistration registration) implements PluginSource {
    }

    record Unsupported(Object value) implements PluginSource {
    }
}
