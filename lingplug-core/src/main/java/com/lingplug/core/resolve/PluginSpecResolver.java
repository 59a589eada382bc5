package com.lingplug.core.resolve;

import com.lingplug.api.annotation.LingPlugin;
import com.lingplug.api.exception.PluginResolutionException;
import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginSpec;

/**
 * 从发现的对象构造 PluginSpec
 * <p>
 * 插件类需要实现 {@link Plugin} 并带有 {@link LingPlugin} 注解，命名空间与名称取自注解，
 * 工厂为类本身。需要其他解析策略的调用方应先自行解析成 PluginSpec。
 */
public class PluginSpecResolver {

    public PluginSpec resolve(Object source) {
        PluginSource classified = PluginSource.of(source);

        if (classified instanceof PluginSource.SpecSource s) {
            return s.spec();
        }
        if (classified instanceof PluginSource.ClassSource c) {
            return fromClass(c.type());
        }
        if (classified instanceof PluginSource.FunctionSource f) {
            return f.registration().getSpec();
        }
        throw new PluginResolutionException("cannot resolve plugin specification from " + describe(source));
    }

    @SuppressWarnings("unchecked")
    private PluginSpec fromClass(Class<?> type) {
        if (!Plugin.class.isAssignableFrom(type)) {
            throw new PluginResolutionException("cannot resolve plugin specification from " + type.getName()
                    + ": not a " + Plugin.class.getSimpleName());
        }
        LingPlugin declaration = type.getAnnotation(LingPlugin.class);
        if (declaration == null) {
            throw new PluginResolutionException("cannot resolve plugin specification from " + type.getName()
                    + ": missing @" + LingPlugin.class.getSimpleName());
        }
        return PluginSpec.of(declaration.namespace(), declaration.name(), (Class<? extends Plugin>) type);
    }

    private static String describe(Object source) {
        if (source == null) {
            return "null";
        }
        return source + " (" + source.getClass().getName() + ")";
    }
}
