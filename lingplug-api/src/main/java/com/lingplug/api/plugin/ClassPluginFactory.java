package com.lingplug.api.plugin;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * 以插件类本身作为工厂：通过无参构造器创建实例
 */
public final class ClassPluginFactory implements PluginFactory {

    private final Class<? extends Plugin> pluginType;

    public ClassPluginFactory(Class<? extends Plugin> pluginType) {
        this.pluginType = pluginType;
    }

    @Override
    public Plugin create() throws Exception {
        Constructor<? extends Plugin> constructor = pluginType.getDeclaredConstructor();
        if (!constructor.canAccess(null)) {
            constructor.setAccessible(true);
        }
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            // 构造器本身抛出的异常才是插件真正的初始化错误
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    @Override
    public String getLocator() {
        return pluginType.getName();
    }

    @Override
    public Class<?> getDeclaringType() {
        return pluginType;
    }

    public Class<? extends Plugin> getPluginType() {
        return pluginType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassPluginFactory that)) return false;
        return pluginType.equals(that.pluginType);
    }

    @Override
    public int hashCode() {
        return pluginType.hashCode();
    }

    @Override
    public String toString() {
        return pluginType.getName();
    }
}
