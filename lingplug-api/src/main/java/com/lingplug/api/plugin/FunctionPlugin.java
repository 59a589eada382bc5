package com.lingplug.api.plugin;

import lombok.Getter;

import java.util.function.BooleanSupplier;

/**
 * 把一个函数包装成插件
 * <p>
 * 实例本身也是一个 {@link PluginFunction}，调用会直接转发给被包装的函数，
 * 所以同一个函数既能作为插件被加载，也能在测试中绕过 PluginManager 直接调用。
 * </p>
 */
public class FunctionPlugin implements Plugin, PluginFunction {

    @Getter
    private final String namespace;
    @Getter
    private final String name;
    @Getter
    private final PluginFunction function;

    private final BooleanSupplier loadCondition;
    private final LoadRoutine loadRoutine;

    public FunctionPlugin(String namespace, String name, PluginFunction function,
                          BooleanSupplier loadCondition, LoadRoutine loadRoutine) {
        this.namespace = namespace;
        this.name = name;
        this.function = function;
        this.loadCondition = loadCondition;
        this.loadRoutine = loadRoutine;
    }

    @Override
    public Object apply(Object... args) throws Exception {
        return function.apply(args);
    }

    @Override
    public boolean shouldLoad() {
        if (loadCondition == null) {
            return true;
        }
        return loadCondition.getAsBoolean();
    }

    @Override
    public Object load(LoadArguments arguments) throws Exception {
        if (loadRoutine == null) {
            return null;
        }
        return loadRoutine.load(arguments);
    }

    @Override
    public String toString() {
        return "FunctionPlugin(" + namespace + ":" + name + ")";
    }
}
