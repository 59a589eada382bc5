package com.lingplug.api.plugin;

import lombok.Getter;

import java.util.function.BooleanSupplier;

/**
 * 函数插件的注册结果
 * <p>
 * 同时提供：
 * 1. 可序列化的 {@link PluginSpec}，其工厂每次调用都会创建一个新的 {@link FunctionPlugin}
 * 2. 直接调用原函数的能力
 * </p>
 * 把它放在类的 public static 字段中，即可被扫描发现或作为入口点 {@code 类名:字段名} 的目标。
 */
public final class FunctionPluginRegistration implements PluginFunction {

    @Getter
    private final PluginSpec spec;

    private final PluginFunction function;
    private final BooleanSupplier loadCondition;
    private final LoadRoutine loadRoutine;
    private final Class<?> owner;
    private final String member;

    FunctionPluginRegistration(String namespace, String name, PluginFunction function,
                               BooleanSupplier loadCondition, LoadRoutine loadRoutine,
                               Class<?> owner, String member) {
        this.function = function;
        this.loadCondition = loadCondition;
        this.loadRoutine = loadRoutine;
        this.owner = owner;
        this.member = member;
        this.spec = new PluginSpec(namespace, name, new Factory());
    }

    /**
     * 创建一个新的插件实例
     */
    public FunctionPlugin newPlugin() {
        return new FunctionPlugin(spec.getNamespace(), spec.getName(), function, loadCondition, loadRoutine);
    }

    @Override
    public Object apply(Object... args) throws Exception {
        return function.apply(args);
    }

    public PluginFunction getFunction() {
        return function;
    }

    @Override
    public String toString() {
        return "FunctionPluginRegistration(" + spec.getNamespace() + ":" + spec.getName() + ")";
    }

    private final class Factory implements PluginFactory {

        @Override
        public Plugin create() {
            return newPlugin();
        }

        @Override
        public String getLocator() {
            if (owner == null) {
                return null;
            }
            return owner.getName() + ":" + member;
        }

        @Override
        public Class<?> getDeclaringType() {
            return owner != null ? owner : function.getClass();
        }

        @Override
        public String toString() {
            String locator = getLocator();
            return locator != null ? locator : "<anonymous function " + spec.getName() + ">";
        }
    }
}
