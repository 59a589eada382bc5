package com.lingplug.api.plugin;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * 函数插件注册器
 * <p>
 * 用法：
 * <pre>{@code
 * public static final FunctionPluginRegistration GREET = FunctionPlugins.namespace("demo.greeters")
 *         .shouldLoad(() -> System.getenv("GREET_DISABLED") == null)
 *         .define(Greeters.class, "GREET", args -> "hello " + args[0]);
 * }</pre>
 * 调用 {@link Builder#define(Class, String, PluginFunction)} 时声明的类与字段名即为入口点定位符，
 * 未显式指定名称时插件名默认取字段名。
 */
public final class FunctionPlugins {

    private FunctionPlugins() {
    }

    public static Builder namespace(String namespace) {
        return new Builder(namespace);
    }

    public static final class Builder {

        private final String namespace;
        private String name;
        private BooleanSupplier loadCondition;
        private LoadRoutine loadRoutine;

        private Builder(String namespace) {
            this.namespace = Objects.requireNonNull(namespace, "namespace");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder shouldLoad(boolean shouldLoad) {
            this.loadCondition = () -> shouldLoad;
            return this;
        }

        public Builder shouldLoad(BooleanSupplier condition) {
            this.loadCondition = condition;
            return this;
        }

        public Builder load(LoadRoutine loadRoutine) {
            this.loadRoutine = loadRoutine;
            return this;
        }

        /**
         * 注册一个可定位的函数插件
         *
         * @param owner  持有注册结果的类
         * @param member 持有注册结果的 public static 字段名
         */
        public FunctionPluginRegistration define(Class<?> owner, String member, PluginFunction function) {
            Objects.requireNonNull(owner, "owner");
            Objects.requireNonNull(member, "member");
            Objects.requireNonNull(function, "function");
            String pluginName = name != null ? name : member;
            return new FunctionPluginRegistration(namespace, pluginName, function,
                    loadCondition, loadRoutine, owner, member);
        }

        /**
         * 注册一个匿名函数插件，必须显式指定名称；无法被序列化为入口点
         */
        public FunctionPluginRegistration define(PluginFunction function) {
            Objects.requireNonNull(function, "function");
            if (name == null) {
                throw new IllegalStateException("anonymous function plugins need an explicit name");
            }
            return new FunctionPluginRegistration(namespace, name, function,
                    loadCondition, loadRoutine, null, null);
        }
    }
}
