package com.lingplug.core.sample;

import com.lingplug.api.annotation.LingPlugin;
import com.lingplug.api.plugin.FunctionPluginRegistration;
import com.lingplug.api.plugin.FunctionPlugins;
import com.lingplug.api.plugin.LoadArguments;
import com.lingplug.api.plugin.Plugin;

/**
 * 测试用插件集合
 */
public class SamplePlugins {

    public static final String NAMESPACE = "lingplug.test.sample";
    public static final String FUNCTIONS_NAMESPACE = "lingplug.test.functions";

    public static final String NOT_A_PLUGIN = "just a string";

    public static final FunctionPluginRegistration GREET = FunctionPlugins.namespace(FUNCTIONS_NAMESPACE)
            .define(SamplePlugins.class, "GREET", args -> "hello " + args[0]);

    public static final FunctionPluginRegistration DISABLED_GREET = FunctionPlugins.namespace(FUNCTIONS_NAMESPACE)
            .name("disabled")
            .shouldLoad(false)
            .define(SamplePlugins.class, "DISABLED_GREET", args -> "unreachable");

    @LingPlugin(namespace = NAMESPACE, name = "plugin1")
    public static class SamplePlugin1 implements Plugin {

        @Override
        public Object load(LoadArguments arguments) {
            return "plugin1 loaded";
        }
    }

    @LingPlugin(namespace = NAMESPACE, name = "plugin2")
    public static class SamplePlugin2 implements Plugin {
    }

    /**
     * 缺少注解，无法解析
     */
    public static class UnannotatedPlugin implements Plugin {
    }
}
