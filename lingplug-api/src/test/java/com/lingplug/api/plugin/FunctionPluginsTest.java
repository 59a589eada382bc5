package com.lingplug.api.plugin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FunctionPlugins 单元测试")
public class FunctionPluginsTest {

    public static final FunctionPluginRegistration GREET = FunctionPlugins.namespace("demo.greeters")
            .define(FunctionPluginsTest.class, "GREET", args -> "hello " + args[0]);

    public static final FunctionPluginRegistration NAMED = FunctionPlugins.namespace("demo.greeters")
            .name("polite")
            .shouldLoad(false)
            .load(arguments -> "loaded with " + arguments.get(0))
            .define(FunctionPluginsTest.class, "NAMED", args -> "good day " + args[0]);

    @Nested
    @DisplayName("注册")
    class DefineTests {

        @Test
        @DisplayName("未指定名称时使用字段名")
        void nameDefaultsToMember() {
            PluginSpec spec = GREET.getSpec();

            assertEquals("demo.greeters", spec.getNamespace());
            assertEquals("GREET", spec.getName());
        }

        @Test
        @DisplayName("显式名称优先")
        void explicitNameWins() {
            assertEquals("polite", NAMED.getSpec().getName());
        }

        @Test
        @DisplayName("工厂定位符为 类名:字段名")
        void locatorPointsToMember() {
            PluginFactory factory = GREET.getSpec().getFactory();

            assertEquals(FunctionPluginsTest.class.getName() + ":GREET", factory.getLocator());
            assertEquals(FunctionPluginsTest.class, factory.getDeclaringType());
        }

        @Test
        @DisplayName("匿名函数必须指定名称")
        void anonymousRequiresName() {
            FunctionPlugins.Builder builder = FunctionPlugins.namespace("demo");

            assertThrows(IllegalStateException.class, () -> builder.define(args -> null));
        }

        @Test
        @DisplayName("匿名函数没有定位符")
        void anonymousHasNoLocator() {
            FunctionPluginRegistration registration = FunctionPlugins.namespace("demo")
                    .name("anon")
                    .define(args -> null);

            assertNull(registration.getSpec().getFactory().getLocator());
            assertTrue(registration.getSpec().toString().contains("anon"));
        }
    }

    @Nested
    @DisplayName("调用")
    class InvokeTests {

        @Test
        @DisplayName("注册结果可以直接调用原函数")
        void registrationIsCallable() throws Exception {
            assertEquals("hello world", GREET.apply("world"));
        }

        @Test
        @DisplayName("工厂每次创建新的插件实例，实例同样可调用")
        void factoryCreatesFreshCallablePlugins() throws Exception {
            Plugin first = GREET.getSpec().getFactory().create();
            Plugin second = GREET.getSpec().getFactory().create();

            assertNotSame(first, second);
            assertInstanceOf(FunctionPlugin.class, first);
            assertEquals("hello you", ((FunctionPlugin) first).apply("you"));
        }
    }

    @Nested
    @DisplayName("加载条件与加载逻辑")
    class LoadTests {

        @Test
        @DisplayName("默认启用，load 返回 null")
        void defaults() throws Exception {
            FunctionPlugin plugin = GREET.newPlugin();

            assertTrue(plugin.shouldLoad());
            assertNull(plugin.load(LoadArguments.empty()));
        }

        @Test
        @DisplayName("布尔值条件与自定义 load")
        void literalConditionAndLoadRoutine() throws Exception {
            FunctionPlugin plugin = NAMED.newPlugin();

            assertFalse(plugin.shouldLoad());
            assertEquals("loaded with x", plugin.load(LoadArguments.of("x")));
        }

        @Test
        @DisplayName("条件函数在每次检查时求值")
        void supplierConditionIsEvaluatedLazily() {
            AtomicBoolean enabled = new AtomicBoolean(false);
            FunctionPluginRegistration registration = FunctionPlugins.namespace("demo")
                    .name("toggle")
                    .shouldLoad(enabled::get)
                    .define(args -> null);
            FunctionPlugin plugin = registration.newPlugin();

            assertFalse(plugin.shouldLoad());
            enabled.set(true);
            assertTrue(plugin.shouldLoad());
        }
    }
}
