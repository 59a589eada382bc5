package com.lingplug.core.resolve;

import com.lingplug.api.exception.PluginResolutionException;
import com.lingplug.api.plugin.ClassPluginFactory;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.sample.SamplePlugins;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginSpecResolver 单元测试")
class PluginSpecResolverTest {

    private final PluginSpecResolver resolver = new PluginSpecResolver();

    @Test
    @DisplayName("PluginSpec 原样返回")
    void specPassesThrough() {
        PluginSpec spec = PluginSpec.of("ns", "name", SamplePlugins.SamplePlugin2.class);

        assertSame(spec, resolver.resolve(spec));
    }

    @Test
    @DisplayName("带注解的插件类使用注解中的命名空间与名称")
    void annotatedClass() {
        PluginSpec spec = resolver.resolve(SamplePlugins.SamplePlugin1.class);

        assertEquals(SamplePlugins.NAMESPACE, spec.getNamespace());
        assertEquals("plugin1", spec.getName());
        assertEquals(new ClassPluginFactory(SamplePlugins.SamplePlugin1.class), spec.getFactory());
    }

    @Test
    @DisplayName("函数插件注册使用其自带的规格")
    void functionRegistration() {
        assertSame(SamplePlugins.GREET.getSpec(), resolver.resolve(SamplePlugins.GREET));
    }

    @Test
    @DisplayName("缺少注解的插件类无法解析")
    void unannotatedClassFails() {
        PluginResolutionException e = assertThrows(PluginResolutionException.class,
                () -> resolver.resolve(SamplePlugins.UnannotatedPlugin.class));
        assertTrue(e.getMessage().contains("@LingPlugin"));
    }

    @Test
    @DisplayName("不是插件的类和对象无法解析")
    void unsupportedSources() {
        assertThrows(PluginResolutionException.class, () -> resolver.resolve(String.class));
        assertThrows(PluginResolutionException.class, () -> resolver.resolve(SamplePlugins.NOT_A_PLUGIN));
        assertThrows(PluginResolutionException.class, () -> resolver.resolve(null));
    }
}
