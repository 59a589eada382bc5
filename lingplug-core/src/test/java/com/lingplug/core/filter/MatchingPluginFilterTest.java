package com.lingplug.core.filter;

import com.lingplug.api.plugin.FunctionPlugins;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.sample.SamplePlugins;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchingPluginFilter 单元测试")
class MatchingPluginFilterTest {

    private final PluginSpec plugin1 = PluginSpec.of("lingplug.test", "plugin1", SamplePlugins.SamplePlugin1.class);
    private final PluginSpec plugin2 = PluginSpec.of("lingplug.test", "plugin2", SamplePlugins.SamplePlugin2.class);
    private final PluginSpec other = PluginSpec.of("other.ns", "plugin1", SamplePlugins.SamplePlugin1.class);

    @Test
    @DisplayName("没有规则时不过滤任何插件")
    void emptyFilterMatchesNothing() {
        MatchingPluginFilter filter = new MatchingPluginFilter();

        assertFalse(filter.isFiltered(plugin1));
        assertFalse(filter.isFiltered(other));
    }

    @Test
    @DisplayName("默认全局过滤器存在")
    void globalInstance() {
        assertSame(MatchingPluginFilter.global(), MatchingPluginFilter.global());
    }

    @Nested
    @DisplayName("规则组合")
    class CompositionTests {

        @Test
        @DisplayName("同一规则内的多个条件必须同时满足")
        void conditionsAreAnded() {
            MatchingPluginFilter filter = new MatchingPluginFilter().addExclusion("lingplug.*", "plugin1");

            assertTrue(filter.isFiltered(plugin1));
            assertFalse(filter.isFiltered(plugin2));
            assertFalse(filter.isFiltered(other));
        }

        @Test
        @DisplayName("任意一条规则命中即过滤")
        void matchersAreOred() {
            MatchingPluginFilter filter = new MatchingPluginFilter()
                    .addExclusion(null, "plugin2")
                    .addExclusion("other.*", null);

            assertFalse(filter.isFiltered(plugin1));
            assertTrue(filter.isFiltered(plugin2));
            assertTrue(filter.isFiltered(other));
            assertEquals(2, filter.getMatchers().size());
        }

        @Test
        @DisplayName("按定位符过滤")
        void valuePattern() {
            MatchingPluginFilter filter = new MatchingPluginFilter()
                    .addExclusion(null, null, "*SamplePlugin2");

            assertFalse(filter.isFiltered(plugin1));
            assertTrue(filter.isFiltered(plugin2));
        }

        @Test
        @DisplayName("没有定位符的插件不会被定位符规则命中")
        void valuePatternIgnoresAnonymousFactories() {
            PluginSpec anonymous = FunctionPlugins.namespace("lingplug.test").name("anon").define(args -> null).getSpec();
            MatchingPluginFilter filter = new MatchingPluginFilter().addExclusion(null, null, "*");

            assertFalse(filter.isFiltered(anonymous));
            assertTrue(filter.isFiltered(SamplePlugins.GREET.getSpec()));
        }
    }
}
