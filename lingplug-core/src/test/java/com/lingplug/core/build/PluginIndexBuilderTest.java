package com.lingplug.core.build;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lingplug.api.exception.DuplicateEntryPointException;
import com.lingplug.api.exception.LingPlugException;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.sample.SamplePlugins;
import com.lingplug.core.spi.PluginFinder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginIndexBuilder 单元测试")
class PluginIndexBuilderTest {

    private static final String PLUGIN1 = SamplePlugins.SamplePlugin1.class.getName();
    private static final String PLUGIN2 = SamplePlugins.SamplePlugin2.class.getName();

    private final PluginFinder finder = () -> List.of(
            PluginSpec.of("z.ns", "second", SamplePlugins.SamplePlugin2.class),
            PluginSpec.of("z.ns", "first", SamplePlugins.SamplePlugin1.class),
            SamplePlugins.GREET.getSpec());

    @Test
    @DisplayName("JSON 输出按键排序，组内按字母排序")
    void writesSortedJson() throws Exception {
        StringWriter out = new StringWriter();

        Map<String, List<String>> written = new PluginIndexBuilder(finder).write(out, PluginIndexBuilder.OutputFormat.JSON);

        Map<String, List<String>> parsed = new ObjectMapper().readValue(out.toString(), new TypeReference<>() {
        });
        assertEquals(written, parsed);
        assertEquals(List.of(SamplePlugins.FUNCTIONS_NAMESPACE, "z.ns"), List.copyOf(parsed.keySet()));
        assertEquals(List.of("first=" + PLUGIN1, "second=" + PLUGIN2), parsed.get("z.ns"));
        assertTrue(out.toString().contains("\n"));
    }

    @Test
    @DisplayName("INI 输出")
    void writesIni() {
        StringWriter out = new StringWriter();

        new PluginIndexBuilder(finder).write(out, PluginIndexBuilder.OutputFormat.INI);

        assertEquals("[" + SamplePlugins.FUNCTIONS_NAMESPACE + "]\n"
                + "GREET = " + SamplePlugins.class.getName() + ":GREET\n\n"
                + "[z.ns]\n"
                + "first = " + PLUGIN1 + "\n"
                + "second = " + PLUGIN2 + "\n\n", out.toString());
    }

    @Test
    @DisplayName("重复的入口点名称报错")
    void duplicateNamesFail() {
        PluginFinder duplicates = () -> List.of(
                PluginSpec.of("ns", "same", SamplePlugins.SamplePlugin1.class),
                PluginSpec.of("ns", "same", SamplePlugins.SamplePlugin2.class));

        assertThrows(DuplicateEntryPointException.class,
                () -> new PluginIndexBuilder(duplicates).write(new StringWriter(), PluginIndexBuilder.OutputFormat.INI));
    }

    @Test
    @DisplayName("输出格式")
    void outputFormat() {
        assertEquals(PluginIndexBuilder.OutputFormat.JSON, PluginIndexBuilder.OutputFormat.of("json"));
        assertEquals(PluginIndexBuilder.OutputFormat.INI, PluginIndexBuilder.OutputFormat.of("INI"));
        assertThrows(LingPlugException.class, () -> PluginIndexBuilder.OutputFormat.of("toml"));
    }
}
