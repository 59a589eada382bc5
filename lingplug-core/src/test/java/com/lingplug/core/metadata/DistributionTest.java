package com.lingplug.core.metadata;

import com.lingplug.api.plugin.FunctionPlugins;
import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginFactory;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.sample.SamplePlugins;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distribution 单元测试")
class DistributionTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("读取目录中的文本文件")
    void readText() throws IOException {
        SearchPathEntryPointsResolverTest.writeDirectoryDistribution(tempDir, "[ns]\n");
        Distribution distribution = Distribution.at(tempDir);

        assertTrue(distribution.exists());
        assertTrue(distribution.isDirectory());
        assertEquals("[ns]\n", distribution.readText(Distribution.ENTRY_POINTS_FILE));
        assertNull(distribution.readText("META-INF/missing.txt"));
        assertNull(distribution.editableLinkTarget());
    }

    @Test
    @DisplayName("读取 jar 中的文本文件")
    void readJarText() throws IOException {
        Path jar = SearchPathEntryPointsResolverTest.writeJarDistribution(tempDir.resolve("a.jar"), "[g]\n");
        Distribution distribution = Distribution.at(jar.toString());

        assertFalse(distribution.isDirectory());
        assertEquals("[g]\n", distribution.readText(Distribution.ENTRY_POINTS_FILE));
    }

    @Test
    @DisplayName("定位插件类所在的 classpath 条目")
    void resolveFromSpec() {
        PluginSpec spec = PluginSpec.of("ns", "a", SamplePlugins.SamplePlugin1.class);

        Optional<Distribution> distribution = new DistributionResolver().resolve(spec);

        assertTrue(distribution.isPresent());
        assertTrue(Files.isDirectory(distribution.get().getLocation()));
    }

    @Test
    @DisplayName("JDK 类没有 classpath 条目")
    void jdkTypesHaveNoDistribution() {
        PluginSpec spec = FunctionPlugins.namespace("ns").name("len")
                .define(args -> String.valueOf(args[0]).length()).getSpec();
        PluginSpec jdk = new PluginSpec("ns", "jdk", new PluginFactory() {
            @Override
            public Plugin create() {
                return null;
            }

            @Override
            public Class<?> getDeclaringType() {
                return String.class;
            }
        });

        assertTrue(new DistributionResolver().resolve(spec).isPresent());
        assertTrue(new DistributionResolver().resolve(jdk).isEmpty());
    }
}
