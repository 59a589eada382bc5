package com.lingplug.core.config;

import com.lingplug.core.cache.EntryPointsCache;
import com.lingplug.core.finder.MetadataPluginFinder;
import com.lingplug.core.metadata.SearchPathEntryPointsResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LingPlugConfig 单元测试")
class LingPlugConfigTest {

    @BeforeEach
    @AfterEach
    void reset() {
        LingPlugConfig.clear();
        EntryPointsCache.clearInstance();
    }

    @Test
    @DisplayName("未初始化时返回默认配置")
    void defaults() {
        LingPlugConfig config = LingPlugConfig.current();

        assertTrue(config.isCacheEnabled());
        assertTrue(config.getCacheDir().endsWith("lingplug"));
        assertEquals(LingPlugConfig.classPath(), config.effectiveSearchPath());
    }

    @Test
    @DisplayName("显式搜索路径优先于 classpath")
    void explicitSearchPath() {
        LingPlugConfig.init(LingPlugConfig.builder().searchPath(List.of("/opt/plugins")).build());

        assertEquals(List.of("/opt/plugins"), LingPlugConfig.current().effectiveSearchPath());
    }

    @Test
    @DisplayName("默认入口点解析器随缓存开关变化")
    void defaultResolverFollowsCacheSwitch(@TempDir Path cacheDir) {
        LingPlugConfig.init(LingPlugConfig.builder().cacheEnabled(true).cacheDir(cacheDir).build());
        EntryPointsCache cache = assertInstanceOf(EntryPointsCache.class, MetadataPluginFinder.defaultEntryPointsResolver());
        assertEquals(cacheDir, cache.getCacheDir());

        LingPlugConfig.init(LingPlugConfig.builder().cacheEnabled(false).build());
        assertInstanceOf(SearchPathEntryPointsResolver.class, MetadataPluginFinder.defaultEntryPointsResolver());
    }
}
