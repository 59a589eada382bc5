package com.lingplug.core.config;

import com.lingplug.core.cache.CacheDirectories;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * LingPlug Core 全局配置对象
 * <p>
 * 职责：为默认组件（默认入口点缓存、默认 Finder）提供参数。
 * 核心组件本身都通过构造器注入依赖，只有在调用方未显式提供依赖时才会读取此配置。
 */
@Data
@Builder
@ToString
public class LingPlugConfig {

    private static volatile LingPlugConfig INSTANCE;

    /**
     * 获取全局配置实例
     */
    public static LingPlugConfig current() {
        if (INSTANCE == null) {
            // 兜底：未初始化时返回默认值
            return LingPlugConfig.builder().build();
        }
        return INSTANCE;
    }

    /**
     * 初始化全局实例 (宿主启动时调用一次)
     */
    public static void init(LingPlugConfig config) {
        INSTANCE = config;
    }

    /**
     * 清理全局配置
     * 场景：单元测试 teardown
     */
    public static void clear() {
        INSTANCE = null;
    }

    /**
     * 是否启用入口点磁盘缓存
     * <p>
     * false 时每次都重新扫描搜索路径
     */
    @Builder.Default
    private boolean cacheEnabled = true;

    /**
     * 入口点缓存目录
     */
    @Builder.Default
    private Path cacheDir = CacheDirectories.userCacheDir().resolve("lingplug");

    /**
     * 入口点搜索路径，为空时使用 java.class.path
     */
    @Builder.Default
    private List<String> searchPath = new ArrayList<>();

    /**
     * 实际生效的搜索路径
     */
    public List<String> effectiveSearchPath() {
        if (searchPath != null && !searchPath.isEmpty()) {
            return searchPath;
        }
        return classPath();
    }

    /**
     * 当前 JVM 的 classpath
     */
    public static List<String> classPath() {
        String classPath = System.getProperty("java.class.path", "");
        if (classPath.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(classPath.split(File.pathSeparator)));
    }
}
