package com.lingplug.core.build;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 构建期配置，对应工作目录下的 lingplug.yml
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BuildConfig {

    /**
     * 要扫描的 classes 目录或 jar，相对工作目录
     */
    @Builder.Default
    private String path = "target/classes";

    /**
     * 排除的类名通配符，{@code foo.*} 排除 foo 下的所有类
     */
    @Builder.Default
    private List<String> exclude = new ArrayList<>();

    /**
     * 包含的类名通配符，为空时包含全部
     */
    @Builder.Default
    private List<String> include = new ArrayList<>();

    @Builder.Default
    private EntrypointBuildMode entrypointBuildMode = EntrypointBuildMode.BUILD_HOOK;

    /**
     * MANUAL 模式下生成的静态文件名
     */
    @Builder.Default
    private String entrypointStaticFile = "lingplug.ini";

    public static BuildConfig defaults() {
        return BuildConfig.builder().build();
    }

    /**
     * 用非 null 的参数覆盖当前配置，include/exclude 取并集
     *
     * @return 新的配置对象，当前对象不变
     */
    public BuildConfig merge(String path,
                             List<String> exclude,
                             List<String> include,
                             EntrypointBuildMode entrypointBuildMode,
                             String entrypointStaticFile) {
        return BuildConfig.builder()
                .path(path != null ? path : this.path)
                .exclude(union(exclude, this.exclude))
                .include(union(include, this.include))
                .entrypointBuildMode(entrypointBuildMode != null ? entrypointBuildMode : this.entrypointBuildMode)
                .entrypointStaticFile(entrypointStaticFile != null ? entrypointStaticFile : this.entrypointStaticFile)
                .build();
    }

    private static List<String> union(List<String> overlay, List<String> base) {
        Set<String> result = new LinkedHashSet<>();
        if (overlay != null) {
            result.addAll(overlay);
        }
        if (base != null) {
            result.addAll(base);
        }
        return new ArrayList<>(result);
    }
}
