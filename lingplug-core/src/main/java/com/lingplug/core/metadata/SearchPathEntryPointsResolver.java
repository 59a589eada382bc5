package com.lingplug.core.metadata;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.exception.EntryPointException;
import com.lingplug.core.config.LingPlugConfig;
import com.lingplug.core.entrypoint.EntryPoints;
import com.lingplug.core.entrypoint.EntryPointsText;
import com.lingplug.core.spi.EntryPointsResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Supplier;

/**
 * 扫描搜索路径上所有发行单元声明的入口点（无缓存）
 * <p>
 * 对于可编辑安装的发行单元，优先读取重定向文件指向的声明文件。
 * 合并时相同的 (name, value, group) 只保留第一次出现的。
 */
@Slf4j
public class SearchPathEntryPointsResolver implements EntryPointsResolver {

    private final Supplier<List<String>> searchPath;

    public SearchPathEntryPointsResolver() {
        this(() -> LingPlugConfig.current().effectiveSearchPath());
    }

    public SearchPathEntryPointsResolver(List<String> searchPath) {
        this(() -> searchPath);
    }

    public SearchPathEntryPointsResolver(Supplier<List<String>> searchPath) {
        this.searchPath = searchPath;
    }

    @Override
    public Map<String, List<EntryPoint>> getEntryPoints() {
        return resolve(searchPath.get());
    }

    public Map<String, List<EntryPoint>> resolve(List<String> path) {
        return EntryPoints.buildIndex(resolveEntryPoints(path));
    }

    /**
     * 按搜索路径顺序收集入口点并去重
     */
    public List<EntryPoint> resolveEntryPoints(List<String> path) {
        Set<EntryPoint> unique = new LinkedHashSet<>();
        for (String entry : path) {
            Distribution distribution = Distribution.at(entry);
            if (!distribution.exists()) {
                continue;
            }
            try {
                unique.addAll(readEntryPoints(distribution));
            } catch (IOException | EntryPointException e) {
                // 单个发行单元的声明文件损坏不能影响其他发行单元
                log.warn("Skipping entry points of {}: {}", entry, e.getMessage());
            }
        }
        return new ArrayList<>(unique);
    }

    private List<EntryPoint> readEntryPoints(Distribution distribution) throws IOException {
        Path editable = distribution.editableLinkTarget();
        if (editable != null && Files.isRegularFile(editable)) {
            log.debug("Following editable entry points link {} -> {}", distribution.getLocation(), editable);
            return EntryPointsText.parse(Files.readString(editable, StandardCharsets.UTF_8));
        }
        String text = distribution.readText(Distribution.ENTRY_POINTS_FILE);
        if (text == null) {
            return Collections.emptyList();
        }
        return EntryPointsText.parse(text);
    }
}
