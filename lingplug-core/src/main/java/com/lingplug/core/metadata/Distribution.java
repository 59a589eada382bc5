package com.lingplug.core.metadata;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * 一个 classpath 条目（目录或 Jar 包），即一个可能声明了入口点的发行单元
 */
@Slf4j
public class Distribution {

    /**
     * 入口点声明文件
     */
    public static final String ENTRY_POINTS_FILE = "META-INF/lingplug/entry_points.ini";

    /**
     * 可编辑安装的重定向文件，内容为另一个入口点声明文件的路径
     */
    public static final String EDITABLE_LINK_FILE = "META-INF/lingplug/entry_points_editable.txt";

    @Getter
    private final Path location;

    private Distribution(Path location) {
        this.location = location;
    }

    public static Distribution at(String entry) {
        return new Distribution(Paths.get(entry));
    }

    public static Distribution at(Path location) {
        return new Distribution(location);
    }

    public boolean exists() {
        return Files.exists(location);
    }

    public boolean isDirectory() {
        return Files.isDirectory(location);
    }

    /**
     * 读取发行单元内的文本文件
     *
     * @param relativePath 以 / 分隔的相对路径
     * @return 文件内容，不存在时返回 null
     */
    public String readText(String relativePath) throws IOException {
        if (isDirectory()) {
            Path file = location.resolve(relativePath);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        if (!Files.isRegularFile(location)) {
            return null;
        }
        try (JarFile jar = new JarFile(location.toFile())) {
            JarEntry entry = jar.getJarEntry(relativePath);
            if (entry == null) {
                return null;
            }
            try (InputStream in = jar.getInputStream(entry)) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
    }

    /**
     * 入口点声明文件在文件系统上的位置（仅目录形式的发行单元有意义）
     */
    public Path entryPointsFile() {
        return location.resolve(ENTRY_POINTS_FILE);
    }

    /**
     * 解析可编辑安装的重定向目标
     *
     * @return 重定向指向的文件路径；没有重定向文件时返回 null（目标不一定存在）
     */
    public Path editableLinkTarget() {
        try {
            String link = readText(EDITABLE_LINK_FILE);
            if (link == null || link.isBlank()) {
                return null;
            }
            return Paths.get(link.trim());
        } catch (IOException e) {
            log.warn("Cannot read editable link of {}: {}", location, e.getMessage());
            return null;
        }
    }

    @Override
    public String toString() {
        return "Distribution(" + location + ")";
    }
}
