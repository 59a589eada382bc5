package com.lingplug.core.build;

import com.lingplug.api.exception.LingPlugException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 读取 lingplug.yml
 * <p>
 * 文件不存在时返回默认配置，未知的键记录警告后忽略。
 */
@Slf4j
public class BuildConfigLoader {

    public static final String CONFIG_FILE = "lingplug.yml";

    public static BuildConfig loadFromWorkdir(Path workdir) {
        Path file = workdir.resolve(CONFIG_FILE);
        if (!Files.isRegularFile(file)) {
            log.debug("No {} in {}, using defaults", CONFIG_FILE, workdir);
            return BuildConfig.defaults();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new LingPlugException("cannot read " + file, e);
        }
    }

    public static BuildConfig load(InputStream inputStream, String source) {
        // 只构造基础类型，不允许任意标签
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));

        Object document;
        try {
            document = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new LingPlugException("invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            return BuildConfig.defaults();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new LingPlugException("expected a mapping at the top level of " + source);
        }

        BuildConfig config = BuildConfig.defaults();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "path" -> config.setPath(asString(key, value, source));
                case "exclude" -> config.setExclude(asList(key, value, source));
                case "include" -> config.setInclude(asList(key, value, source));
                case "entrypointBuildMode" ->
                        config.setEntrypointBuildMode(EntrypointBuildMode.fromValue(asString(key, value, source)));
                case "entrypointStaticFile" -> config.setEntrypointStaticFile(asString(key, value, source));
                default -> log.warn("Ignoring unknown key {} in {}", key, source);
            }
        }
        return config;
    }

    private static String asString(String key, Object value, String source) {
        if (value == null) {
            throw new LingPlugException("key " + key + " in " + source + " must not be empty");
        }
        return String.valueOf(value);
    }

    private static List<String> asList(String key, Object value, String source) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                result.add(String.valueOf(item));
            }
            return result;
        }
        if (value instanceof String text) {
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
            return result;
        }
        throw new LingPlugException("key " + key + " in " + source + " must be a list of strings");
    }
}
