package com.lingplug.core.build;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lingplug.api.exception.LingPlugException;
import com.lingplug.core.entrypoint.EntryPoints;
import com.lingplug.core.entrypoint.EntryPointsText;
import com.lingplug.core.spi.PluginFinder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 发现插件并输出入口点索引，支持 JSON 与 INI 两种格式
 */
public class PluginIndexBuilder {

    public enum OutputFormat {
        JSON, INI;

        public static OutputFormat of(String value) {
            for (OutputFormat format : values()) {
                if (format.name().equalsIgnoreCase(value)) {
                    return format;
                }
            }
            throw new LingPlugException("unknown plugin index output format " + value);
        }
    }

    private final PluginFinder finder;
    private final ObjectMapper objectMapper;

    public PluginIndexBuilder(PluginFinder finder) {
        this(finder, new ObjectMapper());
    }

    public PluginIndexBuilder(PluginFinder finder, ObjectMapper objectMapper) {
        this.finder = finder;
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * 发现入口点，组内按字母排序
     */
    public Map<String, List<String>> discover() {
        Map<String, List<String>> sorted = new TreeMap<>();
        for (Map.Entry<String, List<String>> group : EntryPoints.discoverEntryPoints(finder).entrySet()) {
            List<String> entries = new ArrayList<>(group.getValue());
            entries.sort(null);
            sorted.put(group.getKey(), entries);
        }
        return sorted;
    }

    /**
     * 发现入口点并写出，不关闭 writer
     *
     * @return 写出的入口点映射
     */
    public Map<String, List<String>> write(Writer out, OutputFormat format) {
        Map<String, List<String>> entryPoints = discover();
        try {
            out.write(render(entryPoints, format));
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return entryPoints;
    }

    String render(Map<String, List<String>> entryPoints, OutputFormat format) {
        if (format == OutputFormat.INI) {
            return EntryPointsText.serializeMap(entryPoints);
        }
        try {
            return objectMapper.writeValueAsString(entryPoints) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new LingPlugException("cannot serialize entry points", e);
        }
    }
}
