package com.lingplug.core.entrypoint;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.exception.EntryPointException;

import java.util.*;

/**
 * 入口点声明文件（INI 格式）的解析与序列化
 * <pre>
 * [demo.greeters]
 * hello = com.example.Greeters:HELLO
 * world = com.example.WorldPlugin
 *
 * </pre>
 */
public final class EntryPointsText {

    private EntryPointsText() {
    }

    public static List<EntryPoint> parse(String text) {
        List<EntryPoint> result = new ArrayList<>();
        String group = null;
        int lineNumber = 0;

        for (String rawLine : text.split("\\r?\\n")) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    throw new EntryPointException("malformed section header at line " + lineNumber + ": " + line);
                }
                group = line.substring(1, line.length() - 1).trim();
                continue;
            }
            if (group == null) {
                throw new EntryPointException("entry point outside of a section at line " + lineNumber + ": " + line);
            }
            int idx = line.indexOf('=');
            if (idx <= 0) {
                throw new EntryPointException("malformed entry point at line " + lineNumber + ": " + line);
            }
            result.add(new EntryPoint(group, line.substring(0, idx).trim(), line.substring(idx + 1).trim()));
        }
        return result;
    }

    /**
     * 序列化入口点索引：group 按名称排序，group 内按入口点名称排序，每个 group 后跟一个空行
     */
    public static String serialize(Map<String, List<EntryPoint>> index) {
        StringBuilder buffer = new StringBuilder();
        for (String group : new TreeSet<>(index.keySet())) {
            buffer.append('[').append(group).append("]\n");
            List<EntryPoint> entryPoints = new ArrayList<>(index.get(group));
            entryPoints.sort(Comparator.comparing(EntryPoint::name));
            for (EntryPoint ep : entryPoints) {
                buffer.append(ep.name()).append(" = ").append(ep.value()).append('\n');
            }
            buffer.append('\n');
        }
        return buffer.toString();
    }

    /**
     * 序列化 group -> ["name=value"] 映射
     */
    public static String serializeMap(Map<String, List<String>> map) {
        return serialize(EntryPoints.buildIndex(EntryPoints.fromEntryPointMap(map)));
    }
}
