package com.lingplug.core.entrypoint;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.exception.DuplicateEntryPointException;
import com.lingplug.api.exception.EntryPointException;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.spi.PluginFinder;

import java.util.*;

/**
 * PluginSpec 与入口点之间的转换
 */
public final class EntryPoints {

    private EntryPoints() {
    }

    /**
     * 由插件规格推导入口点，value 取自工厂的代码位置标识
     *
     * @throws EntryPointException 工厂是匿名的，无法定位
     */
    public static EntryPoint specToEntryPoint(PluginSpec spec) {
        String locator = spec.getFactory().getLocator();
        if (locator == null) {
            throw new EntryPointException("cannot derive an entry point for " + spec
                    + ": the factory is not reachable as a named member");
        }
        return new EntryPoint(spec.getNamespace(), spec.getName(), locator);
    }

    /**
     * 工厂的定位符，匿名工厂返回 null
     */
    public static String locatorOf(PluginSpec spec) {
        return spec.getFactory().getLocator();
    }

    /**
     * 把入口点列表转换成 group -> ["name=value", ...] 映射
     *
     * @throws DuplicateEntryPointException 同一 group 内名称重复
     */
    public static Map<String, List<String>> toEntryPointMap(Collection<EntryPoint> entryPoints) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        Map<String, Set<String>> names = new HashMap<>();

        for (EntryPoint ep : entryPoints) {
            Set<String> groupNames = names.computeIfAbsent(ep.group(), k -> new HashSet<>());
            if (!groupNames.add(ep.name())) {
                throw new DuplicateEntryPointException(ep.group(), ep.name());
            }
            result.computeIfAbsent(ep.group(), k -> new ArrayList<>()).add(ep.toPair());
        }
        return result;
    }

    /**
     * 用 Finder 发现插件并转换为入口点映射
     */
    public static Map<String, List<String>> discoverEntryPoints(PluginFinder finder) {
        List<EntryPoint> entryPoints = new ArrayList<>();
        for (PluginSpec spec : finder.findPlugins()) {
            entryPoints.add(specToEntryPoint(spec));
        }
        return toEntryPointMap(entryPoints);
    }

    /**
     * 把入口点组织成 group -> 入口点列表的索引，保持输入顺序
     * <p>
     * 同名但 value 不同的入口点全部保留，由 PluginManager 的索引决定谁生效。
     * </p>
     */
    public static Map<String, List<EntryPoint>> buildIndex(Iterable<EntryPoint> entryPoints) {
        Map<String, List<EntryPoint>> result = new LinkedHashMap<>();
        for (EntryPoint ep : entryPoints) {
            result.computeIfAbsent(ep.group(), k -> new ArrayList<>()).add(ep);
        }
        return result;
    }

    /**
     * 把 "name=value" 映射还原为入口点列表
     */
    public static List<EntryPoint> fromEntryPointMap(Map<String, List<String>> map) {
        List<EntryPoint> result = new ArrayList<>();
        for (Map.Entry<String, List<String>> group : map.entrySet()) {
            for (String pair : group.getValue()) {
                int idx = pair.indexOf('=');
                if (idx <= 0) {
                    throw new EntryPointException("invalid entry point '" + pair + "' in group " + group.getKey());
                }
                result.add(new EntryPoint(group.getKey(),
                        pair.substring(0, idx).trim(), pair.substring(idx + 1).trim()));
            }
        }
        return result;
    }
}
