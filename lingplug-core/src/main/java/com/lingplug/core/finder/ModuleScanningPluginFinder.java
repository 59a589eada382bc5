package com.lingplug.core.finder;

import com.lingplug.api.exception.LingPlugException;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.resolve.PluginSpecResolver;
import com.lingplug.core.spi.PluginFinder;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * 构建期插件发现：扫描已加载类的成员
 * <p>
 * 每个类的成员包括：类本身、public static 字段的值、public 成员类。
 * 逐个尝试解析，解析失败的成员直接丢弃（绝大多数成员都不是插件）。
 * 代价较高，只适合构建期使用。
 */
@Slf4j
public class ModuleScanningPluginFinder implements PluginFinder {

    private final Collection<Class<?>> modules;
    private final PluginSpecResolver resolver;

    public ModuleScanningPluginFinder(Collection<Class<?>> modules) {
        this(modules, new PluginSpecResolver());
    }

    public ModuleScanningPluginFinder(Collection<Class<?>> modules, PluginSpecResolver resolver) {
        this.modules = modules;
        this.resolver = resolver;
    }

    @Override
    public List<PluginSpec> findPlugins() {
        Set<PluginSpec> plugins = new LinkedHashSet<>();

        for (Class<?> module : modules) {
            log.debug("Scanning module {}", module.getName());
            for (Map.Entry<String, Object> member : members(module).entrySet()) {
                try {
                    PluginSpec spec = resolver.resolve(member.getValue());
                    if (plugins.add(spec)) {
                        log.debug("Found plugin spec in {}:{} {}", module.getName(), member.getKey(), spec);
                    }
                } catch (LingPlugException e) {
                    // 不是插件
                    log.trace("Skipping {}:{}: {}", module.getName(), member.getKey(), e.getMessage());
                }
            }
        }
        return new ArrayList<>(plugins);
    }

    private Map<String, Object> members(Class<?> module) {
        Map<String, Object> members = new LinkedHashMap<>();
        members.put(module.getSimpleName(), module);

        try {
            for (Field field : module.getFields()) {
                if (!Modifier.isStatic(field.getModifiers()) || field.getDeclaringClass() != module) {
                    continue;
                }
                try {
                    members.put(field.getName(), field.get(null));
                } catch (IllegalAccessException e) {
                    log.debug("Cannot read {}.{}: {}", module.getName(), field.getName(), e.getMessage());
                }
            }
            for (Class<?> nested : module.getClasses()) {
                if (nested.getDeclaringClass() == module) {
                    members.put(nested.getSimpleName(), nested);
                }
            }
        } catch (LinkageError e) {
            log.debug("Cannot inspect members of {}: {}", module.getName(), e.getMessage());
        }
        return members;
    }
}
