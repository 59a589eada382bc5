package com.lingplug.core.finder;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.cache.EntryPointsCache;
import com.lingplug.core.config.LingPlugConfig;
import com.lingplug.core.metadata.SearchPathEntryPointsResolver;
import com.lingplug.core.resolve.ClassLoaderCodeLoader;
import com.lingplug.core.resolve.PluginSpecResolver;
import com.lingplug.core.spi.CodeLoader;
import com.lingplug.core.spi.EntryPointsResolver;
import com.lingplug.core.spi.PluginFinder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 运行期插件发现：从入口点元数据中解析命名空间下的插件
 * <p>
 * 单个入口点加载或解析失败时不会中断发现过程，而是通过回调上报并跳过该插件。
 */
@Slf4j
public class MetadataPluginFinder implements PluginFinder {

    private final String namespace;
    private final ResolveExceptionCallback resolveExceptionCallback;
    private final PluginSpecResolver specResolver;
    private final EntryPointsResolver entryPointsResolver;
    private final CodeLoader codeLoader;

    public MetadataPluginFinder(String namespace) {
        this(namespace, null);
    }

    public MetadataPluginFinder(String namespace, ResolveExceptionCallback resolveExceptionCallback) {
        this(namespace, resolveExceptionCallback, new PluginSpecResolver(), defaultEntryPointsResolver(),
                new ClassLoaderCodeLoader());
    }

    public MetadataPluginFinder(String namespace,
                                ResolveExceptionCallback resolveExceptionCallback,
                                PluginSpecResolver specResolver,
                                EntryPointsResolver entryPointsResolver,
                                CodeLoader codeLoader) {
        this.namespace = namespace;
        this.resolveExceptionCallback = resolveExceptionCallback;
        this.specResolver = specResolver;
        this.entryPointsResolver = entryPointsResolver;
        this.codeLoader = codeLoader;
    }

    /**
     * 根据全局配置选择带缓存或不带缓存的入口点解析器
     */
    public static EntryPointsResolver defaultEntryPointsResolver() {
        if (LingPlugConfig.current().isCacheEnabled()) {
            return EntryPointsCache.instance();
        }
        return new SearchPathEntryPointsResolver();
    }

    @Override
    public List<PluginSpec> findPlugins() {
        List<EntryPoint> entryPoints = entryPointsResolver.getEntryPoints()
                .getOrDefault(namespace, Collections.emptyList());

        List<PluginSpec> specs = new ArrayList<>();
        for (EntryPoint entryPoint : entryPoints) {
            PluginSpec spec = toPluginSpec(entryPoint);
            if (spec != null) {
                specs.add(spec);
            }
        }
        log.debug("Found {} of {} plugins in namespace {}", specs.size(), entryPoints.size(), namespace);
        return specs;
    }

    /**
     * 加载入口点并解析为 PluginSpec，失败时返回 null
     */
    PluginSpec toPluginSpec(EntryPoint entryPoint) {
        try {
            Object source = codeLoader.load(entryPoint.value());
            return specResolver.resolve(source);
        } catch (Exception | LinkageError e) {
            if (log.isDebugEnabled()) {
                log.debug("Error resolving PluginSpec for plugin {}.{}", namespace, entryPoint.name(), e);
            }
            if (resolveExceptionCallback != null) {
                resolveExceptionCallback.onResolveException(namespace, entryPoint, e);
            } else {
                log.warn("Cannot resolve plugin {}.{}: {}", namespace, entryPoint.name(), e.getMessage());
            }
            return null;
        }
    }
}
