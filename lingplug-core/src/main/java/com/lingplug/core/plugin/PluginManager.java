package com.lingplug.core.plugin;

import com.lingplug.api.exception.*;
import com.lingplug.api.listener.PluginLifecycleListener;
import com.lingplug.api.plugin.LoadArguments;
import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.filter.MatchingPluginFilter;
import com.lingplug.core.finder.MetadataPluginFinder;
import com.lingplug.core.listener.LifecycleNotifier;
import com.lingplug.core.resolve.ClassLoaderCodeLoader;
import com.lingplug.core.resolve.PluginSpecResolver;
import com.lingplug.core.spi.PluginFilter;
import com.lingplug.core.spi.PluginFinder;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 插件管理器：负责一个命名空间下插件的发现、实例化与加载
 * <p>
 * 插件索引在第一次访问时构建，之后只读。每个插件的加载由其容器自身的锁串行化，
 * 不同插件之间互不阻塞。失败的插件保持失败状态，不会重试。
 * </p>
 *
 * <pre>{@code
 * PluginManager<Formatter> manager = PluginManager.<Formatter>builder()
 *         .namespace("formatters")
 *         .listener(new AuditListener())
 *         .build();
 * List<Formatter> formatters = manager.loadAll();
 * }</pre>
 *
 * @param <P> 该命名空间下插件的类型
 * @author LingPlug
 */
@Slf4j
public class PluginManager<P extends Plugin> {

    static final String FILTER_DISABLED_REASON = "filter disabled this plugin before initialization";
    static final String CONDITION_DISABLED_REASON = "load condition was false";

    @Getter
    private final String namespace;

    @Getter
    private final LoadArguments loadArguments;

    @Getter
    private final PluginFinder finder;

    /**
     * 过滤器列表，可在索引加载前追加
     */
    @Getter
    private final List<PluginFilter> filters;

    private final LifecycleNotifier notifier;

    private final ReentrantLock indexLock = new ReentrantLock();
    private volatile Map<String, PluginContainer<P>> index;

    public PluginManager(String namespace) {
        this(namespace, null, null, null, null);
    }

    @Builder
    public PluginManager(@NonNull String namespace,
                         LoadArguments loadArguments,
                         @Singular List<PluginLifecycleListener> listeners,
                         PluginFinder finder,
                         List<PluginFilter> filters) {
        this.namespace = namespace;
        this.loadArguments = loadArguments != null ? loadArguments : LoadArguments.empty();
        this.notifier = new LifecycleNotifier(listeners);
        this.finder = finder != null ? finder : new MetadataPluginFinder(namespace,
                notifier::fireOnResolveException,
                new PluginSpecResolver(),
                MetadataPluginFinder.defaultEntryPointsResolver(),
                new ClassLoaderCodeLoader());
        this.filters = filters != null
                ? new CopyOnWriteArrayList<>(filters)
                : new CopyOnWriteArrayList<>(List.of(MatchingPluginFilter.global()));
    }

    // ==================== 查询 ====================

    public void addListener(PluginLifecycleListener listener) {
        notifier.add(listener);
    }

    public List<PluginLifecycleListener> getListeners() {
        return notifier.getListeners();
    }

    public List<PluginSpec> listPluginSpecs() {
        List<PluginSpec> specs = new ArrayList<>();
        for (PluginContainer<P> container : index().values()) {
            specs.add(container.getSpec());
        }
        return specs;
    }

    /**
     * 按发现顺序返回所有插件名称
     */
    public List<String> listNames() {
        return new ArrayList<>(index().keySet());
    }

    public List<PluginContainer<P>> listContainers() {
        return new ArrayList<>(index().values());
    }

    /**
     * @throws PluginNotFoundException 名称不存在
     */
    public PluginContainer<P> getContainer(String name) {
        PluginContainer<P> container = index().get(name);
        if (container == null) {
            throw new PluginNotFoundException(namespace, name);
        }
        return container;
    }

    public boolean exists(String name) {
        return index().containsKey(name);
    }

    public boolean isLoaded(String name) {
        PluginContainer<P> container = index().get(name);
        return container != null && container.isLoaded();
    }

    // ==================== 加载 ====================

    /**
     * 加载指定插件并返回实例，已加载的插件直接返回缓存的实例
     *
     * @throws PluginNotFoundException 名称不存在
     * @throws PluginDisabledException 插件被过滤器、加载条件或监听器禁用
     * @throws PluginInitException     插件工厂执行失败
     * @throws PluginLoadException     插件 load 方法执行失败
     */
    public P load(String name) {
        PluginContainer<P> container = getContainer(name);

        if (container.isDisabled()) {
            throw new PluginDisabledException(namespace, name, container.getDisabledReason());
        }

        if (!container.isLoaded()) {
            ReentrantLock lock = container.getLock();
            lock.lock();
            try {
                loadPlugin(container);
            } catch (PluginDisabledException e) {
                container.markDisabled(e.getReason());
                throw e;
            } finally {
                lock.unlock();
            }
        }

        if (container.getInitError() != null) {
            throw new PluginInitException(namespace, name, container.getInitError());
        }
        if (container.getLoadError() != null) {
            throw new PluginLoadException(namespace, name, container.getLoadError());
        }
        if (!container.isLoaded()) {
            throw new PluginException("plugin " + namespace + ":" + name + " did not load correctly",
                    namespace, name);
        }
        return container.getPlugin();
    }

    public List<P> loadAll() {
        return loadAll(false);
    }

    /**
     * 加载命名空间下的所有插件
     * <p>
     * 被禁用的插件只记录 debug 日志。其他失败（包括过滤器抛出的运行时异常）默认记录错误日志后跳过；
     * propagateExceptions 为 true 时第一个失败直接抛出，不再加载剩余插件。
     * </p>
     *
     * @return 加载成功的插件，顺序与发现顺序一致
     */
    public List<P> loadAll(boolean propagateExceptions) {
        List<P> plugins = new ArrayList<>();

        for (PluginContainer<P> container : index().values()) {
            if (container.isLoaded()) {
                plugins.add(container.getPlugin());
                continue;
            }
            String name = container.getName();
            try {
                plugins.add(load(name));
            } catch (PluginDisabledException e) {
                log.debug("skipped loading plugin {}:{}: {}", namespace, name, e.getReason());
            } catch (RuntimeException e) {
                // 过滤器等外部组件抛出的异常同样只影响当前插件
                if (propagateExceptions) {
                    throw e;
                }
                if (!(e instanceof PluginException) && log.isDebugEnabled()) {
                    log.debug("unexpected error while loading plugin {}:{}", namespace, name, e);
                }
                log.error("exception while loading plugin {}:{}: {}", namespace, name, e.toString());
            }
        }
        return plugins;
    }

    /**
     * 在容器锁内执行完整的生命周期流程
     * 调用方负责把 PluginDisabledException 记录到容器上
     */
    @SuppressWarnings("unchecked")
    private void loadPlugin(PluginContainer<P> container) {
        PluginSpec spec = container.getSpec();
        String name = spec.getName();

        // 等锁期间可能已被其他线程处理完
        if (container.isLoaded()) {
            return;
        }
        if (container.isDisabled()) {
            throw new PluginDisabledException(namespace, name, container.getDisabledReason());
        }
        if (container.getInitError() != null || container.getLoadError() != null) {
            return;
        }

        for (PluginFilter filter : filters) {
            if (filter.isFiltered(spec)) {
                throw new PluginDisabledException(namespace, name, FILTER_DISABLED_REASON);
            }
        }

        if (!container.isInit()) {
            try {
                P plugin = (P) spec.getFactory().create();
                container.markInitialized(plugin);
                notifier.fireOnInitAfter(spec, plugin);
            } catch (PluginDisabledException e) {
                throw e;
            } catch (Exception | LinkageError e) {
                if (log.isDebugEnabled()) {
                    log.debug("error initializing plugin {}:{}", namespace, name, e);
                }
                notifier.fireOnInitException(spec, e);
                container.markInitError(e);
                return;
            }
        }

        P plugin = container.getPlugin();
        try {
            if (!plugin.shouldLoad()) {
                throw new PluginDisabledException(namespace, name, CONDITION_DISABLED_REASON);
            }
            notifier.fireOnLoadBefore(spec, plugin, loadArguments);
            Object value = plugin.load(loadArguments);
            notifier.fireOnLoadAfter(spec, plugin, value);
            container.markLoaded(value);
            log.debug("Loaded plugin {}:{}", namespace, name);
        } catch (PluginDisabledException e) {
            throw e;
        } catch (Exception | LinkageError e) {
            if (log.isDebugEnabled()) {
                log.debug("error loading plugin {}:{}", namespace, name, e);
            }
            notifier.fireOnLoadException(spec, plugin, e);
            container.markLoadError(e);
        }
    }

    // ==================== 索引 ====================

    private Map<String, PluginContainer<P>> index() {
        Map<String, PluginContainer<P>> current = index;
        if (current == null) {
            indexLock.lock();
            try {
                current = index;
                if (current == null) {
                    current = buildIndex();
                    index = current;
                }
            } finally {
                indexLock.unlock();
            }
        }
        return current;
    }

    private Map<String, PluginContainer<P>> buildIndex() {
        Map<String, PluginContainer<P>> containers = new LinkedHashMap<>();

        for (PluginSpec spec : finder.findPlugins()) {
            notifier.fireOnResolveAfter(spec);
            if (!namespace.equals(spec.getNamespace())) {
                continue;
            }
            PluginContainer<P> previous = containers.put(spec.getName(), new PluginContainer<>(spec));
            if (previous != null) {
                log.warn("Duplicate plugin {}:{}, {} replaces {}", namespace, spec.getName(),
                        spec.getFactory(), previous.getSpec().getFactory());
            }
        }
        log.debug("Plugin index for namespace {} built with {} plugins", namespace, containers.size());
        return Collections.unmodifiableMap(containers);
    }
}
