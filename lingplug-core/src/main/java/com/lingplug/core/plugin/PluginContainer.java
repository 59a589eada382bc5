package com.lingplug.core.plugin;

import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.metadata.Distribution;
import com.lingplug.core.metadata.DistributionResolver;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个插件的运行时状态
 * <p>
 * 由 PluginManager 在构建索引时创建并独占。状态迁移是单调的：
 * 一旦初始化、加载或禁用就不会回退。可变字段只在持有 {@link #getLock()} 时修改。
 * </p>
 *
 * @param <P> 插件类型
 */
@Getter
public class PluginContainer<P extends Plugin> {

    private final PluginSpec spec;

    @Getter(AccessLevel.PACKAGE)
    private final ReentrantLock lock = new ReentrantLock();

    private volatile P plugin;
    private volatile Object loadValue;

    private volatile boolean init;
    private volatile boolean loaded;
    private volatile boolean disabled;

    private volatile Throwable initError;
    private volatile Throwable loadError;
    private volatile String disabledReason;

    public PluginContainer(PluginSpec spec) {
        this.spec = spec;
    }

    public String getNamespace() {
        return spec.getNamespace();
    }

    public String getName() {
        return spec.getName();
    }

    /**
     * 插件来自的 classpath 条目（目录或 jar）
     */
    public Optional<Distribution> getDistribution() {
        return new DistributionResolver().resolve(spec);
    }

    void markInitialized(P plugin) {
        this.plugin = plugin;
        this.init = true;
    }

    void markInitError(Throwable error) {
        this.initError = error;
    }

    void markLoaded(Object loadValue) {
        this.loadValue = loadValue;
        this.loaded = true;
    }

    void markLoadError(Throwable error) {
        this.loadError = error;
    }

    void markDisabled(String reason) {
        this.disabled = true;
        this.disabledReason = reason;
    }

    @Override
    public String toString() {
        return "PluginContainer(" + spec.getNamespace() + ":" + spec.getName()
                + ", init=" + init + ", loaded=" + loaded + ", disabled=" + disabled + ")";
    }
}
