package com.lingplug.core.listener;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.listener.PluginLifecycleListener;
import com.lingplug.api.plugin.LoadArguments;
import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginSpec;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * 把多个监听器组合成一个，逐个转发，异常隔离规则同 {@link LifecycleNotifier}
 */
public class CompositePluginLifecycleListener implements PluginLifecycleListener {

    private final LifecycleNotifier notifier;

    public CompositePluginLifecycleListener(PluginLifecycleListener... listeners) {
        this(Arrays.asList(listeners));
    }

    public CompositePluginLifecycleListener(Collection<? extends PluginLifecycleListener> listeners) {
        this.notifier = new LifecycleNotifier(listeners);
    }

    public List<PluginLifecycleListener> getListeners() {
        return notifier.getListeners();
    }

    @Override
    public void onResolveException(String namespace, EntryPoint entryPoint, Throwable exception) {
        notifier.fireOnResolveException(namespace, entryPoint, exception);
    }

    @Override
    public void onResolveAfter(PluginSpec spec) {
        notifier.fireOnResolveAfter(spec);
    }

    @Override
    public void onInitException(PluginSpec spec, Throwable exception) {
        notifier.fireOnInitException(spec, exception);
    }

    @Override
    public void onInitAfter(PluginSpec spec, Plugin plugin) {
        notifier.fireOnInitAfter(spec, plugin);
    }

    @Override
    public void onLoadBefore(PluginSpec spec, Plugin plugin, LoadArguments arguments) {
        notifier.fireOnLoadBefore(spec, plugin, arguments);
    }

    @Override
    public void onLoadAfter(PluginSpec spec, Plugin plugin, Object result) {
        notifier.fireOnLoadAfter(spec, plugin, result);
    }

    @Override
    public void onLoadException(PluginSpec spec, Plugin plugin, Throwable exception) {
        notifier.fireOnLoadException(spec, plugin, exception);
    }
}
