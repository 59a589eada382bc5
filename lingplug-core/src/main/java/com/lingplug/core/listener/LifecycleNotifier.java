package com.lingplug.core.listener;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.exception.PluginException;
import com.lingplug.api.listener.PluginLifecycleListener;
import com.lingplug.api.plugin.LoadArguments;
import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 生命周期事件分发器
 * <p>
 * 按注册顺序依次回调每个监听器。单个监听器抛出的异常只记录日志，不影响其他监听器，
 * 唯独 {@link PluginException} 及其子类会穿透出去，由生命周期流程处理（例如禁用插件）。
 */
@Slf4j
public class LifecycleNotifier {

    private final List<PluginLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    public LifecycleNotifier() {
    }

    public LifecycleNotifier(Collection<? extends PluginLifecycleListener> listeners) {
        if (listeners != null) {
            listeners.forEach(this::add);
        }
    }

    public void add(PluginLifecycleListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public List<PluginLifecycleListener> getListeners() {
        return Collections.unmodifiableList(listeners);
    }

    public void fireOnResolveException(String namespace, EntryPoint entryPoint, Throwable exception) {
        dispatch("onResolveException", l -> l.onResolveException(namespace, entryPoint, exception));
    }

    public void fireOnResolveAfter(PluginSpec spec) {
        dispatch("onResolveAfter", l -> l.onResolveAfter(spec));
    }

    public void fireOnInitException(PluginSpec spec, Throwable exception) {
        dispatch("onInitException", l -> l.onInitException(spec, exception));
    }

    public void fireOnInitAfter(PluginSpec spec, Plugin plugin) {
        dispatch("onInitAfter", l -> l.onInitAfter(spec, plugin));
    }

    public void fireOnLoadBefore(PluginSpec spec, Plugin plugin, LoadArguments arguments) {
        dispatch("onLoadBefore", l -> l.onLoadBefore(spec, plugin, arguments));
    }

    public void fireOnLoadAfter(PluginSpec spec, Plugin plugin, Object result) {
        dispatch("onLoadAfter", l -> l.onLoadAfter(spec, plugin, result));
    }

    public void fireOnLoadException(PluginSpec spec, Plugin plugin, Throwable exception) {
        dispatch("onLoadException", l -> l.onLoadException(spec, plugin, exception));
    }

    private void dispatch(String hook, Consumer<PluginLifecycleListener> call) {
        for (PluginLifecycleListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (PluginException e) {
                throw e;
            } catch (Exception e) {
                if (log.isDebugEnabled()) {
                    log.debug("Error in lifecycle listener {}.{}", listener.getClass().getName(), hook, e);
                }
                log.error("Error in lifecycle listener {}.{}: {}", listener.getClass().getName(), hook,
                        e.getMessage());
            }
        }
    }
}
