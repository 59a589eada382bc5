package com.lingplug.core.filter;

import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.spi.PluginFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 基于通配符规则的插件过滤器
 * <p>
 * 任意一条规则命中即禁用该插件。没有规则时不过滤任何插件。
 */
@Slf4j
public class MatchingPluginFilter implements PluginFilter {

    private static final MatchingPluginFilter GLOBAL = new MatchingPluginFilter();

    private final List<PluginSpecMatcher> matchers = new CopyOnWriteArrayList<>();

    /**
     * 进程级默认过滤器，宿主应用可以向其追加规则
     */
    public static MatchingPluginFilter global() {
        return GLOBAL;
    }

    public MatchingPluginFilter addExclusion(String namespace, String name, String value) {
        matchers.add(new PluginSpecMatcher(namespace, name, value));
        return this;
    }

    public MatchingPluginFilter addExclusion(String namespace, String name) {
        return addExclusion(namespace, name, null);
    }

    public List<PluginSpecMatcher> getMatchers() {
        return Collections.unmodifiableList(matchers);
    }

    public void clear() {
        matchers.clear();
    }

    @Override
    public boolean isFiltered(PluginSpec spec) {
        for (PluginSpecMatcher matcher : matchers) {
            if (matcher.matches(spec)) {
                log.debug("Plugin {}:{} matched {}", spec.getNamespace(), spec.getName(), matcher);
                return true;
            }
        }
        return false;
    }
}
