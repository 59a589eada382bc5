package com.lingplug.core.filter;

import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.entrypoint.EntryPoints;

/**
 * 单条匹配规则，未配置的维度不参与判断，已配置的维度必须全部匹配
 */
public class PluginSpecMatcher {

    private final GlobPattern namespace;
    private final GlobPattern name;
    private final GlobPattern value;

    public PluginSpecMatcher(String namespace, String name, String value) {
        this.namespace = namespace != null ? GlobPattern.compile(namespace) : null;
        this.name = name != null ? GlobPattern.compile(name) : null;
        this.value = value != null ? GlobPattern.compile(value) : null;
    }

    public boolean matches(PluginSpec spec) {
        if (namespace != null && !namespace.matches(spec.getNamespace())) {
            return false;
        }
        if (name != null && !name.matches(spec.getName())) {
            return false;
        }
        if (value != null) {
            String locator = EntryPoints.locatorOf(spec);
            return locator != null && value.matches(locator);
        }
        return true;
    }

    @Override
    public String toString() {
        return "PluginSpecMatcher(namespace=" + namespace + ", name=" + name + ", value=" + value + ")";
    }
}
