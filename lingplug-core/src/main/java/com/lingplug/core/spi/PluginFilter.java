package com.lingplug.core.spi;

import com.lingplug.api.plugin.PluginSpec;

/**
 * 插件过滤器 SPI
 */
@FunctionalInterface
public interface PluginFilter {

    /**
     * @param spec 待检查的插件规格
     * @return true 表示插件必须在实例化之前被禁用
     */
    boolean isFiltered(PluginSpec spec);
}
