package com.lingplug.core.spi;

import com.lingplug.api.plugin.PluginSpec;

import java.util.List;

/**
 * 插件发现 SPI
 * <p>
 * 构建期通过扫描已加载的类发现插件，运行期通过入口点元数据发现插件。
 */
public interface PluginFinder {

    List<PluginSpec> findPlugins();
}
