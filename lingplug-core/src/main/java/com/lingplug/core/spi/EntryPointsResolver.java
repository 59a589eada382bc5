package com.lingplug.core.spi;

import com.lingplug.api.entrypoint.EntryPoint;

import java.util.List;
import java.util.Map;

/**
 * 入口点索引 SPI：group -> 该 group 下的入口点列表
 */
@FunctionalInterface
public interface EntryPointsResolver {

    Map<String, List<EntryPoint>> getEntryPoints();
}
