package com.lingplug.core.spi;

import com.lingplug.api.exception.CodeLoadingException;

/**
 * 代码加载 SPI
 * <p>
 * 把入口点中的定位符转换为已加载的代码对象（类、PluginSpec、函数插件注册等）。
 * 核心逻辑不关心加载方式，只要求同步执行，失败时抛出 {@link CodeLoadingException}。
 */
@FunctionalInterface
public interface CodeLoader {

    Object load(String locator) throws CodeLoadingException;
}
