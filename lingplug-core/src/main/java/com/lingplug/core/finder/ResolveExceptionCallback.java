package com.lingplug.core.finder;

import com.lingplug.api.entrypoint.EntryPoint;

/**
 * 入口点解析失败时的回调
 */
@FunctionalInterface
public interface ResolveExceptionCallback {

    void onResolveException(String namespace, EntryPoint entryPoint, Throwable exception);
}
