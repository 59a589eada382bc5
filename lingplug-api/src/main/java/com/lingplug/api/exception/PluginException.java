package com.lingplug.api.exception;

import lombok.Getter;

/**
 * 插件异常
 * <p>
 * 携带出错插件的命名空间与名称。生命周期监听器抛出的此类异常不会被吞掉，
 * 而是传回生命周期流程（例如用 {@link PluginDisabledException} 否决一个插件）。
 * </p>
 *
 * @author LingPlug
 */
@Getter
public class PluginException extends LingPlugException {

    private final String namespace;
    private final String name;

    public PluginException(String message) {
        this(message, null, null);
    }

    public PluginException(String message, String namespace, String name) {
        super(message);
        this.namespace = namespace;
        this.name = name;
    }

    public PluginException(String message, String namespace, String name, Throwable cause) {
        super(message, cause);
        this.namespace = namespace;
        this.name = name;
    }
}
