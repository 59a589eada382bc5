package com.lingplug.api.exception;

import lombok.Getter;

/**
 * 插件被禁用
 * 场景：过滤器排除、插件自身的加载条件为 false、监听器否决
 *
 * @author LingPlug
 */
@Getter
public class PluginDisabledException extends PluginException {

    private final String reason;

    public PluginDisabledException(String namespace, String name) {
        this(namespace, name, null);
    }

    public PluginDisabledException(String namespace, String name, String reason) {
        super(message(namespace, name, reason), namespace, name);
        this.reason = reason;
    }

    private static String message(String namespace, String name, String reason) {
        String message = "plugin " + namespace + ":" + name + " is disabled";
        if (reason != null) {
            message = message + ", reason: " + reason;
        }
        return message;
    }
}
