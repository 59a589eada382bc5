package com.lingplug.api.exception;

/**
 * 插件 load 方法执行失败
 * cause 为 load 抛出的原始异常
 *
 * @author LingPlug
 */
public class PluginLoadException extends PluginException {

    public PluginLoadException(String namespace, String name, Throwable cause) {
        super("error loading plugin " + namespace + ":" + name + ": " + cause.getMessage(),
                namespace, name, cause);
    }
}
