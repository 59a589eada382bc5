package com.lingplug.api.exception;

/**
 * 插件工厂调用失败（实例化阶段）
 * cause 为工厂抛出的原始异常
 *
 * @author LingPlug
 */
public class PluginInitException extends PluginException {

    public PluginInitException(String namespace, String name, Throwable cause) {
        super("error initializing plugin " + namespace + ":" + name + ": " + cause.getMessage(),
                namespace, name, cause);
    }
}
