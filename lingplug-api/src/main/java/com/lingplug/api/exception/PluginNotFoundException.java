package com.lingplug.api.exception;

/**
 * 命名空间中不存在指定名称的插件
 *
 * @author LingPlug
 */
public class PluginNotFoundException extends PluginException {

    public PluginNotFoundException(String namespace, String name) {
        super("no plugin named " + name + " in namespace " + namespace, namespace, name);
    }
}
