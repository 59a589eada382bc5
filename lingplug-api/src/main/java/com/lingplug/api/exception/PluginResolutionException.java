package com.lingplug.api.exception;

/**
 * 无法从给定对象解析出 PluginSpec
 *
 * @author LingPlug
 */
public class PluginResolutionException extends LingPlugException {

    public PluginResolutionException(String message) {
        super(message);
    }

    public PluginResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
