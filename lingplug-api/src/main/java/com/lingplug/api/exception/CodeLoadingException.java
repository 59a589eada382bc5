package com.lingplug.api.exception;

import lombok.Getter;

/**
 * 定位符（locator）无法加载为代码对象
 *
 * @author LingPlug
 */
@Getter
public class CodeLoadingException extends LingPlugException {

    private final String locator;

    public CodeLoadingException(String locator, String message) {
        super("cannot load " + locator + ": " + message);
        this.locator = locator;
    }

    public CodeLoadingException(String locator, String message, Throwable cause) {
        super("cannot load " + locator + ": " + message, cause);
        this.locator = locator;
    }
}
