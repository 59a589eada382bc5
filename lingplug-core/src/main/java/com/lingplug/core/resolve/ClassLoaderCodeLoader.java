package com.lingplug.core.resolve;

import com.lingplug.api.exception.CodeLoadingException;
import com.lingplug.core.spi.CodeLoader;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * 基于 ClassLoader 的代码加载器
 * <p>
 * 定位符格式：
 * 1. {@code com.example.MyPlugin} 加载类本身
 * 2. {@code com.example.Plugins:MEMBER} 读取该类的 public static 字段
 */
public class ClassLoaderCodeLoader implements CodeLoader {

    private final ClassLoader classLoader;

    /**
     * 使用线程上下文类加载器
     */
    public ClassLoaderCodeLoader() {
        this(null);
    }

    public ClassLoaderCodeLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public Object load(String locator) throws CodeLoadingException {
        if (locator == null || locator.isBlank()) {
            throw new CodeLoadingException(String.valueOf(locator), "empty locator");
        }
        String trimmed = locator.trim();
        int separator = trimmed.indexOf(':');
        String className = separator < 0 ? trimmed : trimmed.substring(0, separator).trim();
        String member = separator < 0 ? null : trimmed.substring(separator + 1).trim();

        Class<?> type = loadClass(locator, className);
        if (member == null || member.isEmpty()) {
            return type;
        }
        return readStaticMember(locator, type, member);
    }

    private Class<?> loadClass(String locator, String className) {
        ClassLoader loader = resolveClassLoader();
        try {
            return Class.forName(className, true, loader);
        } catch (ClassNotFoundException e) {
            throw new CodeLoadingException(locator, "class " + className + " not found", e);
        } catch (LinkageError e) {
            // 静态初始化失败或依赖缺失
            throw new CodeLoadingException(locator, "class " + className + " could not be linked: " + e, e);
        }
    }

    private Object readStaticMember(String locator, Class<?> type, String member) {
        Field field;
        try {
            field = type.getField(member);
        } catch (NoSuchFieldException e) {
            throw new CodeLoadingException(locator, "no public field " + member + " in " + type.getName(), e);
        }
        if (!Modifier.isStatic(field.getModifiers())) {
            throw new CodeLoadingException(locator, "field " + member + " of " + type.getName() + " is not static");
        }
        try {
            return field.get(null);
        } catch (IllegalAccessException e) {
            throw new CodeLoadingException(locator, "field " + member + " is not accessible", e);
        }
    }

    private ClassLoader resolveClassLoader() {
        if (classLoader != null) {
            return classLoader;
        }
        ClassLoader context = Thread.currentThread().getContextClassLoader();
        return context != null ? context : ClassLoaderCodeLoader.class.getClassLoader();
    }
}
