package com.lingplug.api.plugin;

import java.util.*;

/**
 * 插件加载参数：位置参数 + 命名参数
 * 不可变，原样转发给每个插件的 load 方法
 */
public final class LoadArguments {

    private static final LoadArguments EMPTY = new LoadArguments(Collections.emptyList(), Collections.emptyMap());

    private final List<Object> positional;
    private final Map<String, Object> named;

    private LoadArguments(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    public static LoadArguments empty() {
        return EMPTY;
    }

    public static LoadArguments of(Object... positional) {
        return of(Arrays.asList(positional), Collections.emptyMap());
    }

    public static LoadArguments of(List<?> positional, Map<String, ?> named) {
        List<Object> args = positional == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(positional));
        Map<String, Object> kwargs = named == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(named));
        return new LoadArguments(args, kwargs);
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> named() {
        return named;
    }

    public Object get(int index) {
        return positional.get(index);
    }

    public Object get(String name) {
        return named.get(name);
    }

    public Object[] toArray() {
        return positional.toArray();
    }

    public boolean isEmpty() {
        return positional.isEmpty() && named.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LoadArguments that)) return false;
        return positional.equals(that.positional) && named.equals(that.named);
    }

    @Override
    public int hashCode() {
        return Objects.hash(positional, named);
    }

    @Override
    public String toString() {
        return "LoadArguments{args=" + positional + ", kwargs=" + named + "}";
    }
}
