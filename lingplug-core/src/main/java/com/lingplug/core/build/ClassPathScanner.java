package com.lingplug.core.build;

import com.lingplug.api.exception.LingPlugException;
import com.lingplug.core.filter.GlobPattern;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * 列出 classes 目录或 jar 中的顶层类并加载它们
 * <p>
 * 内部类不单独列出，由 ModuleScanningPluginFinder 通过外部类的成员访问。
 * 加载失败的类（缺少依赖等）记录 debug 日志后跳过。
 * 扫描器持有的类加载器在 {@link #close()} 之前保持打开，加载出的类在此期间可用。
 */
@Slf4j
public class ClassPathScanner implements Closeable {

    private static final String CLASS_SUFFIX = ".class";

    private final Path root;
    private final List<GlobPattern> includes;
    private final List<GlobPattern> excludes;
    private final URLClassLoader classLoader;

    public ClassPathScanner(Path root, List<String> include, List<String> exclude) {
        this(root, include, exclude, Thread.currentThread().getContextClassLoader());
    }

    public ClassPathScanner(Path root, List<String> include, List<String> exclude, ClassLoader parent) {
        this.root = root;
        this.includes = compile(include);
        this.excludes = compile(exclude);
        try {
            this.classLoader = new URLClassLoader(new URL[]{root.toUri().toURL()}, parent);
        } catch (MalformedURLException e) {
            throw new LingPlugException("invalid class path entry " + root, e);
        }
    }

    /**
     * 所有通过 include/exclude 过滤的顶层类名，按名称排序
     */
    public List<String> listClassNames() {
        if (!Files.exists(root)) {
            throw new LingPlugException("class path entry does not exist: " + root);
        }
        List<String> names = Files.isDirectory(root) ? listDirectory() : listJar();
        List<String> result = new ArrayList<>();
        for (String name : names) {
            if (isIncluded(name)) {
                result.add(name);
            }
        }
        Collections.sort(result);
        return result;
    }

    public List<Class<?>> scan() {
        List<Class<?>> classes = new ArrayList<>();
        for (String name : listClassNames()) {
            try {
                classes.add(Class.forName(name, true, classLoader));
            } catch (ClassNotFoundException | LinkageError e) {
                log.debug("Skipping class {}: {}", name, e.toString());
            }
        }
        log.debug("Scanned {} classes from {}", classes.size(), root);
        return classes;
    }

    boolean isIncluded(String className) {
        for (GlobPattern exclude : excludes) {
            if (exclude.matches(className)) {
                return false;
            }
        }
        if (includes.isEmpty()) {
            return true;
        }
        for (GlobPattern include : includes) {
            if (include.matches(className)) {
                return true;
            }
        }
        return false;
    }

    private List<String> listDirectory() {
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .map(file -> root.relativize(file).toString().replace('\\', '/'))
                    .map(ClassPathScanner::toClassName)
                    .filter(Objects::nonNull)
                    .forEach(names::add);
        } catch (IOException e) {
            throw new LingPlugException("cannot list classes in " + root, e);
        }
        return names;
    }

    private List<String> listJar() {
        List<String> names = new ArrayList<>();
        try (JarFile jar = new JarFile(root.toFile())) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                String name = toClassName(entry.getName());
                if (name != null) {
                    names.add(name);
                }
            }
        } catch (IOException e) {
            throw new LingPlugException("cannot list classes in " + root, e);
        }
        return names;
    }

    /**
     * 资源路径转类名，非顶层类返回 null
     */
    static String toClassName(String resource) {
        if (!resource.endsWith(CLASS_SUFFIX) || resource.startsWith("META-INF/")) {
            return null;
        }
        String name = resource.substring(0, resource.length() - CLASS_SUFFIX.length()).replace('/', '.');
        if (name.contains("$") || name.endsWith("module-info") || name.endsWith("package-info")) {
            return null;
        }
        return name;
    }

    private static List<GlobPattern> compile(List<String> patterns) {
        List<GlobPattern> result = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                result.add(GlobPattern.compile(pattern));
            }
        }
        return result;
    }

    @Override
    public void close() throws IOException {
        classLoader.close();
    }
}
