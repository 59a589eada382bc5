package com.lingplug.core.cache;

import com.lingplug.api.entrypoint.EntryPoint;
import com.lingplug.api.exception.EntryPointException;
import com.lingplug.core.config.LingPlugConfig;
import com.lingplug.core.entrypoint.EntryPoints;
import com.lingplug.core.entrypoint.EntryPointsText;
import com.lingplug.core.metadata.Distribution;
import com.lingplug.core.metadata.SearchPathEntryPointsResolver;
import com.lingplug.core.spi.EntryPointsResolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 带两级缓存的入口点解析器
 * <p>
 * 1. 进程内缓存：以搜索路径列表为 key，同一搜索路径的并发调用方阻塞等待第一个构建者
 * 2. 磁盘缓存：文件名为搜索路径状态（JVM 标识 + 每个条目及其声明文件的 mtime）的 SHA-256，
 *    任何声明文件被修改都会产生新的 key，过期索引不会被误用
 * <p>
 * 磁盘缓存目录在进程之间共享且不加锁，并发写入同一个文件时内容相同，后写者覆盖即可。
 */
@Slf4j
public class EntryPointsCache implements EntryPointsResolver {

    private static final String CACHE_FILE_SUFFIX = ".entry_points.ini";
    private static final long NONEXISTENT = -1L;

    private static volatile EntryPointsCache instance;
    private static final Object INSTANCE_LOCK = new Object();

    // Key=搜索路径, Value=group -> 入口点列表
    private final Map<List<String>, Map<String, List<EntryPoint>>> cache = new ConcurrentHashMap<>();

    // 每个搜索路径一把锁，不同搜索路径之间互不阻塞
    private final Map<List<String>, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final SearchPathEntryPointsResolver resolver;
    private final Supplier<List<String>> searchPath;

    @Getter
    private final Path cacheDir;

    public EntryPointsCache(Path cacheDir) {
        this(cacheDir, new SearchPathEntryPointsResolver(), () -> LingPlugConfig.current().effectiveSearchPath());
    }

    public EntryPointsCache(Path cacheDir,
                            SearchPathEntryPointsResolver resolver,
                            Supplier<List<String>> searchPath) {
        this.cacheDir = cacheDir;
        this.resolver = resolver;
        this.searchPath = searchPath;
    }

    /**
     * 获取全局缓存实例，首次访问时按当前配置创建
     */
    public static EntryPointsCache instance() {
        EntryPointsCache current = instance;
        if (current != null) {
            return current;
        }
        synchronized (INSTANCE_LOCK) {
            if (instance == null) {
                instance = new EntryPointsCache(LingPlugConfig.current().getCacheDir());
            }
            return instance;
        }
    }

    /**
     * 丢弃全局实例
     * 场景：单元测试 teardown、切换配置
     */
    public static void clearInstance() {
        synchronized (INSTANCE_LOCK) {
            instance = null;
        }
    }

    @Override
    public Map<String, List<EntryPoint>> getEntryPoints() {
        return getEntryPoints(searchPath.get());
    }

    public Map<String, List<EntryPoint>> getEntryPoints(List<String> path) {
        List<String> key = List.copyOf(path);

        Map<String, List<EntryPoint>> index = cache.get(key);
        if (index != null) {
            return index;
        }

        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            index = cache.get(key);
            if (index == null) {
                index = freeze(buildAndStoreIndex(key));
                cache.put(key, index);
            }
            return index;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 优先读取磁盘缓存，不存在时重新扫描并写入
     */
    Map<String, List<EntryPoint>> buildAndStoreIndex(List<String> path) {
        Path file = cacheFile(path);

        if (Files.isRegularFile(file)) {
            try {
                log.debug("Reading entry points from cache file {}", file);
                return EntryPoints.buildIndex(EntryPointsText.parse(Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException | EntryPointException e) {
                log.warn("Ignoring unreadable entry point cache {}: {}", file, e.getMessage());
            }
        }

        long start = System.currentTimeMillis();
        Map<String, List<EntryPoint>> index = resolver.resolve(path);
        log.debug("Resolved {} entry point groups from {} path entries in {} ms",
                index.size(), path.size(), System.currentTimeMillis() - start);

        write(file, EntryPointsText.serialize(index));
        return index;
    }

    /**
     * 搜索路径对应的缓存文件
     */
    public Path cacheFile(List<String> path) {
        return cacheDir.resolve(calculateHashKey(path) + CACHE_FILE_SUFFIX);
    }

    /**
     * 计算搜索路径入口点状态的哈希
     * <p>
     * 包含：JVM 路径与版本、每个条目的路径与 mtime、条目下入口点声明文件的路径与 mtime、
     * 可编辑安装重定向目标的路径与 mtime。
     */
    public String calculateHashKey(List<String> path) {
        MessageDigest digest = sha256();

        update(digest, System.getProperty("java.home", ""));
        update(digest, System.getProperty("java.runtime.version", ""));

        for (String entry : path) {
            update(digest, entry);
            update(digest, mtime(entry));

            for (Path file : declarationFiles(entry)) {
                update(digest, file.toString());
                update(digest, mtime(file));
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private List<Path> declarationFiles(String entry) {
        Distribution distribution;
        try {
            distribution = Distribution.at(entry);
        } catch (InvalidPathException e) {
            return Collections.emptyList();
        }
        if (!distribution.exists()) {
            return Collections.emptyList();
        }

        List<Path> files = new ArrayList<>();
        if (distribution.isDirectory()) {
            files.add(distribution.entryPointsFile());
            files.add(distribution.getLocation().resolve(Distribution.EDITABLE_LINK_FILE));
        }
        Path editable = distribution.editableLinkTarget();
        if (editable != null) {
            files.add(editable);
        }
        return files;
    }

    private void write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), "entry_points", ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            // 缓存写入失败只影响下次启动的速度
            log.warn("Cannot write entry point cache {}: {}", file, e.getMessage());
        }
    }

    private static Map<String, List<EntryPoint>> freeze(Map<String, List<EntryPoint>> index) {
        Map<String, List<EntryPoint>> frozen = new LinkedHashMap<>();
        index.forEach((group, eps) -> frozen.put(group, List.copyOf(eps)));
        return Collections.unmodifiableMap(frozen);
    }

    private static long mtime(String entry) {
        try {
            return mtime(Paths.get(entry));
        } catch (InvalidPathException e) {
            return NONEXISTENT;
        }
    }

    private static long mtime(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (NoSuchFileException e) {
            return NONEXISTENT;
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", path, e.getMessage());
            return NONEXISTENT;
        }
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
    }

    private static void update(MessageDigest digest, long value) {
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
