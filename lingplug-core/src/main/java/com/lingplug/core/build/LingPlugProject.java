package com.lingplug.core.build;

import com.lingplug.api.exception.LingPlugException;
import com.lingplug.core.finder.ModuleScanningPluginFinder;
import com.lingplug.core.metadata.Distribution;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 一个待构建的项目：工作目录 + lingplug.yml
 * <p>
 * 把构建配置、类扫描、插件发现和入口点文件的生成串起来，供 CLI 使用。
 *
 * @author LingPlug
 */
@Slf4j
public class LingPlugProject {

    @Getter
    private final Path workdir;

    @Getter
    @Setter
    private BuildConfig config;

    public LingPlugProject(Path workdir) {
        this(workdir, BuildConfigLoader.loadFromWorkdir(workdir));
    }

    public LingPlugProject(Path workdir, BuildConfig config) {
        this.workdir = workdir;
        this.config = config;
    }

    public Path getClassesDir() {
        return workdir.resolve(config.getPath());
    }

    /**
     * 构建产物中的入口点声明文件，文件不一定存在
     */
    public Path findEntryPointFile() {
        return getClassesDir().resolve(Distribution.ENTRY_POINTS_FILE);
    }

    /**
     * MANUAL 模式下的静态入口点文件
     */
    public Path findStaticEntryPointFile() {
        return workdir.resolve(config.getEntrypointStaticFile());
    }

    public ClassPathScanner createScanner() {
        return new ClassPathScanner(getClassesDir(), config.getInclude(), config.getExclude());
    }

    /**
     * 扫描 classes 目录并把入口点写到 out
     */
    public Map<String, List<String>> discover(Writer out, PluginIndexBuilder.OutputFormat format) {
        try (ClassPathScanner scanner = createScanner()) {
            PluginIndexBuilder builder = new PluginIndexBuilder(new ModuleScanningPluginFinder(scanner.scan()));
            return builder.write(out, format);
        } catch (IOException e) {
            throw new LingPlugException("error discovering plugins in " + getClassesDir(), e);
        }
    }

    /**
     * 扫描 classes 目录，把入口点声明写入构建产物
     */
    public Path buildEntryPoints() {
        return writeEntryPoints(findEntryPointFile());
    }

    /**
     * 扫描 classes 目录，把入口点写入工作目录下的静态文件
     */
    public Path writeStaticEntryPoints() {
        return writeEntryPoints(findStaticEntryPointFile());
    }

    private Path writeEntryPoints(Path target) {
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                Map<String, List<String>> entryPoints = discover(out, PluginIndexBuilder.OutputFormat.INI);
                log.info("Wrote {} entry point groups to {}", entryPoints.size(), target);
            }
            return target;
        } catch (IOException e) {
            throw new LingPlugException("cannot write entry points to " + target, e);
        }
    }
}
