package com.lingplug.cli;

import com.lingplug.api.plugin.Plugin;
import com.lingplug.api.plugin.PluginSpec;
import com.lingplug.core.cache.EntryPointsCache;
import com.lingplug.core.config.LingPlugConfig;
import com.lingplug.core.entrypoint.EntryPoints;
import com.lingplug.core.finder.MetadataPluginFinder;
import com.lingplug.core.metadata.SearchPathEntryPointsResolver;
import com.lingplug.core.plugin.PluginManager;
import com.lingplug.core.resolve.ClassLoaderCodeLoader;
import com.lingplug.core.resolve.PluginSpecResolver;
import com.lingplug.core.spi.EntryPointsResolver;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.io.File;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 列出命名空间下注册的插件，不加载插件
 */
class ResolveCommand extends Command {

    private final OptionSpec<String> namespaceOption = parser.accepts("namespace", "the plugin namespace")
            .withRequiredArg().required();
    private final OptionSpec<String> classPathOption = parser.accepts("classpath",
            "search path to resolve against, separated by the platform path separator; defaults to the JVM class path")
            .withRequiredArg();

    ResolveCommand() {
        super("Resolve a plugin namespace and list all its plugins");
    }

    @Override
    protected int execute(Terminal terminal, OptionSet options) throws Exception {
        String namespace = options.valueOf(namespaceOption);
        List<String> searchPath = options.has(classPathOption)
                ? new ArrayList<>(Arrays.asList(options.valueOf(classPathOption).split(File.pathSeparator)))
                : LingPlugConfig.current().effectiveSearchPath();

        for (String entry : searchPath) {
            terminal.println("path = " + entry);
        }

        try (URLClassLoader classLoader = new URLClassLoader(toUrls(searchPath),
                Thread.currentThread().getContextClassLoader())) {
            MetadataPluginFinder finder = new MetadataPluginFinder(namespace,
                    (ns, entryPoint, e) -> terminal.errorPrintln(
                            "WARN: cannot resolve " + ns + ":" + entryPoint.name() + ": " + e.getMessage()),
                    new PluginSpecResolver(),
                    entryPointsResolver(searchPath),
                    new ClassLoaderCodeLoader(classLoader));

            PluginManager<Plugin> manager = PluginManager.<Plugin>builder()
                    .namespace(namespace)
                    .finder(finder)
                    .build();

            for (PluginSpec spec : manager.listPluginSpecs()) {
                String locator = EntryPoints.locatorOf(spec);
                terminal.println(spec.getNamespace() + ":" + spec.getName() + " = "
                        + (locator != null ? locator : spec.getFactory()));
            }
        }
        return ExitCodes.OK;
    }

    private static EntryPointsResolver entryPointsResolver(List<String> searchPath) {
        LingPlugConfig config = LingPlugConfig.current();
        if (config.isCacheEnabled()) {
            return new EntryPointsCache(config.getCacheDir(), new SearchPathEntryPointsResolver(), () -> searchPath);
        }
        return new SearchPathEntryPointsResolver(searchPath);
    }

    private static URL[] toUrls(List<String> searchPath) throws Exception {
        List<URL> urls = new ArrayList<>();
        for (String entry : searchPath) {
            if (entry.isBlank()) {
                continue;
            }
            Path path = Paths.get(entry).toAbsolutePath();
            urls.add(path.toUri().toURL());
        }
        return urls.toArray(new URL[0]);
    }
}
