package com.lingplug.cli;

import com.lingplug.core.build.LingPlugProject;
import com.lingplug.core.build.PluginIndexBuilder;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * 扫描 classes 目录，输出发现的入口点
 */
class DiscoverCommand extends ProjectCommand {

    private final OptionSpec<String> pathOption = parser.acceptsAll(List.of("p", "path"),
            "the classes directory or jar in which to look for plugins").withRequiredArg();
    private final OptionSpec<String> excludeOption = parser.acceptsAll(List.of("e", "exclude"),
            "comma separated class name patterns to exclude; 'foo.*' excludes everything below 'foo'")
            .withRequiredArg();
    private final OptionSpec<String> includeOption = parser.acceptsAll(List.of("i", "include"),
            "comma separated class name patterns to include; when given, only matching classes are scanned")
            .withRequiredArg();
    private final OptionSpec<String> formatOption = parser.acceptsAll(List.of("f", "format"),
            "output format, 'json' or 'ini'").withRequiredArg().defaultsTo("json");
    private final OptionSpec<String> outputOption = parser.acceptsAll(List.of("o", "output"),
            "output file, defaults to stdout").withRequiredArg();

    DiscoverCommand(Supplier<Path> workdir) {
        super("Discover plugins and print them", workdir);
    }

    @Override
    protected int execute(Terminal terminal, OptionSet options) throws Exception {
        PluginIndexBuilder.OutputFormat format = parseFormat(options.valueOf(formatOption));

        LingPlugProject project = loadProject();
        project.setConfig(project.getConfig().merge(
                options.valueOf(pathOption),
                splitList(options, excludeOption),
                splitList(options, includeOption),
                null,
                null));

        if (options.has(outputOption)) {
            Path output = workdir().resolve(options.valueOf(outputOption));
            try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                project.discover(out, format);
            }
        } else {
            project.discover(terminal.getWriter(), format);
        }
        return ExitCodes.OK;
    }

    private static PluginIndexBuilder.OutputFormat parseFormat(String value) throws UserException {
        return switch (value.toLowerCase()) {
            case "json" -> PluginIndexBuilder.OutputFormat.JSON;
            case "ini" -> PluginIndexBuilder.OutputFormat.INI;
            default -> throw new UserException(ExitCodes.USAGE, "unknown format " + value + ", use 'json' or 'ini'");
        };
    }
}
