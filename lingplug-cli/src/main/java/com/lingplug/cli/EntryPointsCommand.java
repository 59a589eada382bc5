package com.lingplug.cli;

import com.lingplug.core.build.BuildConfig;
import com.lingplug.core.build.EntrypointBuildMode;
import com.lingplug.core.build.LingPlugProject;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * 发现插件并生成入口点声明文件
 * <p>
 * BUILD_HOOK 模式写入 classes 目录，MANUAL 模式写入工作目录下的静态文件。
 */
class EntryPointsCommand extends ProjectCommand {

    private final OptionSpec<String> excludeOption = parser.acceptsAll(List.of("e", "exclude"),
            "comma separated class name patterns to exclude").withRequiredArg();
    private final OptionSpec<String> includeOption = parser.acceptsAll(List.of("i", "include"),
            "comma separated class name patterns to include").withRequiredArg();

    EntryPointsCommand(Supplier<Path> workdir) {
        super("Discover plugins and generate entry points", workdir);
    }

    @Override
    protected int execute(Terminal terminal, OptionSet options) {
        LingPlugProject project = loadProject();
        project.setConfig(project.getConfig().merge(
                null,
                splitList(options, excludeOption),
                splitList(options, includeOption),
                null,
                null));
        BuildConfig config = project.getConfig();

        terminal.println("entry point build mode: " + config.getEntrypointBuildMode().getValue());

        Path written;
        if (config.getEntrypointBuildMode() == EntrypointBuildMode.MANUAL) {
            terminal.println("discovering plugins and writing to " + project.findStaticEntryPointFile() + " ...");
            written = project.writeStaticEntryPoints();
        } else {
            terminal.println("discovering plugins and building entrypoints automatically...");
            written = project.buildEntryPoints();
        }
        terminal.println("wrote " + written);
        return ExitCodes.OK;
    }
}
