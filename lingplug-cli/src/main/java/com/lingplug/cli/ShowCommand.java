package com.lingplug.cli;

import joptsimple.OptionSet;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * 打印已生成的入口点声明文件
 */
class ShowCommand extends ProjectCommand {

    ShowCommand(Supplier<Path> workdir) {
        super("Show entrypoints that were generated", workdir);
    }

    @Override
    protected int execute(Terminal terminal, OptionSet options) throws Exception {
        Path file = loadProject().findEntryPointFile();
        if (!Files.isRegularFile(file)) {
            terminal.println("No entrypoints file found at " + file + ", nothing to show");
            return ExitCodes.OK;
        }
        terminal.getWriter().print(Files.readString(file, StandardCharsets.UTF_8));
        terminal.getWriter().flush();
        return ExitCodes.OK;
    }
}
