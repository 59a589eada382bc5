package com.lingplug.cli;

import com.lingplug.core.build.LingPlugProject;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * 作用于工作目录中项目的命令
 */
public abstract class ProjectCommand extends Command {

    private final Supplier<Path> workdir;

    protected ProjectCommand(String description, Supplier<Path> workdir) {
        super(description);
        this.workdir = workdir;
    }

    protected Path workdir() {
        return workdir.get();
    }

    protected LingPlugProject loadProject() {
        return new LingPlugProject(workdir());
    }

    /**
     * 逗号分隔的列表选项，未指定时返回 null
     */
    protected static List<String> splitList(OptionSet options, OptionSpec<String> option) {
        if (!options.has(option)) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (String value : options.valuesOf(option)) {
            Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(values::add);
        }
        return values;
    }
}
