package com.lingplug.cli;

import ch.qos.logback.classic.Level;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * lingplug 命令行入口
 *
 * <pre>
 * lingplug [--workdir dir] [-v] discover|entrypoints|resolve|show [options]
 * </pre>
 *
 * @author LingPlug
 */
public class LingPlugCli extends MultiCommand {

    private final OptionSpec<String> workdirOption = parser.accepts("workdir", "overwrite the working directory")
            .withRequiredArg();
    private final OptionSpec<Void> verboseOption = parser.acceptsAll(List.of("v", "verbose"),
            "enable verbose logging");

    private Path workdir = Paths.get("").toAbsolutePath();

    public LingPlugCli() {
        super("LingPlug plugin tooling");
        subcommands.put("discover", new DiscoverCommand(this::getWorkdir));
        subcommands.put("entrypoints", new EntryPointsCommand(this::getWorkdir));
        subcommands.put("resolve", new ResolveCommand());
        subcommands.put("show", new ShowCommand(this::getWorkdir));
    }

    public static void main(String[] args) {
        int status = new LingPlugCli().main(args, Terminal.system());
        System.exit(status);
    }

    public Path getWorkdir() {
        return workdir;
    }

    @Override
    protected void beforeSubcommand(Terminal terminal, OptionSet options) {
        if (options.has(workdirOption)) {
            workdir = Paths.get(options.valueOf(workdirOption)).toAbsolutePath();
        }
        if (options.has(verboseOption)) {
            enableDebugLogging();
            terminal.println("loading project config from " + workdir);
        }
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }
}
