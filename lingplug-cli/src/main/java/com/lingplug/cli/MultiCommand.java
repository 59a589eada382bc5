package com.lingplug.cli;

import joptsimple.NonOptionArgumentSpec;
import joptsimple.OptionSet;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 由多个子命令组成的命令，第一个非选项参数是子命令名
 */
public abstract class MultiCommand extends Command {

    protected final Map<String, Command> subcommands = new LinkedHashMap<>();

    private final NonOptionArgumentSpec<String> arguments = parser.nonOptions("command");

    protected MultiCommand(String description) {
        super(description);
        parser.posixlyCorrect(true);
    }

    @Override
    protected void printAdditionalHelp(Terminal terminal) {
        terminal.println("Commands");
        terminal.println("--------");
        for (Map.Entry<String, Command> subcommand : subcommands.entrySet()) {
            terminal.println(subcommand.getKey() + " - " + subcommand.getValue().getDescription());
        }
        terminal.println("");
    }

    /**
     * 子命令执行前的钩子，用于处理全局选项
     */
    protected void beforeSubcommand(Terminal terminal, OptionSet options) throws Exception {
    }

    @Override
    protected int execute(Terminal terminal, OptionSet options) throws Exception {
        String[] args = arguments.values(options).toArray(new String[0]);
        if (args.length == 0) {
            printHelp(terminal);
            throw new UserException(ExitCodes.USAGE, "Missing command");
        }
        Command subcommand = subcommands.get(args[0]);
        if (subcommand == null) {
            throw new UserException(ExitCodes.USAGE, "Unknown command [" + args[0] + "]");
        }
        beforeSubcommand(terminal, options);
        return subcommand.mainWithoutErrorHandling(Arrays.copyOfRange(args, 1, args.length), terminal);
    }
}
