package com.lingplug.cli;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Arrays;

/**
 * 一条命令：解析自己的参数并执行
 */
@Slf4j
public abstract class Command {

    protected final String description;

    protected final OptionParser parser = new OptionParser();

    private final OptionSpec<Void> helpOption = parser.acceptsAll(Arrays.asList("h", "help"), "show help").forHelp();

    protected Command(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 解析参数并执行，所有异常都转换成退出码
     */
    public final int main(String[] args, Terminal terminal) {
        try {
            return mainWithoutErrorHandling(args, terminal);
        } catch (UserException e) {
            terminal.errorPrintln("ERROR: " + e.getMessage());
            return e.getExitCode();
        } catch (Exception e) {
            log.debug("Command failed", e);
            terminal.errorPrintln("ERROR: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    final int mainWithoutErrorHandling(String[] args, Terminal terminal) throws Exception {
        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            printHelp(terminal);
            throw new UserException(ExitCodes.USAGE, e.getMessage());
        }

        if (options.has(helpOption)) {
            printHelp(terminal);
            return ExitCodes.OK;
        }
        return execute(terminal, options);
    }

    protected void printHelp(Terminal terminal) throws IOException {
        terminal.println(description);
        terminal.println("");
        printAdditionalHelp(terminal);
        parser.printHelpOn(terminal.getWriter());
        terminal.getWriter().flush();
    }

    protected void printAdditionalHelp(Terminal terminal) {
    }

    protected abstract int execute(Terminal terminal, OptionSet options) throws Exception;
}
