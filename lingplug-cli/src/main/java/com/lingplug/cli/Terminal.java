package com.lingplug.cli;

import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * 命令的输出目标，标准输出与错误输出分开
 */
public class Terminal {

    private final PrintWriter out;
    private final PrintWriter err;

    public Terminal(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public static Terminal system() {
        return new Terminal(
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true),
                new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));
    }

    public PrintWriter getWriter() {
        return out;
    }

    public PrintWriter getErrorWriter() {
        return err;
    }

    public void println(String line) {
        out.println(line);
        out.flush();
    }

    public void errorPrintln(String line) {
        err.println(line);
        err.flush();
    }
}
