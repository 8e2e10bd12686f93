package com.buildrunner.core.output;

import picocli.CommandLine.Help.Ansi;

import java.io.PrintStream;

/**
 * ANSI-colored terminal backed by the process streams. Colors are dropped when the
 * {@link Ansi} mode is disabled, e.g. when output is redirected under {@link Ansi#AUTO}.
 */
public class ConsoleTerminal implements Terminal {

    private final PrintStream out;
    private final PrintStream err;
    private final Ansi ansi;

    public ConsoleTerminal() {
        this(System.out, System.err, Ansi.AUTO);
    }

    public ConsoleTerminal(PrintStream out, PrintStream err, Ansi ansi) {
        this.out = out;
        this.err = err;
        this.ansi = ansi;
    }

    @Override
    public synchronized void writeLine(String line) {
        out.println(line);
    }

    @Override
    public synchronized void writeSuccessLine(String line) {
        out.println(styled(line, Ansi.Style.fg_green));
    }

    @Override
    public synchronized void writeWarningLine(String line) {
        err.println(styled(line, Ansi.Style.fg_yellow));
    }

    @Override
    public synchronized void writeErrorLine(String line) {
        err.println(styled(line, Ansi.Style.fg_red));
    }

    // Style codes are applied directly so task output containing "@|" is never read as markup.
    private String styled(String line, Ansi.Style style) {
        if (!ansi.enabled()) {
            return line;
        }
        return style.on() + line + style.off();
    }
}
