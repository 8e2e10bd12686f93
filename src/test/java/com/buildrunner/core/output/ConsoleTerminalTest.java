package com.buildrunner.core.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTerminalTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private ConsoleTerminal terminal(Ansi ansi) {
        return new ConsoleTerminal(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8), ansi);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("plain mode writes text unchanged to the right stream")
    void plainMode() {
        var terminal = terminal(Ansi.OFF);
        terminal.writeLine("output");
        terminal.writeSuccessLine("done");
        terminal.writeWarningLine("careful");
        terminal.writeErrorLine("broken");

        assertEquals("output" + System.lineSeparator() + "done" + System.lineSeparator(), stdout());
        assertTrue(stderr().contains("careful"));
        assertTrue(stderr().contains("broken"));
        assertFalse(stderr().contains("\u001B["));
    }

    @Test
    @DisplayName("ansi mode colors status lines")
    void ansiMode() {
        var terminal = terminal(Ansi.ON);
        terminal.writeErrorLine("broken");
        terminal.writeLine("plain");

        assertTrue(stderr().contains("\u001B["));
        assertTrue(stderr().contains("broken"));
        assertEquals("plain" + System.lineSeparator(), stdout());
    }

    @Test
    @DisplayName("markup in task output is printed literally")
    void markupNotInterpreted() {
        var terminal = terminal(Ansi.ON);
        terminal.writeWarningLine("@|bold oops|@");

        assertTrue(stderr().contains("@|bold oops|@"));
    }
}
