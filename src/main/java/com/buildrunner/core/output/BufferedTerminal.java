package com.buildrunner.core.output;

/**
 * Terminal that keeps every stream in memory. Each line is stored followed by {@code '\n'}.
 */
public class BufferedTerminal implements Terminal {

    private final StringBuilder output = new StringBuilder();
    private final StringBuilder warnings = new StringBuilder();
    private final StringBuilder errors = new StringBuilder();

    @Override
    public synchronized void writeLine(String line) {
        output.append(line).append('\n');
    }

    @Override
    public synchronized void writeWarningLine(String line) {
        warnings.append(line).append('\n');
    }

    @Override
    public synchronized void writeErrorLine(String line) {
        errors.append(line).append('\n');
    }

    public synchronized String getOutput() {
        return output.toString();
    }

    public synchronized String getWarningOutput() {
        return warnings.toString();
    }

    public synchronized String getErrorOutput() {
        return errors.toString();
    }
}
