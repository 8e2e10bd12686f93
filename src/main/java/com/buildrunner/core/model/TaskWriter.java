package com.buildrunner.core.model;

/**
 * Write-only output sink handed to a running task. Text goes to one of two channels:
 * standard output or error output. Chunks are kept in write order per channel.
 */
public interface TaskWriter {

    /** Name of the task that owns this writer. */
    String taskName();

    void write(String text);

    void writeError(String text);

    default void writeLine(String line) {
        write(line + System.lineSeparator());
    }

    default void writeErrorLine(String line) {
        writeError(line + System.lineSeparator());
    }
}
