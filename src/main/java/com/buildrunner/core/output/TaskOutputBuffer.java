package com.buildrunner.core.output;

import com.buildrunner.core.model.TaskWriter;

/**
 * Captures one task's output while it runs. Once {@link #close()} is called the buffer belongs
 * to the collator and further writes are rejected.
 */
public class TaskOutputBuffer implements TaskWriter {

    private final String taskName;
    private final StringBuilder standard = new StringBuilder();
    private final StringBuilder error = new StringBuilder();
    private boolean closed = false;

    public TaskOutputBuffer(String taskName) {
        this.taskName = taskName;
    }

    @Override
    public String taskName() {
        return taskName;
    }

    @Override
    public synchronized void write(String text) {
        ensureOpen();
        standard.append(text);
    }

    @Override
    public synchronized void writeError(String text) {
        ensureOpen();
        error.append(text);
    }

    /**
     * Record a fault raised by the runner on the task's behalf. Allowed after close.
     */
    public synchronized void appendFault(String message) {
        if (error.length() > 0 && error.charAt(error.length() - 1) != '\n') {
            error.append(System.lineSeparator());
        }
        error.append(message).append(System.lineSeparator());
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized String standardText() {
        return standard.toString();
    }

    public synchronized String errorText() {
        return error.toString();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Output for task '" + taskName + "' has already been collected");
        }
    }
}
