package com.buildrunner.core.output;

/**
 * Line-oriented sink for everything the runner shows the user. Implementations must tolerate
 * calls from any thread; the collator serialises its own writes.
 */
public interface Terminal {

    void writeLine(String line);

    void writeWarningLine(String line);

    void writeErrorLine(String line);

    /** A line announcing success. Plain output unless the terminal can highlight it. */
    default void writeSuccessLine(String line) {
        writeLine(line);
    }
}
