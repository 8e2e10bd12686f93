package com.buildrunner.core.model;

import com.buildrunner.core.exception.InvalidParallelismException;

/**
 * Number of tasks that may execute at the same time.
 *
 * <p>Either a positive slot count or {@link #unbounded()}, written as {@value #MAX_TOKEN}.
 */
public record Parallelism(int slots) {

    public static final String MAX_TOKEN = "max";

    private static final int UNBOUNDED = Integer.MAX_VALUE;

    public Parallelism {
        if (slots < 1) {
            throw new InvalidParallelismException(String.valueOf(slots));
        }
    }

    public static Parallelism of(int slots) {
        return new Parallelism(slots);
    }

    public static Parallelism unbounded() {
        return new Parallelism(UNBOUNDED);
    }

    /**
     * Parse a configured value. Null or blank means one slot per available processor.
     *
     * @throws InvalidParallelismException if the value is neither a positive integer nor "max"
     */
    public static Parallelism parse(String value) {
        if (value == null || value.isBlank()) {
            return of(Runtime.getRuntime().availableProcessors());
        }
        String trimmed = value.trim();
        if (MAX_TOKEN.equalsIgnoreCase(trimmed)) {
            return unbounded();
        }
        if (!trimmed.chars().allMatch(Character::isDigit)) {
            throw new InvalidParallelismException(value);
        }
        try {
            int slots = Integer.parseInt(trimmed);
            if (slots < 1) {
                throw new InvalidParallelismException(value);
            }
            return of(slots);
        } catch (NumberFormatException e) {
            throw new InvalidParallelismException(value, e);
        }
    }

    public boolean isUnbounded() {
        return slots == UNBOUNDED;
    }

    @Override
    public String toString() {
        return isUnbounded() ? MAX_TOKEN : String.valueOf(slots);
    }
}
