package com.tessera.search.query;

/**
 * Inclusive range of integers, used for word positions and query term ids.
 */
public record IntRange(int start, int end) {

    public IntRange {
        if (end < start) {
            throw new IllegalArgumentException(String.format("Invalid range %d..=%d", start, end));
        }
    }

    public static IntRange single(int value) {
        return new IntRange(value, value);
    }

    public int length() {
        return end - start + 1;
    }

    public boolean contains(int value) {
        return value >= start && value <= end;
    }

    @Override
    public String toString() {
        return start == end ? String.valueOf(start) : start + "..=" + end;
    }
}
