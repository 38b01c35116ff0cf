package io.tradeload.trading;

import java.util.Arrays;

/** Futures position direction. Stock trades use {@link #NA}. Codes are ASCII digits. */
public enum Direction {
    NA(0),
    LONG(48),
    SHORT(49);

    private final int code;

    Direction(int code) { this.code = code; }

    public int code() { return code; }

    public static long[] codes() { return Arrays.stream(values()).mapToLong(Direction::code).toArray(); }
}
