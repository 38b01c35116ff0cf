package io.tradeload.trading;

import java.util.Arrays;

/** Open/close flag of a trade, as ASCII codes '0' to '6'. */
public enum OffsetFlag {
    OPEN(48),
    CLOSE(49),
    FORCE_CLOSE(50),
    CLOSE_TODAY(51),
    CLOSE_YESTERDAY(52),
    FORCE_OFF(53),
    LOCAL_FORCE_CLOSE(54);

    private final int code;

    OffsetFlag(int code) { this.code = code; }

    public int code() { return code; }

    public static long[] codes() { return Arrays.stream(values()).mapToLong(OffsetFlag::code).toArray(); }
}
