package io.tradeload.trading;

import java.util.Arrays;

/** Brokerage account categories, by their numeric codes in the source feeds. */
public enum AccountType {
    FUTURE(1),
    SECURITY(2),
    CREDIT(3),
    FUTURE_OPTION(5),
    STOCK_OPTION(6),
    HUGANGTONG(7),
    SHENGANGTONG(11);

    private final int code;

    AccountType(int code) { this.code = code; }

    public int code() { return code; }

    public static AccountType fromCode(int code) {
        return Arrays.stream(values()).filter(t -> t.code == code).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown account type code " + code));
    }

    public static long[] codes() { return Arrays.stream(values()).mapToLong(AccountType::code).toArray(); }
}
