package io.tradeload.registry;

/** Business meaning of a column, driving the type/range validation rules. */
public enum ValueKind {
    PLAIN,
    /** Non-negative decimal amount. */
    MONETARY,
    /** Positive integer count. */
    QUANTITY,
    /** Integer code from a closed value set. */
    ENUMERATED
}
