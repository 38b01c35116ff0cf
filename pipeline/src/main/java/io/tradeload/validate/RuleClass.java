package io.tradeload.validate;

/** Rule classes in evaluation order. Validation stops at the first class that reports a violation. */
public enum RuleClass {
    PRESENCE,
    TYPE_RANGE,
    CROSS_FIELD,
    REFERENTIAL
}
