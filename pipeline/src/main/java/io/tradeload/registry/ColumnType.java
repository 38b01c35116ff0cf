package io.tradeload.registry;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/** Physical column types of the target store, with the Java type each one is coerced to. */
public enum ColumnType {
    STRING(String.class),
    INT32(Integer.class),
    INT64(Long.class),
    DECIMAL(BigDecimal.class),
    TIMESTAMP(OffsetDateTime.class);

    private final Class<?> javaType;

    ColumnType(Class<?> javaType) { this.javaType = javaType; }

    public Class<?> javaType() { return javaType; }

    public boolean isIntegral() { return this == INT32 || this == INT64; }
}
