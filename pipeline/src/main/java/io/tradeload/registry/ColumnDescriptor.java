package io.tradeload.registry;

import io.tradeload.error.InvalidDescriptorException;

import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of one physical column: its type, nullability and validation attributes.
 * Instances are built and checked once at startup; a bad combination fails with
 * {@link InvalidDescriptorException}.
 */
public final class ColumnDescriptor {
    private final String name;
    private final ColumnType type;
    private final boolean nullable;
    private final int precision;
    private final int scale;
    private final String format;
    private final DateTimeFormatter formatter;
    private final ValueKind kind;
    private final Set<Long> allowedValues;
    private final int maxLength;

    private ColumnDescriptor(Builder b) {
        this.name = b.name;
        this.type = b.type;
        this.nullable = b.nullable;
        this.precision = b.precision;
        this.scale = b.scale;
        this.format = b.format;
        this.formatter = b.formatter;
        this.kind = b.kind;
        this.allowedValues = Set.copyOf(b.allowedValues);
        this.maxLength = b.maxLength;
    }

    public String name() { return name; }
    public ColumnType type() { return type; }
    public boolean nullable() { return nullable; }
    public int precision() { return precision; }
    public int scale() { return scale; }
    public String format() { return format; }
    public DateTimeFormatter formatter() { return formatter; }
    public ValueKind kind() { return kind; }
    public Set<Long> allowedValues() { return allowedValues; }
    /** Zero means unbounded. */
    public int maxLength() { return maxLength; }

    public static Builder string(String name) { return new Builder(name, ColumnType.STRING); }
    public static Builder int32(String name) { return new Builder(name, ColumnType.INT32); }
    public static Builder int64(String name) { return new Builder(name, ColumnType.INT64); }
    public static Builder decimal(String name, int precision, int scale) { return new Builder(name, ColumnType.DECIMAL).precision(precision, scale); }
    public static Builder timestamp(String name, String format) { return new Builder(name, ColumnType.TIMESTAMP).format(format); }

    @Override
    public String toString() {
        return "ColumnDescriptor{" + name + " " + type + (nullable ? " NULL" : " NOT NULL") + ", kind=" + kind + '}';
    }

    public static final class Builder {
        private final String name;
        private final ColumnType type;
        private boolean nullable;
        private int precision = -1;
        private int scale = -1;
        private String format;
        private DateTimeFormatter formatter;
        private ValueKind kind = ValueKind.PLAIN;
        private final Set<Long> allowedValues = new LinkedHashSet<>();
        private int maxLength;

        private Builder(String name, ColumnType type) {
            this.name = name;
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder nullable() { this.nullable = true; return this; }
        public Builder precision(int precision, int scale) { this.precision = precision; this.scale = scale; return this; }
        public Builder format(String format) { this.format = format; return this; }
        public Builder maxLength(int n) { this.maxLength = n; return this; }
        public Builder monetary() { this.kind = ValueKind.MONETARY; return this; }
        public Builder quantity() { this.kind = ValueKind.QUANTITY; return this; }

        public Builder oneOf(long... values) {
            this.kind = ValueKind.ENUMERATED;
            for (long v : values) allowedValues.add(v);
            return this;
        }

        public ColumnDescriptor build() {
            if (name == null || name.isBlank()) throw new InvalidDescriptorException("column name must not be blank");
            switch (type) {
                case DECIMAL -> {
                    if (precision <= 0 || scale < 0 || scale > precision) {
                        throw new InvalidDescriptorException("decimal column '" + name + "' needs precision >= scale >= 0, got (" + precision + "," + scale + ")");
                    }
                }
                case TIMESTAMP -> {
                    if (format == null || format.isBlank()) throw new InvalidDescriptorException("timestamp column '" + name + "' needs a format");
                    try {
                        formatter = DateTimeFormatter.ofPattern(format);
                    } catch (IllegalArgumentException e) {
                        throw new InvalidDescriptorException("timestamp column '" + name + "' has a bad format '" + format + "': " + e.getMessage());
                    }
                }
                default -> { }
            }
            if (kind == ValueKind.MONETARY && type != ColumnType.DECIMAL) {
                throw new InvalidDescriptorException("monetary column '" + name + "' must be DECIMAL");
            }
            if ((kind == ValueKind.QUANTITY || kind == ValueKind.ENUMERATED) && !type.isIntegral()) {
                throw new InvalidDescriptorException(kind.name().toLowerCase() + " column '" + name + "' must be an integer type");
            }
            if (kind == ValueKind.ENUMERATED && allowedValues.isEmpty()) {
                throw new InvalidDescriptorException("enumerated column '" + name + "' has no allowed values");
            }
            if (maxLength < 0 || (maxLength > 0 && type != ColumnType.STRING)) {
                throw new InvalidDescriptorException("maxLength only applies to string columns ('" + name + "')");
            }
            return new ColumnDescriptor(this);
        }
    }
}
