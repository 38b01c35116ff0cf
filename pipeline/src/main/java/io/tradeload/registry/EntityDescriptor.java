package io.tradeload.registry;

import io.tradeload.error.InvalidDescriptorException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry entry for one entity type: target table, conflict key, ordered columns, cross-field
 * rules and an optional parent the entity references through a foreign-key column pair.
 * Immutable once built.
 */
public final class EntityDescriptor {
    private final String name;
    private final String tableName;
    private final String conflictKey;
    private final List<ColumnDescriptor> columns;
    private final Map<String, ColumnDescriptor> byName;
    private final String parentEntity;
    private final String parentKeyColumn;
    private final String referencedKeyColumn;
    private final List<ArithmeticRule> crossFieldRules;

    private EntityDescriptor(Builder b, Map<String, ColumnDescriptor> byName) {
        this.name = b.name;
        this.tableName = b.tableName;
        this.conflictKey = b.conflictKey;
        this.columns = List.copyOf(b.columns);
        this.byName = byName;
        this.parentEntity = b.parentEntity;
        this.parentKeyColumn = b.parentKeyColumn;
        this.referencedKeyColumn = b.referencedKeyColumn;
        this.crossFieldRules = List.copyOf(b.rules);
    }

    public static Builder builder(String name) { return new Builder(name); }

    public String name() { return name; }
    public String tableName() { return tableName; }
    public String conflictKey() { return conflictKey; }
    public List<ColumnDescriptor> columns() { return columns; }
    public Optional<String> parentEntity() { return Optional.ofNullable(parentEntity); }
    /** Foreign-key column on this entity; null when there is no parent. */
    public String parentKeyColumn() { return parentKeyColumn; }
    /** Column of the parent entity that {@link #parentKeyColumn()} points to. */
    public String referencedKeyColumn() { return referencedKeyColumn; }
    public List<ArithmeticRule> crossFieldRules() { return crossFieldRules; }

    public List<String> columnNames() {
        List<String> out = new ArrayList<>(columns.size());
        for (ColumnDescriptor c : columns) out.add(c.name());
        return out;
    }

    public ColumnDescriptor column(String column) {
        ColumnDescriptor c = byName.get(column);
        if (c == null) throw new IllegalArgumentException("entity '" + name + "' has no column '" + column + "'");
        return c;
    }

    public boolean hasColumn(String column) { return byName.containsKey(column); }

    @Override
    public String toString() {
        return "EntityDescriptor{" + name + " -> " + tableName + ", key=" + conflictKey
                + (parentEntity == null ? "" : ", parent=" + parentEntity + "(" + parentKeyColumn + "->" + referencedKeyColumn + ")") + '}';
    }

    public static final class Builder {
        private final String name;
        private String tableName;
        private String conflictKey;
        private final List<ColumnDescriptor> columns = new ArrayList<>();
        private String parentEntity;
        private String parentKeyColumn;
        private String referencedKeyColumn;
        private final List<ArithmeticRule> rules = new ArrayList<>();

        private Builder(String name) { this.name = name; }

        public Builder table(String tableName) { this.tableName = tableName; return this; }
        public Builder conflictKey(String column) { this.conflictKey = column; return this; }
        public Builder column(ColumnDescriptor column) { this.columns.add(column); return this; }
        public Builder column(ColumnDescriptor.Builder column) { return column(column.build()); }
        public Builder rule(ArithmeticRule rule) { this.rules.add(rule); return this; }

        public Builder parent(String parentEntity, String parentKeyColumn, String referencedKeyColumn) {
            this.parentEntity = parentEntity;
            this.parentKeyColumn = parentKeyColumn;
            this.referencedKeyColumn = referencedKeyColumn;
            return this;
        }

        public EntityDescriptor build() {
            if (name == null || name.isBlank()) throw new InvalidDescriptorException("entity name must not be blank");
            if (tableName == null || tableName.isBlank()) throw new InvalidDescriptorException("entity '" + name + "' has no table name");
            if (columns.isEmpty()) throw new InvalidDescriptorException("entity '" + name + "' declares no columns");
            Map<String, ColumnDescriptor> byName = new LinkedHashMap<>();
            for (ColumnDescriptor c : columns) {
                if (byName.put(c.name(), c) != null) {
                    throw new InvalidDescriptorException("entity '" + name + "' declares column '" + c.name() + "' twice");
                }
            }
            ColumnDescriptor key = byName.get(conflictKey);
            if (key == null) throw new InvalidDescriptorException("conflict key '" + conflictKey + "' of '" + name + "' is not a declared column");
            if (key.nullable()) throw new InvalidDescriptorException("conflict key '" + conflictKey + "' of '" + name + "' must not be nullable");
            if (parentEntity != null) {
                if (parentEntity.equals(name)) throw new InvalidDescriptorException("entity '" + name + "' cannot be its own parent");
                if (!byName.containsKey(parentKeyColumn)) {
                    throw new InvalidDescriptorException("foreign-key column '" + parentKeyColumn + "' of '" + name + "' is not a declared column");
                }
                if (referencedKeyColumn == null || referencedKeyColumn.isBlank()) {
                    throw new InvalidDescriptorException("entity '" + name + "' must name the referenced column of '" + parentEntity + "'");
                }
            }
            for (ArithmeticRule r : rules) {
                List<String> used = new ArrayList<>(r.operands());
                used.add(r.target());
                for (String col : used) {
                    ColumnDescriptor c = byName.get(col);
                    if (c == null) throw new InvalidDescriptorException("rule " + r + " of '" + name + "' uses unknown column '" + col + "'");
                    if (c.type() != ColumnType.DECIMAL && !c.type().isIntegral()) {
                        throw new InvalidDescriptorException("rule " + r + " of '" + name + "' uses non-numeric column '" + col + "'");
                    }
                }
            }
            return new EntityDescriptor(this, Map.copyOf(byName));
        }
    }
}
