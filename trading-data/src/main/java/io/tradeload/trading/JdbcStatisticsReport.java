package io.tradeload.trading;

import io.tradeload.registry.ColumnDescriptor;
import io.tradeload.registry.EntityDescriptor;
import io.tradeload.registry.EntityRegistry;
import io.tradeload.registry.ValueKind;
import io.tradeload.runtime.PipelineRunResult;
import io.tradeload.runtime.PostLoadHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Post-load summary read straight from the store: per entity the row count and the totals of its
 * monetary and quantity columns, overall and broken down by grouping columns such as
 * {@code account_type}.
 */
public class JdbcStatisticsReport implements PostLoadHook {
    private static final Logger log = LoggerFactory.getLogger(JdbcStatisticsReport.class);

    public static final List<String> DEFAULT_GROUPINGS = List.of("account_type", "offset_flag", "strategy_name");

    private final EntityRegistry registry;
    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final List<String> groupings;

    public JdbcStatisticsReport(EntityRegistry registry, String jdbcUrl, String user, String password) {
        this(registry, jdbcUrl, user, password, DEFAULT_GROUPINGS);
    }

    public JdbcStatisticsReport(EntityRegistry registry, String jdbcUrl, String user, String password, List<String> groupings) {
        this.registry = registry;
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.groupings = List.copyOf(groupings);
    }

    public record Totals(long rows, Map<String, BigDecimal> sums) {
        public BigDecimal sum(String column) { return sums.getOrDefault(column, BigDecimal.ZERO); }
    }

    /** {@code byGroup} maps a grouping column to its values, in ascending order, and their totals. */
    public record EntityStatistics(String entityName, Totals overall, Map<String, Map<String, Totals>> byGroup) {}

    @Override
    public void afterLoad(PipelineRunResult result) throws SQLException {
        for (EntityStatistics stats : collect()) {
            log.info("'{}': {} rows, totals {}", stats.entityName(), stats.overall().rows(), stats.overall().sums());
            stats.byGroup().forEach((column, groups) -> groups.forEach((value, totals) ->
                    log.info("'{}' {}={}: {} rows, totals {}", stats.entityName(), column, value, totals.rows(), totals.sums())));
        }
    }

    public List<EntityStatistics> collect() throws SQLException {
        List<EntityStatistics> out = new ArrayList<>();
        try (Connection c = connect()) {
            for (EntityDescriptor entity : registry.orderedEntities()) {
                List<String> summed = entity.columns().stream()
                        .filter(col -> col.kind() == ValueKind.MONETARY || col.kind() == ValueKind.QUANTITY)
                        .map(ColumnDescriptor::name)
                        .collect(Collectors.toList());
                Totals overall = query(c, entity.tableName(), null, summed).getOrDefault("", new Totals(0, Map.of()));
                Map<String, Map<String, Totals>> byGroup = new LinkedHashMap<>();
                for (String grouping : groupings) {
                    if (entity.hasColumn(grouping)) byGroup.put(grouping, query(c, entity.tableName(), grouping, summed));
                }
                out.add(new EntityStatistics(entity.name(), overall, byGroup));
            }
        }
        return out;
    }

    private static Map<String, Totals> query(Connection c, String table, String groupColumn, List<String> summed) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append(groupColumn == null ? "''" : groupColumn).append(", COUNT(*)");
        for (String column : summed) sql.append(", SUM(").append(column).append(')');
        sql.append(" FROM ").append(table);
        if (groupColumn != null) sql.append(" GROUP BY ").append(groupColumn).append(" ORDER BY ").append(groupColumn);

        Map<String, Totals> out = new LinkedHashMap<>();
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql.toString())) {
            while (rs.next()) {
                Map<String, BigDecimal> sums = new LinkedHashMap<>();
                for (int i = 0; i < summed.size(); i++) {
                    BigDecimal v = rs.getBigDecimal(i + 3);
                    sums.put(summed.get(i), v == null ? BigDecimal.ZERO : v);
                }
                out.put(String.valueOf(rs.getObject(1)), new Totals(rs.getLong(2), sums));
            }
        }
        return out;
    }

    private Connection connect() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
