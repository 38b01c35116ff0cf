package io.tradeload.trading;

import io.tradeload.coerce.TypeCoercer;
import io.tradeload.core.Batch;
import io.tradeload.core.BatchSource;
import io.tradeload.core.CoercedBatch;
import io.tradeload.registry.EntityDescriptor;
import io.tradeload.registry.EntityRegistry;
import io.tradeload.retry.RetryPolicy;
import io.tradeload.runtime.OrchestratorBuilder;
import io.tradeload.runtime.PipelineRunResult;
import io.tradeload.runtime.PipelineStepResult;
import io.tradeload.runtime.StepState;
import io.tradeload.store.JdbcStoreSession;
import io.tradeload.store.StoreSession;
import io.tradeload.store.UpsertEngine;
import io.tradeload.store.UpsertResult;
import io.tradeload.validate.FieldViolation;
import io.tradeload.validate.RecordValidator;
import io.tradeload.validate.RuleClass;
import io.tradeload.validate.ValidationOutcome;
import io.tradeload.store.JdbcStoreSessionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TradingScenariosTest {
    private final EntityRegistry registry = TradingEntities.registry();
    private final RecordValidator validator = new RecordValidator(registry);
    private final TypeCoercer coercer = new TypeCoercer(registry);
    private final UpsertEngine engine = new UpsertEngine();
    private String url;

    @BeforeEach
    void setup() throws Exception {
        url = TradingDb.create();
    }

    static Map<String, Object> account(String id, Object cash, Object frozen, Object market, Object total) {
        Map<String, Object> m = new HashMap<>();
        m.put("account_id", id);
        m.put("account_type", AccountType.SECURITY.code());
        m.put("cash", cash);
        m.put("frozen_cash", frozen);
        m.put("market_value", market);
        m.put("total_asset", total);
        m.put("updated_at", "2025-12-22T14:30:00");
        return m;
    }

    static Map<String, Object> trade(String tradedId, String accountId) {
        Map<String, Object> m = new HashMap<>();
        m.put("account_id", accountId);
        m.put("account_type", AccountType.SECURITY.code());
        m.put("traded_id", tradedId);
        m.put("stock_code", "600000");
        m.put("traded_time", "2025-12-22T10:30:00");
        m.put("traded_price", "15.50");
        m.put("traded_volume", "1000");
        m.put("traded_amount", "15500.00");
        m.put("strategy_name", "momentum");
        m.put("order_remark", null);
        m.put("direction", Direction.NA.code());
        m.put("offset_flag", OffsetFlag.OPEN.code());
        m.put("created_at", "2025-12-22T10:30:00");
        m.put("updated_at", "2025-12-22T10:30:00");
        return m;
    }

    private UpsertResult load(Map<String, Object> accountRow) throws Exception {
        Batch batch = Batch.of(TradingEntities.ACCOUNT, List.of(accountRow));
        ValidationOutcome outcome = validator.validate(TradingEntities.ACCOUNT, batch);
        assertTrue(outcome.valid(), () -> outcome.errors().toString());
        CoercedBatch coerced = coercer.coerce(TradingEntities.ACCOUNT, outcome.passedData().orElseThrow());
        EntityDescriptor d = registry.lookup(TradingEntities.ACCOUNT);
        try (StoreSession session = new JdbcStoreSession(DriverManager.getConnection(url))) {
            return engine.upsert(session, coerced, d.tableName(), d.conflictKey(), d.columnNames());
        }
    }

    @Test
    void newAccountIsValidatedCoercedAndInserted() throws Exception {
        Map<String, Object> row = account("A1", 100, 0, 0, 100);
        CoercedBatch coerced = coercer.coerce(TradingEntities.ACCOUNT, Batch.of(TradingEntities.ACCOUNT, List.of(row)));
        assertEquals(new BigDecimal("100.00"), coerced.rows().get(0).getDecimal("cash"));
        assertEquals(new BigDecimal("0.00"), coerced.rows().get(0).getDecimal("market_value"));

        UpsertResult result = load(row);
        assertTrue(result.success());
        assertEquals(1, result.insertedRows());
        assertEquals(0, result.updatedRows());
        assertEquals(1, TradingDb.count(url, "account"));
    }

    @Test
    void resubmittedAccountIsUpdated() throws Exception {
        load(account("A1", 100, 0, 0, 100));
        UpsertResult result = load(account("A1", 150, 0, 0, 150));
        assertEquals(1, result.updatedRows());
        assertEquals(0, result.insertedRows());
        assertEquals(1, TradingDb.count(url, "account"));
        assertEquals(0, new BigDecimal("150.00").compareTo((BigDecimal) TradingDb.value(url, "SELECT cash FROM account WHERE account_id = 'A1'")));
    }

    @Test
    void transactionForUnloadedAccountNeverReachesUpsert() throws Exception {
        Map<String, List<Map<String, Object>>> input = Map.of(
                TradingEntities.ACCOUNT, List.of(account("A1", 100, 0, 0, 100)),
                TradingEntities.TRANSACTION, List.of(trade("T1", "A2")));
        BatchSource source = entity -> Batch.of(entity.name(), input.get(entity.name()));
        List<StepState> txStates = new ArrayList<>();
        PipelineRunResult run = new OrchestratorBuilder()
                .registry(registry)
                .source(source)
                .sessions(new JdbcStoreSessionFactory(url, null, null, RetryPolicy.never()))
                .listener((entity, from, to) -> { if (entity.equals(TradingEntities.TRANSACTION)) txStates.add(to); })
                .build()
                .runPipeline();

        PipelineStepResult tx = run.step(TradingEntities.TRANSACTION).orElseThrow();
        assertFalse(tx.success());
        assertEquals(RuleClass.REFERENTIAL, tx.violations().get(0).rule());
        assertFalse(txStates.contains(StepState.UPSERTING));
        assertEquals(0, TradingDb.count(url, "trade"));
        assertEquals(1, TradingDb.count(url, "account"));
    }

    @Test
    void totalAssetOffByTwoCentsIsReported() {
        ValidationOutcome outcome = validator.validate(TradingEntities.ACCOUNT, Batch.of(TradingEntities.ACCOUNT, List.of(
                account("A1", "100.00", "0.00", "0.00", "100.00"),
                account("A2", "100.00", "0.00", "0.00", "100.02"))));
        assertFalse(outcome.valid());
        FieldViolation v = outcome.errors().get(0);
        assertEquals(1, v.rowIndex());
        assertEquals("total_asset", v.field());
        assertEquals(RuleClass.CROSS_FIELD, v.rule());
        assertTrue(v.message().contains("discrepancy 0.02"), v.message());
    }

    @Test
    void toleranceBoundaryIsInclusive() {
        assertTrue(validator.validate(TradingEntities.ACCOUNT, Batch.of(TradingEntities.ACCOUNT,
                List.of(account("A1", "100.00", "0.00", "0.00", "100.01")))).valid());
        assertFalse(validator.validate(TradingEntities.ACCOUNT, Batch.of(TradingEntities.ACCOUNT,
                List.of(account("A1", "100.00", "0.00", "0.00", "100.011")))).valid());
    }

    @Test
    void tradeAmountMustMatchPriceTimesVolume() {
        Map<String, Object> bad = trade("T1", "A1");
        bad.put("traded_amount", "15600.00");
        ValidationOutcome outcome = validator.validate(TradingEntities.TRANSACTION,
                Batch.of(TradingEntities.TRANSACTION, List.of(trade("T0", "A1"), bad)), java.util.Set.of("A1"));
        assertEquals(1, outcome.errors().size());
        assertEquals("traded_amount", outcome.errors().get(0).field());
    }

    @Test
    void unknownOffsetFlagIsRejected() {
        Map<String, Object> bad = trade("T1", "A1");
        bad.put("offset_flag", 55);
        ValidationOutcome outcome = validator.validate(TradingEntities.TRANSACTION,
                Batch.of(TradingEntities.TRANSACTION, List.of(bad)), java.util.Set.of("A1"));
        assertEquals(RuleClass.TYPE_RANGE, outcome.errors().get(0).rule());
        assertEquals("offset_flag", outcome.errors().get(0).field());
    }
}
