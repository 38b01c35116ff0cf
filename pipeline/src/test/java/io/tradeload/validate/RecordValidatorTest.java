package io.tradeload.validate;

import io.tradeload.TestEntities;
import io.tradeload.core.Batch;
import io.tradeload.error.UnknownEntityException;
import io.tradeload.registry.EntityRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class RecordValidatorTest {
    private final EntityRegistry registry = TestEntities.registry();
    private final RecordValidator validator = new RecordValidator(registry);

    static Map<String, Object> wallet(String id, Object balance, Object reserved, Object total) {
        Map<String, Object> m = new HashMap<>();
        m.put("wallet_id", id);
        m.put("kind", "2");
        m.put("balance", balance);
        m.put("reserved", reserved);
        m.put("total", total);
        m.put("opened_at", "2025-12-22 14:30:00");
        return m;
    }

    static Map<String, Object> payment(String id, String walletId, Object price, Object units, Object amount) {
        Map<String, Object> m = new HashMap<>();
        m.put("payment_id", id);
        m.put("wallet_id", walletId);
        m.put("price", price);
        m.put("units", units);
        m.put("amount", amount);
        m.put("note", null);
        return m;
    }

    @Test
    void valid_batch_passes_unchanged() {
        Batch batch = Batch.of("wallet", List.of(wallet("W1", "100.00", "0.00", "100.00"), wallet("W2", 5, 2.5, "7.50")));
        ValidationOutcome outcome = validator.validate("wallet", batch);
        assertTrue(outcome.valid());
        assertTrue(outcome.errors().isEmpty());
        assertSame(batch, outcome.passedData().orElseThrow());
        assertTrue(outcome.failedRule().isEmpty());
    }

    @Test
    void empty_batch_is_valid() {
        assertTrue(validator.validate("wallet", Batch.empty("wallet")).valid());
    }

    @Test
    void missing_and_blank_values_fail_presence_with_every_offender_reported() {
        Map<String, Object> a = wallet("W1", null, "0", "0");
        Map<String, Object> b = wallet("  ", "1", "0", "1");
        ValidationOutcome outcome = validator.validate("wallet", Batch.of("wallet", List.of(a, b)));
        assertFalse(outcome.valid());
        assertTrue(outcome.passedData().isEmpty());
        assertEquals(RuleClass.PRESENCE, outcome.failedRule().orElseThrow());
        assertEquals(2, outcome.errors().size());
        assertEquals(0, outcome.errors().get(0).rowIndex());
        assertEquals("balance", outcome.errors().get(0).field());
        assertEquals(1, outcome.errors().get(1).rowIndex());
        assertEquals("wallet_id", outcome.errors().get(1).field());
    }

    @Test
    void nullable_column_may_be_missing() {
        Set<String> keys = Set.of("W1");
        ValidationOutcome outcome = validator.validate("payment",
                Batch.of("payment", List.of(payment("P1", "W1", "2.50", "4", "10.00"))), keys);
        assertTrue(outcome.valid(), () -> outcome.errors().toString());
    }

    @Test
    void presence_failures_stop_later_rule_classes() {
        // row 1 also breaks the sum, but presence fails first
        ValidationOutcome outcome = validator.validate("wallet", Batch.of("wallet", List.of(
                wallet("W1", null, "0", "0"),
                wallet("W2", "1", "1", "99"))));
        assertTrue(outcome.errors().stream().allMatch(v -> v.rule() == RuleClass.PRESENCE));
    }

    @Test
    void negative_monetary_amount_is_a_range_violation() {
        ValidationOutcome outcome = validator.validate("wallet", Batch.of("wallet", List.of(wallet("W1", "-1.00", "1.00", "0.00"))));
        assertEquals(RuleClass.TYPE_RANGE, outcome.failedRule().orElseThrow());
        assertEquals("balance", outcome.errors().get(0).field());
        assertTrue(outcome.errors().get(0).message().contains("non-negative"));
    }

    @Test
    void quantity_must_be_a_positive_integer() {
        Set<String> keys = Set.of("W1");
        for (Object units : List.of("0", "-3", "1.5", "many")) {
            ValidationOutcome outcome = validator.validate("payment",
                    Batch.of("payment", List.of(payment("P1", "W1", "1.00", units, "1.00"))), keys);
            assertFalse(outcome.valid(), "units=" + units);
            assertEquals("units", outcome.errors().get(0).field());
            assertEquals(RuleClass.TYPE_RANGE, outcome.errors().get(0).rule());
        }
    }

    @Test
    void enumerated_value_outside_the_set_is_rejected() {
        Map<String, Object> w = wallet("W1", "1", "0", "1");
        w.put("kind", 4);
        ValidationOutcome outcome = validator.validate("wallet", Batch.of("wallet", List.of(w)));
        assertEquals("kind", outcome.errors().get(0).field());
        assertTrue(outcome.errors().get(0).message().contains("not one of"));
    }

    @Test
    void unparseable_values_and_long_strings_are_range_violations() {
        Map<String, Object> w = wallet("W-TOO-LONG-ID", "abc", "0", "0");
        w.put("opened_at", "22/12/2025");
        ValidationOutcome outcome = validator.validate("wallet", Batch.of("wallet", List.of(w)));
        List<String> fields = new ArrayList<>();
        outcome.errors().forEach(v -> fields.add(v.field()));
        assertEquals(List.of("wallet_id", "balance", "opened_at"), fields);
    }

    @Test
    void sum_rule_accepts_discrepancy_equal_to_tolerance() {
        ValidationOutcome outcome = validator.validate("wallet",
                Batch.of("wallet", List.of(wallet("W1", "100.00", "0.00", "100.01"))));
        assertTrue(outcome.valid());
    }

    @Test
    void sum_rule_rejects_discrepancy_above_tolerance() {
        ValidationOutcome outcome = validator.validate("wallet",
                Batch.of("wallet", List.of(wallet("W1", "100.00", "0.00", "100.011"))));
        assertEquals(RuleClass.CROSS_FIELD, outcome.failedRule().orElseThrow());
        FieldViolation v = outcome.errors().get(0);
        assertEquals("total", v.field());
        assertTrue(v.message().contains("balance + reserved"), v.message());
    }

    @Test
    void product_rule_uses_exact_decimal_arithmetic() {
        Set<String> keys = Set.of("W1");
        assertTrue(validator.validate("payment",
                Batch.of("payment", List.of(payment("P1", "W1", 0.1, 3, "0.30"))), keys).valid());
        assertFalse(validator.validate("payment",
                Batch.of("payment", List.of(payment("P1", "W1", "15.50", "1000", "15600.00"))), keys).valid());
    }

    @Test
    void tolerance_is_configurable() {
        RecordValidator strict = new RecordValidator(registry, BigDecimal.ZERO, false);
        assertFalse(strict.validate("wallet", Batch.of("wallet", List.of(wallet("W1", "100.00", "0.00", "100.01")))).valid());
    }

    @Test
    void unknown_parent_key_is_a_referential_violation() {
        ValidationOutcome outcome = validator.validate("payment", Batch.of("payment", List.of(
                payment("P1", "W1", "1.00", "1", "1.00"),
                payment("P2", "W9", "1.00", "1", "1.00"))), Set.of("W1"));
        assertEquals(RuleClass.REFERENTIAL, outcome.failedRule().orElseThrow());
        assertEquals(1, outcome.errors().size());
        assertEquals(1, outcome.errors().get(0).rowIndex());
        assertTrue(outcome.errors().get(0).message().contains("W9"));
    }

    @Test
    void dependent_entity_without_parent_keys_fails_every_reference() {
        ValidationOutcome outcome = validator.validate("payment",
                Batch.of("payment", List.of(payment("P1", "W1", "1.00", "1", "1.00"))));
        assertEquals(RuleClass.REFERENTIAL, outcome.failedRule().orElseThrow());
    }

    @Test
    void parallel_validation_reports_violations_in_row_order() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < 200; i++) rows.add(wallet("W" + i, "1.00", "1.00", i % 7 == 0 ? "9.00" : "2.00"));
        RecordValidator parallel = new RecordValidator(registry, RecordValidator.DEFAULT_TOLERANCE, true);
        ValidationOutcome outcome = parallel.validate("wallet", Batch.of("wallet", rows));
        List<Integer> indexes = new ArrayList<>();
        outcome.errors().forEach(v -> indexes.add(v.rowIndex()));
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 200; i += 7) expected.add(i);
        assertEquals(expected, indexes);
    }

    @Test
    void huge_exponent_decimal_fails_type_range_before_any_arithmetic() {
        ValidationOutcome outcome = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> validator.validate("wallet",
                Batch.of("wallet", List.of(wallet("W1", "1E+300000000", "0", "1E+300000000")))));
        assertFalse(outcome.valid());
        assertEquals(RuleClass.TYPE_RANGE, outcome.failedRule().orElseThrow());
        assertEquals(List.of("balance", "total"), outcome.errors().stream().map(FieldViolation::field).toList());
        assertTrue(outcome.errors().get(0).message().contains("exceeds DECIMAL(12,2)"), outcome.errors().get(0).message());
    }

    @Test
    void decimal_wider_than_its_column_is_rejected_but_extra_fraction_digits_are_allowed() {
        ValidationOutcome tooWide = validator.validate("wallet",
                Batch.of("wallet", List.of(wallet("W1", "12345678901.00", "0", "12345678901.00"))));
        assertEquals(RuleClass.TYPE_RANGE, tooWide.failedRule().orElseThrow());

        assertTrue(validator.validate("wallet",
                Batch.of("wallet", List.of(wallet("W1", "9999999999.994", "0", "9999999999.994")))).valid());
        ValidationOutcome tiny = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> validator.validate("wallet",
                Batch.of("wallet", List.of(wallet("W1", "1E-300000000", "0", "0")))));
        assertEquals(RuleClass.TYPE_RANGE, tiny.failedRule().orElseThrow());
    }

    @Test
    void unknown_entity_is_rejected() {
        assertThrows(UnknownEntityException.class, () -> validator.validate("refund", Batch.empty("refund")));
    }
}
