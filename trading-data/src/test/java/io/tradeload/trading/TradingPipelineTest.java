package io.tradeload.trading;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.tradeload.config.EtlConfig;
import io.tradeload.runtime.PipelineOrchestrator;
import io.tradeload.runtime.PipelineRunResult;
import io.tradeload.runtime.PipelineStepResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradingPipelineTest {
    private Path tmp;
    private String url;

    @BeforeEach
    void setup() throws Exception {
        tmp = Files.createTempDirectory("tradeload-e2e");
        url = TradingDb.create();
    }

    @AfterEach
    void cleanup() throws IOException {
        try (var s = Files.walk(tmp)) {
            s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }

    private EtlConfig config() {
        return new EtlConfig(url, null, null, tmp, tmp.resolve("out/failures.jsonl"), new BigDecimal("0.01"), false, 1);
    }

    private PipelineOrchestrator orchestrator() {
        Injector injector = Guice.createInjector(new TradingLoadModule(config()));
        return injector.getInstance(PipelineOrchestrator.class);
    }

    @Test
    void loadsAccountsThenTrades() throws Exception {
        CsvFixtures.validAccounts(tmp);
        CsvFixtures.validTrades(tmp);

        PipelineRunResult result = orchestrator().runPipeline();

        assertTrue(result.success(), result.errorMessage());
        assertEquals(List.of("account", "transaction"), result.steps().stream().map(PipelineStepResult::entityName).toList());
        assertEquals(6, result.totalRowsLoaded());
        assertEquals(3, TradingDb.count(url, "account"));
        assertEquals(3, TradingDb.count(url, "trade"));
        assertEquals(0, new BigDecimal("28.30").compareTo((BigDecimal) TradingDb.value(url,
                "SELECT traded_price FROM trade WHERE traded_id = 'T20251222000002'")));
        assertNull(TradingDb.value(url, "SELECT order_remark FROM trade WHERE traded_id = 'T20251222000002'"));
        OffsetDateTime tradedTime = (OffsetDateTime) TradingDb.value(url,
                "SELECT traded_time FROM trade WHERE traded_id = 'T20251222000001'");
        assertEquals(OffsetDateTime.of(2025, 12, 22, 10, 30, 0, 0, ZoneOffset.UTC).toInstant(), tradedTime.toInstant());
    }

    @Test
    void secondRunIsIdempotent() throws Exception {
        CsvFixtures.validAccounts(tmp);
        CsvFixtures.validTrades(tmp);
        PipelineOrchestrator orchestrator = orchestrator();
        assertTrue(orchestrator.runPipeline().success());
        PipelineRunResult again = orchestrator.runPipeline();
        assertTrue(again.success());
        assertEquals(3, TradingDb.count(url, "account"));
        assertEquals(3, TradingDb.count(url, "trade"));
    }

    @Test
    void invalidTradeFileIsReportedAndNothingOfItIsWritten() throws Exception {
        CsvFixtures.validAccounts(tmp);
        CsvFixtures.write(tmp, TradingEntities.TRANSACTION, CsvFixtures.TRADE_HEADER,
                "1,10000000001,2,T1,600000,2025-12-22T10:30:00,15.50,1000,15500.00,S,,0,48,2025-12-22T10:30:00,2025-12-22T10:30:00",
                "2,99999999999,2,T2,600000,2025-12-22T10:30:00,15.50,1000,15500.00,S,,0,48,2025-12-22T10:30:00,2025-12-22T10:30:00");

        PipelineRunResult result = orchestrator().runPipeline();

        assertFalse(result.success());
        assertTrue(result.step("account").orElseThrow().success());
        assertEquals(3, TradingDb.count(url, "account"));
        assertEquals(0, TradingDb.count(url, "trade"));
        List<String> report = Files.readAllLines(tmp.resolve("out/failures.jsonl"), StandardCharsets.UTF_8);
        assertEquals(1, report.size());
        assertTrue(report.get(0).contains("\"entity\":\"transaction\""));
        assertTrue(report.get(0).contains("REFERENTIAL"));
        assertTrue(report.get(0).contains("99999999999"));
    }

    @Test
    void malformedAccountFileSkipsTrades() throws Exception {
        CsvFixtures.write(tmp, TradingEntities.ACCOUNT, CsvFixtures.ACCOUNT_HEADER,
                "1,A1,4,100.00,0.00,0.00,100.00,2025-12-22T14:30:00");
        CsvFixtures.validTrades(tmp);

        PipelineRunResult result = orchestrator().runPipeline();

        assertFalse(result.success());
        assertEquals(List.of("transaction"), result.skippedEntities());
        assertEquals(0, TradingDb.count(url, "account"));
        assertEquals(0, TradingDb.count(url, "trade"));
    }

    @Test
    void statisticsReportSummarisesLoadedRows() throws Exception {
        CsvFixtures.validAccounts(tmp);
        CsvFixtures.validTrades(tmp);
        assertTrue(orchestrator().runPipeline().success());

        List<JdbcStatisticsReport.EntityStatistics> stats =
                new JdbcStatisticsReport(TradingEntities.registry(), url, null, null).collect();

        JdbcStatisticsReport.EntityStatistics accounts = stats.get(0);
        assertEquals("account", accounts.entityName());
        assertEquals(3, accounts.overall().rows());
        assertEquals(0, new BigDecimal("2280000.00").compareTo(accounts.overall().sum("total_asset")));
        assertEquals(2, accounts.byGroup().get("account_type").get("2").rows());
        assertEquals(0, new BigDecimal("625000.00").compareTo(accounts.byGroup().get("account_type").get("3").sum("total_asset")));

        JdbcStatisticsReport.EntityStatistics trades = stats.get(1);
        assertEquals(3, trades.overall().rows());
        assertEquals(0, new BigDecimal("3500").compareTo(trades.overall().sum("traded_volume")));
        assertEquals(2, trades.byGroup().get("offset_flag").get("48").rows());
        assertFalse(accounts.byGroup().containsKey("offset_flag"));
    }
}
