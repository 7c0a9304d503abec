package attesta.coordinator.service;

import attesta.coordinator.model.AggregateResult;
import attesta.coordinator.model.PartitionOutput;
import attesta.coordinator.simulation.InMemoryLedgerService;
import attesta.coordinator.util.Jsons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LedgerSettlementTest {

    private InMemoryLedgerService ledger;
    private LedgerSettlement settlement;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedgerService();
        settlement = new LedgerSettlement(ledger, 0.2);
    }

    private static AggregateResult aggregate(String groupId, int success, int failed) {
        return new AggregateResult(groupId, success, failed, 1500L,
                List.of(new PartitionOutput("part-0000", "job-1", "{\"ok\":true}")),
                Map.of("accuracy", 0.9), success == 0 ? 0.0 : 0.875);
    }

    @Test
    void priceAddsPremiumPerSuccessfulJob() {
        assertEquals(0, new BigDecimal("3.6").compareTo(settlement.price(BigDecimal.ONE, 3)));
        assertEquals(0, BigDecimal.ZERO.compareTo(settlement.price(new BigDecimal("2.5"), 0)));
        assertEquals(8, settlement.price(BigDecimal.ONE, 1).scale());
    }

    @Test
    void settlePaysOnceAndRecordsHash() {
        AggregateResult result = aggregate("grp-1", 3, 1);

        SettlementOutcome outcome = settlement.settle(result, "0xworker", BigDecimal.ONE);

        assertTrue(outcome.succeeded());
        assertEquals(1, ledger.payments().size());
        assertEquals("0xworker", outcome.payment().recipient());
        assertEquals(0, new BigDecimal("3.6").compareTo(outcome.payment().amount()));
        assertEquals(Jsons.sha256(result), outcome.resultHash());
        assertEquals(outcome.resultHash(), ledger.recordedHash("grp-1"));
        assertNotNull(outcome.transactionReference());
    }

    @Test
    void noPaymentWhenNothingSucceeded() {
        SettlementOutcome outcome = settlement.settle(aggregate("grp-2", 0, 4), "0xworker", BigDecimal.ONE);

        assertTrue(outcome.succeeded());
        assertNull(outcome.payment());
        assertTrue(ledger.payments().isEmpty());
        assertNotNull(ledger.recordedHash("grp-2"));
    }

    @Test
    void equalAggregatesHashEqually() {
        assertEquals(Jsons.sha256(aggregate("grp-1", 3, 1)), Jsons.sha256(aggregate("grp-1", 3, 1)));
        assertNotEquals(Jsons.sha256(aggregate("grp-1", 3, 1)), Jsons.sha256(aggregate("grp-1", 2, 2)));
    }

    @Test
    void ledgerOutageIsReportedNotThrown() {
        ledger.unavailable(true);
        AggregateResult result = aggregate("grp-3", 2, 0);

        SettlementOutcome outcome = settlement.settle(result, "0xworker", BigDecimal.ONE);

        assertFalse(outcome.succeeded());
        assertNotNull(outcome.failure());
        assertInstanceOf(IllegalStateException.class, outcome.failure().getCause());
        assertEquals(Jsons.sha256(result), outcome.resultHash());
        assertNull(ledger.recordedHash("grp-3"));
    }

    @Test
    void rejectsNegativePremium() {
        assertThrows(IllegalArgumentException.class, () -> new LedgerSettlement(ledger, -0.1));
    }
}
