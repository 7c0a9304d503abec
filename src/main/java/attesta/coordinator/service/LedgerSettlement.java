package attesta.coordinator.service;

import attesta.coordinator.exception.LedgerSubmissionException;
import attesta.coordinator.external.LedgerSubmissionService;
import attesta.coordinator.external.PaymentReceipt;
import attesta.coordinator.model.AggregateResult;
import attesta.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pays for a finished group and commits the hash of its aggregate result.
 * Runs only after aggregation; nothing here can change the aggregate.
 */
public class LedgerSettlement {

    private static final Logger log = LoggerFactory.getLogger(LedgerSettlement.class);

    private final LedgerSubmissionService ledger;
    private final BigDecimal premium;

    public LedgerSettlement(LedgerSubmissionService ledger, double premium) {
        if (premium < 0) {
            throw new IllegalArgumentException("premium must not be negative");
        }
        this.ledger = ledger;
        this.premium = BigDecimal.valueOf(premium);
    }

    /**
     * Price for a group: {@code baseFee * (1 + premium)} for each successful job.
     */
    public BigDecimal price(BigDecimal baseFee, int successCount) {
        return baseFee.multiply(BigDecimal.ONE.add(premium))
                .multiply(BigDecimal.valueOf(successCount))
                .setScale(8, RoundingMode.HALF_UP);
    }

    /**
     * Pay {@code recipient} and record the SHA-256 of the canonical aggregate JSON.
     * Nothing is paid when no job succeeded; the hash is recorded regardless.
     */
    public SettlementOutcome settle(AggregateResult aggregate, String recipient, BigDecimal baseFee) {
        String groupId = aggregate.groupId();
        String resultHash = Jsons.sha256(aggregate);

        PaymentReceipt payment = null;
        if (aggregate.successCount() > 0) {
            BigDecimal amount = price(baseFee, aggregate.successCount());
            try {
                payment = ledger.pay(amount, recipient);
                log.info("Paid {} to {} for group {}", amount, recipient, groupId);
            } catch (RuntimeException e) {
                log.error("Payment for group {} failed: {}", groupId, e.getMessage());
                return SettlementOutcome.failed(groupId, resultHash, null,
                        new LedgerSubmissionException("payment for group " + groupId + " failed", e));
            }
        }

        try {
            String tx = ledger.record(resultHash, groupId);
            log.info("Recorded result hash {} for group {} in {}", resultHash, groupId, tx);
            return SettlementOutcome.settled(groupId, resultHash, payment, tx);
        } catch (RuntimeException e) {
            log.error("Recording result of group {} failed: {}", groupId, e.getMessage());
            return SettlementOutcome.failed(groupId, resultHash, payment,
                    new LedgerSubmissionException("recording result of group " + groupId + " failed", e));
        }
    }
}
