package attesta.coordinator.service;

import attesta.coordinator.exception.LedgerSubmissionException;
import attesta.coordinator.external.PaymentReceipt;

/**
 * Result of settling an aggregate on the ledger. A failed settlement carries
 * the error instead of throwing it, since the aggregate itself stays valid.
 */
public record SettlementOutcome(
        String groupId,
        String resultHash,
        PaymentReceipt payment,
        String transactionReference,
        LedgerSubmissionException failure) {

    public static SettlementOutcome settled(String groupId, String resultHash, PaymentReceipt payment,
            String transactionReference) {
        return new SettlementOutcome(groupId, resultHash, payment, transactionReference, null);
    }

    public static SettlementOutcome failed(String groupId, String resultHash, PaymentReceipt payment,
            LedgerSubmissionException failure) {
        return new SettlementOutcome(groupId, resultHash, payment, null, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
