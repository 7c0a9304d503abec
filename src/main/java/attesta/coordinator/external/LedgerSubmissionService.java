package attesta.coordinator.external;

import java.math.BigDecimal;

/**
 * Pays for compute and records attested result hashes on a ledger.
 * Implementations throw any runtime exception on failure; callers wrap it.
 */
public interface LedgerSubmissionService {

    PaymentReceipt pay(BigDecimal amount, String recipient);

    /**
     * @return transaction reference of the recorded hash
     */
    String record(String resultHash, String jobId);
}
