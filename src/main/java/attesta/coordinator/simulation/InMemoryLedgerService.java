package attesta.coordinator.simulation;

import attesta.coordinator.external.LedgerSubmissionService;
import attesta.coordinator.external.PaymentReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ledger that keeps payments and recorded hashes in memory.
 */
public final class InMemoryLedgerService implements LedgerSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerService.class);

    private final List<PaymentReceipt> payments = new CopyOnWriteArrayList<>();
    private final Map<String, String> recordedHashes = new ConcurrentHashMap<>();
    private final AtomicInteger txSeq = new AtomicInteger(1);

    private volatile boolean unavailable = false;

    /** Make every following call fail, as if the ledger node were down */
    public InMemoryLedgerService unavailable(boolean unavailable) {
        this.unavailable = unavailable;
        return this;
    }

    @Override
    public PaymentReceipt pay(BigDecimal amount, String recipient) {
        checkAvailable();
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("negative payment: " + amount);
        }
        PaymentReceipt receipt = new PaymentReceipt(nextTx(), recipient, amount);
        payments.add(receipt);
        log.debug("Ledger payment {} -> {}: {}", receipt.transactionReference(), recipient, amount);
        return receipt;
    }

    @Override
    public String record(String resultHash, String jobId) {
        checkAvailable();
        String tx = nextTx();
        recordedHashes.put(jobId, resultHash);
        log.debug("Ledger recorded {} for {} in {}", resultHash, jobId, tx);
        return tx;
    }

    public List<PaymentReceipt> payments() {
        return List.copyOf(payments);
    }

    public String recordedHash(String jobId) {
        return recordedHashes.get(jobId);
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new IllegalStateException("ledger unavailable");
        }
    }

    private String nextTx() {
        return String.format("0x%08x", txSeq.getAndIncrement());
    }
}
