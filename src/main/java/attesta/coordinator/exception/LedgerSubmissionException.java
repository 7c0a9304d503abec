package attesta.coordinator.exception;

/**
 * Paying for compute or recording a result hash on the ledger failed.
 * Does not invalidate an aggregate result that was already computed.
 */
public class LedgerSubmissionException extends OrchestrationException {

    public LedgerSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
