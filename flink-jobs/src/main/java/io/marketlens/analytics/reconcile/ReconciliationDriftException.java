package io.marketlens.analytics.reconcile;

/**
 * Raised when a reconciliation check is asserted and a metric exceeds its tolerance.
 */
public class ReconciliationDriftException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient ReconciliationResult result;

    public ReconciliationDriftException(ReconciliationResult result) {
        super("Reconciliation drift in " + result.checkName()
                + " [" + result.minDate() + ".." + result.maxDate() + "]: " + result.failures());
        this.result = result;
    }

    public ReconciliationResult result() {
        return result;
    }
}
