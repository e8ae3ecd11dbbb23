package com.foliogate.shared.exception;

import com.foliogate.processing.CostReport;
import com.foliogate.shared.model.FailureKind;

/**
 * A gated operation failed. Carries the failure kind and whatever cost the
 * operation incurred before failing, so the ledger can account for it.
 */
public class OperationFailedException extends RuntimeException {

    private final FailureKind kind;
    private final CostReport partialCost;

    public OperationFailedException(FailureKind kind, String message, Throwable cause) {
        this(kind, message, cause, CostReport.none());
    }

    public OperationFailedException(FailureKind kind, String message, Throwable cause, CostReport partialCost) {
        super(message, cause);
        this.kind = kind;
        this.partialCost = partialCost != null ? partialCost : CostReport.none();
    }

    public FailureKind getKind() {
        return kind;
    }

    public CostReport getPartialCost() {
        return partialCost;
    }
}
