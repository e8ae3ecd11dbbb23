package com.foliogate.processing;

/**
 * Output of a gated operation together with its cost report.
 */
public record OperationResult<T>(T output, CostReport cost) {

    public OperationResult {
        if (cost == null) {
            cost = CostReport.none();
        }
    }
}
