package com.foliogate.processing;

import java.math.BigDecimal;

/**
 * What a gated operation consumed: model, token counts and estimated cost in USD.
 */
public record CostReport(String model, int tokensIn, int tokensOut, BigDecimal costEstimate) {

    private static final CostReport NONE = new CostReport(null, 0, 0, BigDecimal.ZERO);

    public CostReport {
        if (costEstimate == null) {
            costEstimate = BigDecimal.ZERO;
        }
    }

    public static CostReport none() {
        return NONE;
    }
}
