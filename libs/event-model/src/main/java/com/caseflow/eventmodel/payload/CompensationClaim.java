package com.caseflow.eventmodel.payload;

import java.math.BigDecimal;

/**
 * The contractor's claim for additional payment.
 *
 * @param amount claimed amount, excluding VAT
 * @param method requested settlement method
 * @param justification free-text justification
 */
public record CompensationClaim(BigDecimal amount, CompensationMethod method, String justification)
        implements EventPayload {}
