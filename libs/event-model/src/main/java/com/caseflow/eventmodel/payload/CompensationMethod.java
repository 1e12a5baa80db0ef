package com.caseflow.eventmodel.payload;

/** Settlement method requested for a compensation claim. */
public enum CompensationMethod {
    CONTRACT_UNIT_PRICES,
    ADJUSTED_UNIT_PRICES,
    TIME_AND_MATERIALS,
    FIXED_PRICE
}
