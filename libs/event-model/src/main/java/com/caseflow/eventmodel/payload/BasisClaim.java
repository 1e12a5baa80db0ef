package com.caseflow.eventmodel.payload;

import java.time.LocalDate;
import java.util.List;

/**
 * The contractor's claim that a change has occurred.
 *
 * <p>Category codes are opaque strings; they are stored and shown, never interpreted.
 *
 * @param category main category code
 * @param subcategory subcategory code, nullable
 * @param description free-text description of the change
 * @param discoveredOn when the contractor became aware of the change, nullable
 * @param contractReferences referenced contract clauses
 */
public record BasisClaim(
        String category,
        String subcategory,
        String description,
        LocalDate discoveredOn,
        List<String> contractReferences)
        implements EventPayload {

    public BasisClaim {
        contractReferences = contractReferences == null ? List.of() : List.copyOf(contractReferences);
    }
}
