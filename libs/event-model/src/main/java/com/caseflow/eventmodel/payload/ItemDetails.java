package com.caseflow.eventmodel.payload;

import java.time.LocalDate;

/**
 * One item (machine) an exemption is requested for. An update replaces the whole record.
 *
 * @param itemId identifier unique within the application
 * @param category item category code
 * @param description free-text description
 * @param startDate first day of use
 * @param endDate last day of use
 * @param justification why a compliant alternative cannot be used
 */
public record ItemDetails(
        String itemId,
        String category,
        String description,
        LocalDate startDate,
        LocalDate endDate,
        String justification)
        implements EventPayload {}
