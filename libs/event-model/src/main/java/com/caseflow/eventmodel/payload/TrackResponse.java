package com.caseflow.eventmodel.payload;

import java.math.BigDecimal;

/**
 * The client's response to one track.
 *
 * @param result the decision
 * @param justification free-text justification
 * @param approvedAmount approved compensation amount, compensation track only
 * @param approvedDays approved extension in days, deadline track only
 */
public record TrackResponse(
        Decision result, String justification, BigDecimal approvedAmount, Integer approvedDays)
        implements EventPayload {}
