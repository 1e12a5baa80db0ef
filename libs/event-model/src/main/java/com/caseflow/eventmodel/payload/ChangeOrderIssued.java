package com.caseflow.eventmodel.payload;

import java.math.BigDecimal;

/**
 * The client's formal change order, closing the case.
 *
 * @param orderNumber change order number
 * @param agreedAmount agreed compensation, nullable
 * @param agreedDays agreed extension, nullable
 * @param description free-text description
 */
public record ChangeOrderIssued(
        String orderNumber, BigDecimal agreedAmount, Integer agreedDays, String description)
        implements EventPayload {}
