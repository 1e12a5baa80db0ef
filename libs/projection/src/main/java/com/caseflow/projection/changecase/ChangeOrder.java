package com.caseflow.projection.changecase;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The change order that closed a case.
 *
 * @param orderNumber change order number
 * @param agreedAmount agreed compensation, nullable
 * @param agreedDays agreed extension, nullable
 * @param issuedAt when it was issued
 * @param issuedBy who issued it
 */
public record ChangeOrder(
        String orderNumber, BigDecimal agreedAmount, Integer agreedDays, Instant issuedAt, String issuedBy) {}
