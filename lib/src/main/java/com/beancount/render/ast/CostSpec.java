package com.beancount.render.ast;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Lot cost annotation of a posting. Every field is optional; a total number selects the
 * double-brace form.
 */
public final class CostSpec {
    private final BigDecimal numberPer;
    private final BigDecimal numberTotal;
    private final String currency;
    private final LocalDate date;
    private final String label;

    public CostSpec(
            BigDecimal numberPer,
            BigDecimal numberTotal,
            String currency,
            LocalDate date,
            String label) {
        this.numberPer = numberPer;
        this.numberTotal = numberTotal;
        this.currency = currency;
        this.date = date;
        this.label = label;
    }

    public static CostSpec perUnit(BigDecimal number, String currency) {
        return new CostSpec(number, null, currency, null, null);
    }

    public static CostSpec total(BigDecimal number, String currency) {
        return new CostSpec(null, number, currency, null, null);
    }

    public BigDecimal getNumberPer() {
        return numberPer;
    }

    public BigDecimal getNumberTotal() {
        return numberTotal;
    }

    public String getCurrency() {
        return currency;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getLabel() {
        return label;
    }

    public boolean isDoubleBracket() {
        return numberTotal != null;
    }

    /** Number shown inside the braces: the total when given, otherwise the per-unit number. */
    public BigDecimal getDisplayNumber() {
        return numberTotal != null ? numberTotal : numberPer;
    }
}
