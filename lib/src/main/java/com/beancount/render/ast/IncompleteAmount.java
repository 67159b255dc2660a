package com.beancount.render.ast;

import java.math.BigDecimal;

/**
 * Posting units where the number, the currency, or both may be left out for the ledger model to
 * infer.
 */
public final class IncompleteAmount {
    private static final IncompleteAmount EMPTY = new IncompleteAmount(null, null);

    private final BigDecimal number;
    private final String currency;

    public IncompleteAmount(BigDecimal number, String currency) {
        this.number = number;
        this.currency = currency;
    }

    public static IncompleteAmount empty() {
        return EMPTY;
    }

    public static IncompleteAmount of(Amount amount) {
        return new IncompleteAmount(amount.getNumber(), amount.getCurrency());
    }

    public static IncompleteAmount of(String number, String currency) {
        return new IncompleteAmount(number == null ? null : new BigDecimal(number), currency);
    }

    public BigDecimal getNumber() {
        return number;
    }

    public String getCurrency() {
        return currency;
    }

    public boolean isEmpty() {
        return number == null && currency == null;
    }
}
