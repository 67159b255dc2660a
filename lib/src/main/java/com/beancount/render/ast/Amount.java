package com.beancount.render.ast;

import java.math.BigDecimal;
import java.util.Objects;

/** A number together with its currency. Both are always present. */
public final class Amount {
    private final BigDecimal number;
    private final String currency;

    public Amount(BigDecimal number, String currency) {
        this.number = Objects.requireNonNull(number, "number");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static Amount of(String number, String currency) {
        return new Amount(new BigDecimal(number), currency);
    }

    public BigDecimal getNumber() {
        return number;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Amount other)) {
            return false;
        }
        return number.equals(other.number) && currency.equals(other.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, currency);
    }

    @Override
    public String toString() {
        return number.toPlainString() + " " + currency;
    }
}
