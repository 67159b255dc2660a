package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class PriceDirectiveNode extends DatedDirectiveNode {

    private final String currency;
    private final Amount amount;

    public PriceDirectiveNode(
            SourceLocation location,
            LocalDate date,
            String currency,
            Amount amount,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.currency = Objects.requireNonNull(currency, "currency");
        this.amount = Objects.requireNonNull(amount, "amount");
    }

    public String getCurrency() {
        return currency;
    }

    public Amount getAmount() {
        return amount;
    }

    @Override
    public String getDirectiveType() {
        return "price";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitPrice(this);
    }
}
