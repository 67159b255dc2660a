package com.beancount.render.ast;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class BalanceDirectiveNode extends DatedDirectiveNode {

    private final Account account;
    private final Amount amount;
    private final BigDecimal tolerance;

    public BalanceDirectiveNode(
            SourceLocation location,
            LocalDate date,
            Account account,
            Amount amount,
            BigDecimal tolerance,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.account = Objects.requireNonNull(account, "account");
        this.amount = Objects.requireNonNull(amount, "amount");
        this.tolerance = tolerance;
    }

    public Account getAccount() {
        return account;
    }

    public Amount getAmount() {
        return amount;
    }

    /** Explicit tolerance written as {@code ~ n}, or {@code null} to use the inferred one. */
    public BigDecimal getTolerance() {
        return tolerance;
    }

    @Override
    public String getDirectiveType() {
        return "balance";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitBalance(this);
    }
}
