package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class OpenDirectiveNode extends DatedDirectiveNode {

    private final Account account;
    private final List<String> currencies;
    private final Booking booking;

    public OpenDirectiveNode(
            SourceLocation location,
            LocalDate date,
            Account account,
            List<String> currencies,
            Booking booking,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.account = Objects.requireNonNull(account, "account");
        this.currencies = currencies == null ? List.of() : List.copyOf(currencies);
        this.booking = booking == null ? Booking.NONE : booking;
    }

    public Account getAccount() {
        return account;
    }

    public List<String> getCurrencies() {
        return currencies;
    }

    public Booking getBooking() {
        return booking;
    }

    @Override
    public String getDirectiveType() {
        return "open";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitOpen(this);
    }
}
