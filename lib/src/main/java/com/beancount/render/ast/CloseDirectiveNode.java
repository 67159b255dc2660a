package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class CloseDirectiveNode extends DatedDirectiveNode {

    private final Account account;

    public CloseDirectiveNode(
            SourceLocation location, LocalDate date, Account account, Map<String, String> metadata) {
        super(location, date, metadata);
        this.account = Objects.requireNonNull(account, "account");
    }

    public Account getAccount() {
        return account;
    }

    @Override
    public String getDirectiveType() {
        return "close";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitClose(this);
    }
}
