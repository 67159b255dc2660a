package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class PadDirectiveNode extends DatedDirectiveNode {

    private final Account padToAccount;
    private final Account padFromAccount;

    public PadDirectiveNode(
            SourceLocation location,
            LocalDate date,
            Account padToAccount,
            Account padFromAccount,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.padToAccount = Objects.requireNonNull(padToAccount, "padToAccount");
        this.padFromAccount = Objects.requireNonNull(padFromAccount, "padFromAccount");
    }

    public Account getPadToAccount() {
        return padToAccount;
    }

    public Account getPadFromAccount() {
        return padFromAccount;
    }

    @Override
    public String getDirectiveType() {
        return "pad";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitPad(this);
    }
}
