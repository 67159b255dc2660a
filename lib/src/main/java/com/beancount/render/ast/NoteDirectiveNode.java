package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class NoteDirectiveNode extends DatedDirectiveNode {

    private final Account account;
    private final String comment;

    public NoteDirectiveNode(
            SourceLocation location,
            LocalDate date,
            Account account,
            String comment,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.account = Objects.requireNonNull(account, "account");
        this.comment = Objects.requireNonNull(comment, "comment");
    }

    public Account getAccount() {
        return account;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public String getDirectiveType() {
        return "note";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitNote(this);
    }
}
