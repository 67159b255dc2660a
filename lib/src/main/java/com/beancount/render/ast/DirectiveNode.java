package com.beancount.render.ast;

/**
 * A top-level statement of a ledger. The set of variants is closed; consumers dispatch through
 * {@link #accept(DirectiveVisitor)}.
 */
public sealed abstract class DirectiveNode
        permits DatedDirectiveNode,
                OptionDirectiveNode,
                IncludeDirectiveNode,
                PluginDirectiveNode,
                UnsupportedDirectiveNode {

    private final SourceLocation location;

    protected DirectiveNode(SourceLocation location) {
        this.location = location;
    }

    /** Source position of the directive, or {@code null} when the model did not record one. */
    public SourceLocation getLocation() {
        return location;
    }

    /** Keyword of the directive as it appears in ledger text, e.g. {@code open} or {@code txn}. */
    public abstract String getDirectiveType();

    public abstract <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X;
}
