package com.beancount.render.ast;

import java.util.List;

/** A parsed ledger: its directives in document order. */
public final class LedgerNode {
    private final List<DirectiveNode> directives;

    public LedgerNode(List<DirectiveNode> directives) {
        this.directives = List.copyOf(directives);
    }

    public List<DirectiveNode> getDirectives() {
        return directives;
    }
}
