package com.beancount.render.ast;

/**
 * Stand-in for a statement the ledger model could not classify. Renderers must report it rather
 * than drop it.
 */
public final class UnsupportedDirectiveNode extends DirectiveNode {

    private final String directiveType;

    public UnsupportedDirectiveNode(SourceLocation location, String directiveType) {
        super(location);
        this.directiveType = directiveType == null ? "unknown" : directiveType;
    }

    @Override
    public String getDirectiveType() {
        return directiveType;
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitUnsupported(this);
    }
}
