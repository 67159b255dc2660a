package com.beancount.render.ast;

import java.util.Objects;

/** An include statement. The file is never resolved here; only its name is kept. */
public final class IncludeDirectiveNode extends DirectiveNode {

    private final String filename;

    public IncludeDirectiveNode(SourceLocation location, String filename) {
        super(location);
        this.filename = Objects.requireNonNull(filename, "filename");
    }

    public String getFilename() {
        return filename;
    }

    @Override
    public String getDirectiveType() {
        return "include";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitInclude(this);
    }
}
