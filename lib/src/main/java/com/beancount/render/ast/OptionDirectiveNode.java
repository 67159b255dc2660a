package com.beancount.render.ast;

import java.util.Objects;

public final class OptionDirectiveNode extends DirectiveNode {

    private final String name;
    private final String value;

    public OptionDirectiveNode(SourceLocation location, String name, String value) {
        super(location);
        this.name = Objects.requireNonNull(name, "name");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getDirectiveType() {
        return "option";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitOption(this);
    }
}
