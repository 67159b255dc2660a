package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class CommodityDirectiveNode extends DatedDirectiveNode {

    private final String name;

    public CommodityDirectiveNode(
            SourceLocation location, LocalDate date, String name, Map<String, String> metadata) {
        super(location, date, metadata);
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public String getDirectiveType() {
        return "commodity";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitCommodity(this);
    }
}
