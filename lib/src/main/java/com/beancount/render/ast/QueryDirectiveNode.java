package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class QueryDirectiveNode extends DatedDirectiveNode {

    private final String name;
    private final String queryString;

    public QueryDirectiveNode(
            SourceLocation location,
            LocalDate date,
            String name,
            String queryString,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.name = Objects.requireNonNull(name, "name");
        this.queryString = Objects.requireNonNull(queryString, "queryString");
    }

    public String getName() {
        return name;
    }

    public String getQueryString() {
        return queryString;
    }

    @Override
    public String getDirectiveType() {
        return "query";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitQuery(this);
    }
}
