package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

public final class EventDirectiveNode extends DatedDirectiveNode {

    private final String name;
    private final String description;

    public EventDirectiveNode(
            SourceLocation location,
            LocalDate date,
            String name,
            String description,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String getDirectiveType() {
        return "event";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitEvent(this);
    }
}
