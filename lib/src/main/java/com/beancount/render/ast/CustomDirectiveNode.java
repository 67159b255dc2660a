package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class CustomDirectiveNode extends DatedDirectiveNode {

    private final String name;
    private final List<String> args;

    /**
     * @param args already-formatted value tokens (quoted strings, amounts, accounts), written
     *     verbatim
     */
    public CustomDirectiveNode(
            SourceLocation location,
            LocalDate date,
            String name,
            List<String> args,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.name = Objects.requireNonNull(name, "name");
        this.args = args == null ? List.of() : List.copyOf(args);
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    @Override
    public String getDirectiveType() {
        return "custom";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitCustom(this);
    }
}
