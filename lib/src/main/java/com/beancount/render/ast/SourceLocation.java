package com.beancount.render.ast;

import java.util.Objects;

/** Where a directive came from in the parsed ledger. Only used to make error messages useful. */
public final class SourceLocation {
    private final String sourceName;
    private final int line;
    private final int column;

    public SourceLocation(String sourceName, int line, int column) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.line = line;
        this.column = column;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        if (line <= 0) {
            return sourceName;
        }
        return sourceName + ":" + line + ":" + column;
    }
}
