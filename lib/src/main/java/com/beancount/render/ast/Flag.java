package com.beancount.render.ast;

import java.util.Objects;

/** Transaction or posting flag. */
public final class Flag {

    public enum Kind {
        OKAY,
        WARNING,
        OTHER
    }

    public static final Flag OKAY = new Flag(Kind.OKAY, "*");
    public static final Flag WARNING = new Flag(Kind.WARNING, "!");

    private final Kind kind;
    private final String symbol;

    private Flag(Kind kind, String symbol) {
        this.kind = kind;
        this.symbol = symbol;
    }

    /** Any flag other than {@code *} and {@code !}, written exactly as given. */
    public static Flag other(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (OKAY.symbol.equals(symbol)) {
            return OKAY;
        }
        if (WARNING.symbol.equals(symbol)) {
            return WARNING;
        }
        return new Flag(Kind.OTHER, symbol);
    }

    public Kind getKind() {
        return kind;
    }

    public String getSymbol() {
        return symbol;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Flag other)) {
            return false;
        }
        return kind == other.kind && symbol.equals(other.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
