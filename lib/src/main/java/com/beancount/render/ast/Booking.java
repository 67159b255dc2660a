package com.beancount.render.ast;

import java.util.Locale;

/** Inventory booking method attached to an account when it is opened. */
public enum Booking {
    NONE,
    STRICT,
    AVERAGE,
    FIFO,
    LIFO;

    /** Lower-case keyword written after an open directive, or {@code null} for {@link #NONE}. */
    public String getKeyword() {
        if (this == NONE) {
            return null;
        }
        return name().toLowerCase(Locale.ROOT);
    }
}
