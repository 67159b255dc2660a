package com.beancount.render.renderer;

import com.beancount.render.ast.DirectiveNode;
import java.io.IOException;

/**
 * Checked exception signalling that a ledger could not be rendered. Either the sink refused a
 * write or the ledger holds a directive that has no textual form.
 */
public final class RenderException extends Exception {

    public enum Kind {
        IO,
        UNSUPPORTED
    }

    private final Kind kind;

    private RenderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    static RenderException io(IOException cause) {
        return new RenderException(Kind.IO, "Failed to write ledger output: " + cause.getMessage(), cause);
    }

    static RenderException unsupported(DirectiveNode directive) {
        String message = "Cannot render unsupported directive '" + directive.getDirectiveType() + "'";
        if (directive.getLocation() != null) {
            message = message + " (" + directive.getLocation() + ")";
        }
        return new RenderException(Kind.UNSUPPORTED, message, null);
    }

    public Kind getKind() {
        return kind;
    }
}
