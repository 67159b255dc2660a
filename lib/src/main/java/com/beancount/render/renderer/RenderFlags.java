package com.beancount.render.renderer;

import com.beancount.render.ast.DirectiveNode;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Runtime switches, read from system properties first and the environment second. */
public final class RenderFlags {
    private static final Logger LOGGER = Logger.getLogger(RenderFlags.class.getName());

    static final String TRACE_PROPERTY = "beancount.render.trace";
    static final String CHARSET_PROPERTY = "beancount.render.charset";
    private static final String TRACE_ENV = "BEANCOUNT_RENDER_TRACE";
    private static final String CHARSET_ENV = "BEANCOUNT_RENDER_CHARSET";

    private RenderFlags() {}

    public static boolean isTraceEnabled() {
        String value = System.getProperty(TRACE_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TRACE_ENV));
    }

    /** Encoding for the byte-stream entry points. Defaults to UTF-8. */
    public static Charset outputCharset() {
        String name = System.getProperty(CHARSET_PROPERTY);
        if (name == null) {
            name = System.getenv(CHARSET_ENV);
        }
        if (name == null || name.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(name.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            LOGGER.log(
                    Level.WARNING,
                    "[Beancount Render] Unknown output charset {0}, falling back to UTF-8",
                    name);
            return StandardCharsets.UTF_8;
        }
    }

    static void traceDirective(DirectiveNode directive) {
        String location = directive.getLocation() == null ? "?" : directive.getLocation().toString();
        System.err.printf(
                Locale.ROOT,
                "[Beancount Render] %-10s @ %s%n",
                directive.getDirectiveType(),
                location);
    }
}
