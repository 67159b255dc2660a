package com.beancount.render.renderer;

import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.Charset;
import java.util.Objects;

/** Wraps the caller's {@link Appendable} and turns write failures into {@link RenderException}. */
final class RenderSink {
    private final Appendable out;
    private final Flushable passThrough;

    RenderSink(Appendable out) {
        this(out, null);
    }

    private RenderSink(Appendable out, Flushable passThrough) {
        this.out = Objects.requireNonNull(out, "out");
        this.passThrough = passThrough;
    }

    /**
     * Encodes into a byte stream. Every write is pushed through to the stream before the next one
     * starts, so a refused write stops rendering at that point.
     */
    static RenderSink forStream(OutputStream stream, Charset charset) {
        OutputStreamWriter writer = new OutputStreamWriter(Objects.requireNonNull(stream, "out"), charset);
        return new RenderSink(writer, writer);
    }

    RenderSink write(CharSequence text) throws RenderException {
        try {
            out.append(text);
            if (passThrough != null) {
                passThrough.flush();
            }
        } catch (IOException ex) {
            throw RenderException.io(ex);
        }
        return this;
    }

    RenderSink write(char c) throws RenderException {
        try {
            out.append(c);
            if (passThrough != null) {
                passThrough.flush();
            }
        } catch (IOException ex) {
            throw RenderException.io(ex);
        }
        return this;
    }

    RenderSink newline() throws RenderException {
        return write('\n');
    }

    /** Writes a double-quoted string, escaping backslashes and embedded quotes. */
    RenderSink quoted(String text) throws RenderException {
        write('"');
        if (text.indexOf('"') < 0 && text.indexOf('\\') < 0) {
            write(text);
        } else {
            StringBuilder escaped = new StringBuilder(text.length() + 8);
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '"' || c == '\\') {
                    escaped.append('\\');
                }
                escaped.append(c);
            }
            write(escaped);
        }
        return write('"');
    }
}
