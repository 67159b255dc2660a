package com.beancount.render.renderer;

import com.beancount.render.ast.Account;
import com.beancount.render.ast.Amount;
import com.beancount.render.ast.CostSpec;
import com.beancount.render.ast.DirectiveNode;
import com.beancount.render.ast.Flag;
import com.beancount.render.ast.IncompleteAmount;
import com.beancount.render.ast.LedgerNode;
import com.beancount.render.ast.PostingNode;
import java.io.OutputStream;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders a ledger model back to Beancount text.
 *
 * <p>The renderer holds no state, so one instance can be shared between threads. A single sink
 * must not be written by two render calls at the same time. Rendering stops at the first failure;
 * whatever reached the sink before it stays there.
 */
public final class LedgerRenderer {
    private static final Logger LOGGER = Logger.getLogger(LedgerRenderer.class.getName());

    /** Renders every directive in document order, each followed by a blank line. */
    public void render(LedgerNode ledger, Appendable out) throws RenderException {
        renderLedger(ledger, new RenderSink(out));
    }

    private static void renderLedger(LedgerNode ledger, RenderSink sink) throws RenderException {
        Objects.requireNonNull(ledger, "ledger");
        DirectiveRenderer directives = new DirectiveRenderer(sink);
        for (DirectiveNode directive : ledger.getDirectives()) {
            dispatch(directive, directives);
            sink.newline();
        }
        LOGGER.log(Level.FINE, "Rendered {0} directives", ledger.getDirectives().size());
    }

    /**
     * Renders a single directive without a trailing blank line.
     *
     * @throws RenderException of kind {@link RenderException.Kind#UNSUPPORTED} for a directive
     *     the model could not classify
     */
    public void render(DirectiveNode directive, Appendable out) throws RenderException {
        Objects.requireNonNull(directive, "directive");
        dispatch(directive, new DirectiveRenderer(new RenderSink(out)));
    }

    public void render(PostingNode posting, Appendable out) throws RenderException {
        Objects.requireNonNull(posting, "posting");
        new DirectiveRenderer(new RenderSink(out)).visitPosting(posting);
    }

    public void render(Account account, Appendable out) throws RenderException {
        ComponentRenderer.account(new RenderSink(out), Objects.requireNonNull(account, "account"));
    }

    public void render(Amount amount, Appendable out) throws RenderException {
        ComponentRenderer.amount(new RenderSink(out), Objects.requireNonNull(amount, "amount"));
    }

    public void render(IncompleteAmount amount, Appendable out) throws RenderException {
        ComponentRenderer.incompleteAmount(new RenderSink(out), Objects.requireNonNull(amount, "amount"));
    }

    public void render(CostSpec cost, Appendable out) throws RenderException {
        ComponentRenderer.costSpec(new RenderSink(out), Objects.requireNonNull(cost, "cost"));
    }

    public void render(Flag flag, Appendable out) throws RenderException {
        ComponentRenderer.flag(new RenderSink(out), Objects.requireNonNull(flag, "flag"));
    }

    public void renderMetadata(Map<String, String> metadata, Appendable out) throws RenderException {
        ComponentRenderer.metadata(new RenderSink(out), Objects.requireNonNull(metadata, "metadata"));
    }

    /**
     * Byte-stream form of {@link #render(LedgerNode, Appendable)}. Each write reaches the stream
     * before rendering continues. The stream is not closed.
     */
    public void renderLedger(LedgerNode ledger, OutputStream out) throws RenderException {
        renderLedger(ledger, RenderSink.forStream(out, RenderFlags.outputCharset()));
    }

    /** Byte-stream form of {@link #render(DirectiveNode, Appendable)} for a single top-level record. */
    public void renderDocument(DirectiveNode directive, OutputStream out) throws RenderException {
        Objects.requireNonNull(directive, "directive");
        dispatch(directive, new DirectiveRenderer(RenderSink.forStream(out, RenderFlags.outputCharset())));
    }

    public String renderToString(LedgerNode ledger) throws RenderException {
        StringBuilder out = new StringBuilder();
        render(ledger, out);
        return out.toString();
    }

    private static void dispatch(DirectiveNode directive, DirectiveRenderer directives)
            throws RenderException {
        if (RenderFlags.isTraceEnabled()) {
            RenderFlags.traceDirective(directive);
        }
        directive.accept(directives);
    }
}
