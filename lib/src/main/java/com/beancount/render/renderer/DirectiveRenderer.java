package com.beancount.render.renderer;

import com.beancount.render.ast.BalanceDirectiveNode;
import com.beancount.render.ast.CloseDirectiveNode;
import com.beancount.render.ast.CommodityDirectiveNode;
import com.beancount.render.ast.CustomDirectiveNode;
import com.beancount.render.ast.DatedDirectiveNode;
import com.beancount.render.ast.DirectiveVisitor;
import com.beancount.render.ast.DocumentDirectiveNode;
import com.beancount.render.ast.EventDirectiveNode;
import com.beancount.render.ast.IncludeDirectiveNode;
import com.beancount.render.ast.NoteDirectiveNode;
import com.beancount.render.ast.OpenDirectiveNode;
import com.beancount.render.ast.OptionDirectiveNode;
import com.beancount.render.ast.PadDirectiveNode;
import com.beancount.render.ast.PluginDirectiveNode;
import com.beancount.render.ast.PostingNode;
import com.beancount.render.ast.PriceDirectiveNode;
import com.beancount.render.ast.QueryDirectiveNode;
import com.beancount.render.ast.TransactionNode;
import com.beancount.render.ast.UnsupportedDirectiveNode;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes one directive per visit. An instance is bound to a single sink and lives for one render
 * call.
 */
final class DirectiveRenderer implements DirectiveVisitor<Void, RenderException> {
    private static final Logger LOGGER = Logger.getLogger(DirectiveRenderer.class.getName());

    private final RenderSink sink;

    DirectiveRenderer(RenderSink sink) {
        this.sink = sink;
    }

    @Override
    public Void visitOpen(OpenDirectiveNode open) throws RenderException {
        header(open);
        ComponentRenderer.account(sink, open.getAccount());
        for (String currency : open.getCurrencies()) {
            sink.write(' ').write(currency);
        }
        String booking = open.getBooking().getKeyword();
        if (booking != null) {
            sink.write(' ').quoted(booking);
        }
        return finish(open);
    }

    @Override
    public Void visitClose(CloseDirectiveNode close) throws RenderException {
        header(close);
        ComponentRenderer.account(sink, close.getAccount());
        return finish(close);
    }

    @Override
    public Void visitBalance(BalanceDirectiveNode balance) throws RenderException {
        header(balance);
        ComponentRenderer.account(sink, balance.getAccount());
        sink.write('\t');
        ComponentRenderer.amount(sink, balance.getAmount());
        if (balance.getTolerance() != null) {
            sink.write(" ~ ").write(ComponentRenderer.number(balance.getTolerance()));
        }
        return finish(balance);
    }

    @Override
    public Void visitOption(OptionDirectiveNode option) throws RenderException {
        sink.write("option ").quoted(option.getName()).write(' ').quoted(option.getValue()).newline();
        return null;
    }

    @Override
    public Void visitCommodity(CommodityDirectiveNode commodity) throws RenderException {
        header(commodity);
        sink.write(commodity.getName());
        return finish(commodity);
    }

    @Override
    public Void visitCustom(CustomDirectiveNode custom) throws RenderException {
        header(custom);
        sink.quoted(custom.getName());
        if (!custom.getArgs().isEmpty()) {
            sink.write(' ').write(String.join(" ", custom.getArgs()));
        }
        return finish(custom);
    }

    @Override
    public Void visitDocument(DocumentDirectiveNode document) throws RenderException {
        header(document);
        ComponentRenderer.account(sink, document.getAccount());
        sink.write(' ').quoted(document.getPath());
        ComponentRenderer.tagsAndLinks(sink, document.getTags(), document.getLinks());
        return finish(document);
    }

    @Override
    public Void visitEvent(EventDirectiveNode event) throws RenderException {
        header(event);
        sink.quoted(event.getName()).write(' ').quoted(event.getDescription());
        return finish(event);
    }

    @Override
    public Void visitInclude(IncludeDirectiveNode include) throws RenderException {
        sink.write("include ").write(include.getFilename()).newline();
        return null;
    }

    @Override
    public Void visitNote(NoteDirectiveNode note) throws RenderException {
        header(note);
        ComponentRenderer.account(sink, note.getAccount());
        sink.write(' ').quoted(note.getComment());
        return finish(note);
    }

    @Override
    public Void visitPad(PadDirectiveNode pad) throws RenderException {
        header(pad);
        ComponentRenderer.account(sink, pad.getPadToAccount());
        sink.write(' ');
        ComponentRenderer.account(sink, pad.getPadFromAccount());
        return finish(pad);
    }

    @Override
    public Void visitPlugin(PluginDirectiveNode plugin) throws RenderException {
        sink.write("plugin ").quoted(plugin.getModule());
        if (plugin.getConfig() != null) {
            sink.write(' ').quoted(plugin.getConfig());
        }
        sink.newline();
        return null;
    }

    @Override
    public Void visitPrice(PriceDirectiveNode price) throws RenderException {
        header(price);
        sink.write(price.getCurrency()).write(' ');
        ComponentRenderer.amount(sink, price.getAmount());
        return finish(price);
    }

    @Override
    public Void visitQuery(QueryDirectiveNode query) throws RenderException {
        header(query);
        sink.quoted(query.getName()).write(' ').quoted(query.getQueryString());
        return finish(query);
    }

    @Override
    public Void visitTransaction(TransactionNode transaction) throws RenderException {
        sink.write(transaction.getDate().toString()).write(' ');
        ComponentRenderer.flag(sink, transaction.getFlag());
        if (transaction.getPayee() != null) {
            sink.write(' ').quoted(transaction.getPayee());
        }
        sink.write(' ').quoted(transaction.getNarration());
        ComponentRenderer.tagsAndLinks(sink, transaction.getTags(), transaction.getLinks());
        sink.newline();
        for (PostingNode posting : transaction.getPostings()) {
            visitPosting(posting);
        }
        ComponentRenderer.metadata(sink, transaction.getMetadata());
        return null;
    }

    @Override
    public Void visitUnsupported(UnsupportedDirectiveNode unsupported) throws RenderException {
        RenderException failure = RenderException.unsupported(unsupported);
        LOGGER.log(Level.WARNING, "[Beancount Render] {0}", failure.getMessage());
        throw failure;
    }

    /** Posting line followed by the posting's own metadata block. */
    void visitPosting(PostingNode posting) throws RenderException {
        sink.write('\t');
        if (posting.getFlag() != null) {
            ComponentRenderer.flag(sink, posting.getFlag());
            sink.write(' ');
        }
        ComponentRenderer.account(sink, posting.getAccount());
        if (!posting.getUnits().isEmpty()) {
            sink.write('\t');
            ComponentRenderer.incompleteAmount(sink, posting.getUnits());
        }
        if (posting.getPrice() != null) {
            sink.write(" @ ");
            ComponentRenderer.amount(sink, posting.getPrice());
        }
        if (posting.getCost() != null) {
            sink.write(' ');
            ComponentRenderer.costSpec(sink, posting.getCost());
        }
        sink.newline();
        ComponentRenderer.metadata(sink, posting.getMetadata());
    }

    private void header(DatedDirectiveNode directive) throws RenderException {
        sink.write(directive.getDate().toString())
                .write(' ')
                .write(directive.getDirectiveType())
                .write(' ');
    }

    private Void finish(DatedDirectiveNode directive) throws RenderException {
        sink.newline();
        ComponentRenderer.metadata(sink, directive.getMetadata());
        return null;
    }
}
