package com.beancount.render.ast;

/**
 * One callback per directive variant. Adding a variant to {@link DirectiveNode} adds a method
 * here, so every consumer has to handle it before the build succeeds again.
 *
 * @param <R> result type of a visit
 * @param <X> checked exception a visit may throw
 */
public interface DirectiveVisitor<R, X extends Exception> {

    R visitOpen(OpenDirectiveNode open) throws X;

    R visitClose(CloseDirectiveNode close) throws X;

    R visitBalance(BalanceDirectiveNode balance) throws X;

    R visitOption(OptionDirectiveNode option) throws X;

    R visitCommodity(CommodityDirectiveNode commodity) throws X;

    R visitCustom(CustomDirectiveNode custom) throws X;

    R visitDocument(DocumentDirectiveNode document) throws X;

    R visitEvent(EventDirectiveNode event) throws X;

    R visitInclude(IncludeDirectiveNode include) throws X;

    R visitNote(NoteDirectiveNode note) throws X;

    R visitPad(PadDirectiveNode pad) throws X;

    R visitPlugin(PluginDirectiveNode plugin) throws X;

    R visitPrice(PriceDirectiveNode price) throws X;

    R visitQuery(QueryDirectiveNode query) throws X;

    R visitTransaction(TransactionNode transaction) throws X;

    R visitUnsupported(UnsupportedDirectiveNode unsupported) throws X;
}
