package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/** Base for directives that start with a date and may carry a metadata block. */
public sealed abstract class DatedDirectiveNode extends DirectiveNode
        permits OpenDirectiveNode,
                CloseDirectiveNode,
                BalanceDirectiveNode,
                CommodityDirectiveNode,
                CustomDirectiveNode,
                DocumentDirectiveNode,
                EventDirectiveNode,
                NoteDirectiveNode,
                PadDirectiveNode,
                PriceDirectiveNode,
                QueryDirectiveNode,
                TransactionNode {

    private final LocalDate date;
    private final Map<String, String> metadata;

    protected DatedDirectiveNode(SourceLocation location, LocalDate date, Map<String, String> metadata) {
        super(location);
        this.date = Objects.requireNonNull(date, "date");
        this.metadata = MetadataMaps.copyOf(metadata);
    }

    public LocalDate getDate() {
        return date;
    }

    /** Metadata in the order it was supplied. */
    public Map<String, String> getMetadata() {
        return metadata;
    }
}
