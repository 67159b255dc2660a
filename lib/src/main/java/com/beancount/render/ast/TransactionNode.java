package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class TransactionNode extends DatedDirectiveNode {
    private final Flag flag;
    private final String payee;
    private final String narration;
    private final List<String> tags;
    private final List<String> links;
    private final List<PostingNode> postings;

    public TransactionNode(
            SourceLocation location,
            LocalDate date,
            Flag flag,
            String payee,
            String narration,
            List<String> tags,
            List<String> links,
            List<PostingNode> postings,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.flag = Objects.requireNonNull(flag, "flag");
        this.payee = payee;
        this.narration = Objects.requireNonNull(narration, "narration");
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.links = links == null ? List.of() : List.copyOf(links);
        this.postings = postings == null ? List.of() : List.copyOf(postings);
    }

    public Flag getFlag() {
        return flag;
    }

    /** Payee, or {@code null} when the transaction only has a narration. */
    public String getPayee() {
        return payee;
    }

    public String getNarration() {
        return narration;
    }

    /** Tags without the leading {@code #}, in the order they were written. */
    public List<String> getTags() {
        return tags;
    }

    /** Links without the leading {@code ^}, in the order they were written. */
    public List<String> getLinks() {
        return links;
    }

    public List<PostingNode> getPostings() {
        return postings;
    }

    @Override
    public String getDirectiveType() {
        return "txn";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitTransaction(this);
    }
}
