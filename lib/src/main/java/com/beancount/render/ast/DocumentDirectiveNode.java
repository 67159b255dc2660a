package com.beancount.render.ast;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class DocumentDirectiveNode extends DatedDirectiveNode {

    private final Account account;
    private final String path;
    private final List<String> tags;
    private final List<String> links;

    public DocumentDirectiveNode(
            SourceLocation location,
            LocalDate date,
            Account account,
            String path,
            Map<String, String> metadata) {
        this(location, date, account, path, List.of(), List.of(), metadata);
    }

    public DocumentDirectiveNode(
            SourceLocation location,
            LocalDate date,
            Account account,
            String path,
            List<String> tags,
            List<String> links,
            Map<String, String> metadata) {
        super(location, date, metadata);
        this.account = Objects.requireNonNull(account, "account");
        this.path = Objects.requireNonNull(path, "path");
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.links = links == null ? List.of() : List.copyOf(links);
    }

    public Account getAccount() {
        return account;
    }

    public String getPath() {
        return path;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getLinks() {
        return links;
    }

    @Override
    public String getDirectiveType() {
        return "document";
    }

    @Override
    public <R, X extends Exception> R accept(DirectiveVisitor<R, X> visitor) throws X {
        return visitor.visitDocument(this);
    }
}
