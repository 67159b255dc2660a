package com.beancount.render.ast;

import java.util.Map;
import java.util.Objects;

public final class PostingNode {
    private final Flag flag;
    private final Account account;
    private final IncompleteAmount units;
    private final Amount price;
    private final CostSpec cost;
    private final Map<String, String> metadata;

    public PostingNode(
            Flag flag,
            Account account,
            IncompleteAmount units,
            Amount price,
            CostSpec cost,
            Map<String, String> metadata) {
        this.flag = flag;
        this.account = Objects.requireNonNull(account, "account");
        this.units = units == null ? IncompleteAmount.empty() : units;
        this.price = price;
        this.cost = cost;
        this.metadata = MetadataMaps.copyOf(metadata);
    }

    /** Posting with units only: no flag, price, cost or metadata. */
    public static PostingNode of(Account account, IncompleteAmount units) {
        return new PostingNode(null, account, units, null, null, Map.of());
    }

    /** Override flag, or {@code null} when the posting inherits the transaction flag. */
    public Flag getFlag() {
        return flag;
    }

    public Account getAccount() {
        return account;
    }

    public IncompleteAmount getUnits() {
        return units;
    }

    public Amount getPrice() {
        return price;
    }

    public CostSpec getCost() {
        return cost;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }
}
