package com.beancount.render.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class Account {
    private final AccountType type;
    private final List<String> parts;

    public Account(AccountType type, List<String> parts) {
        this.type = Objects.requireNonNull(type, "type");
        this.parts = List.copyOf(parts);
    }

    /**
     * Builds an account from its colon-separated text form, e.g. {@code Assets:Bank:Checking}.
     *
     * @throws IllegalArgumentException if the first component is not an account type name
     */
    public static Account parse(String name) {
        Objects.requireNonNull(name, "name");
        String[] components = name.split(":", -1);
        AccountType type = AccountType.fromDisplayName(components[0]);
        return new Account(type, Arrays.asList(components).subList(1, components.length));
    }

    public AccountType getType() {
        return type;
    }

    public List<String> getParts() {
        return parts;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Account other)) {
            return false;
        }
        return type == other.type && parts.equals(other.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, parts);
    }

    @Override
    public String toString() {
        if (parts.isEmpty()) {
            return type.getDisplayName();
        }
        return type.getDisplayName() + ":" + String.join(":", parts);
    }
}
