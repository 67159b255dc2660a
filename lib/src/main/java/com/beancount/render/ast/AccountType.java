package com.beancount.render.ast;

/** The five root account types of a ledger. */
public enum AccountType {
    ASSETS("Assets"),
    LIABILITIES("Liabilities"),
    EQUITY("Equity"),
    INCOME("Income"),
    EXPENSES("Expenses");

    private final String displayName;

    AccountType(String displayName) {
        this.displayName = displayName;
    }

    /** Capitalised name used as the first component of an account name. */
    public String getDisplayName() {
        return displayName;
    }

    public static AccountType fromDisplayName(String name) {
        for (AccountType type : values()) {
            if (type.displayName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown account type: " + name);
    }
}
