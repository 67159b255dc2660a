package com.beancount.render.renderer;

import com.beancount.render.ast.Account;
import com.beancount.render.ast.Amount;
import com.beancount.render.ast.CostSpec;
import com.beancount.render.ast.Flag;
import com.beancount.render.ast.IncompleteAmount;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Emitters for the pieces directives are built from: accounts, amounts, costs, flags, metadata. */
final class ComponentRenderer {

    private ComponentRenderer() {}

    static void account(RenderSink sink, Account account) throws RenderException {
        sink.write(account.getType().getDisplayName());
        for (String part : account.getParts()) {
            sink.write(':').write(part);
        }
    }

    static void amount(RenderSink sink, Amount amount) throws RenderException {
        sink.write(number(amount.getNumber())).write(' ').write(amount.getCurrency());
    }

    /** Writes whichever of number and currency is present; nothing at all when both are missing. */
    static void incompleteAmount(RenderSink sink, IncompleteAmount amount) throws RenderException {
        numberAndCurrency(sink, amount.getNumber(), amount.getCurrency());
    }

    static void flag(RenderSink sink, Flag flag) throws RenderException {
        sink.write(flag.getSymbol());
    }

    static void costSpec(RenderSink sink, CostSpec cost) throws RenderException {
        boolean doubleBracket = cost.isDoubleBracket();
        sink.write(doubleBracket ? "{{" : "{");
        boolean first = true;
        BigDecimal number = cost.getDisplayNumber();
        if (number != null || cost.getCurrency() != null) {
            numberAndCurrency(sink, number, cost.getCurrency());
            first = false;
        }
        if (cost.getDate() != null) {
            if (!first) {
                sink.write(", ");
            }
            sink.write(cost.getDate().toString());
            first = false;
        }
        if (cost.getLabel() != null) {
            if (!first) {
                sink.write(", ");
            }
            sink.quoted(cost.getLabel());
        }
        sink.write(doubleBracket ? "}}" : "}");
    }

    /** One {@code \tkey: value} line per entry, in the mapping's iteration order. */
    static void metadata(RenderSink sink, Map<String, String> metadata) throws RenderException {
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sink.write('\t').write(entry.getKey()).write(": ").write(entry.getValue()).newline();
        }
    }

    /** Space-prefixed {@code #tag} and {@code ^link} tokens. Empty values are skipped. */
    static void tagsAndLinks(RenderSink sink, List<String> tags, List<String> links)
            throws RenderException {
        for (String tag : tags) {
            marker(sink, '#', tag);
        }
        for (String link : links) {
            marker(sink, '^', link);
        }
    }

    /** Exact decimal text. Never uses exponent notation. */
    static String number(BigDecimal number) {
        return number.toPlainString();
    }

    private static void numberAndCurrency(RenderSink sink, BigDecimal number, String currency)
            throws RenderException {
        if (number != null) {
            sink.write(number(number));
            if (currency != null) {
                sink.write(' ');
            }
        }
        if (currency != null) {
            sink.write(currency);
        }
    }

    private static void marker(RenderSink sink, char sigil, String value) throws RenderException {
        String name = !value.isEmpty() && value.charAt(0) == sigil ? value.substring(1) : value;
        if (name.isEmpty()) {
            return;
        }
        sink.write(' ').write(sigil).write(name);
    }
}
