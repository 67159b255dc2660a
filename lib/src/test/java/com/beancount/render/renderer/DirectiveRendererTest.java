package com.beancount.render.renderer;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.beancount.render.ast.Account;
import com.beancount.render.ast.AccountType;
import com.beancount.render.ast.Amount;
import com.beancount.render.ast.BalanceDirectiveNode;
import com.beancount.render.ast.Booking;
import com.beancount.render.ast.CloseDirectiveNode;
import com.beancount.render.ast.CommodityDirectiveNode;
import com.beancount.render.ast.CostSpec;
import com.beancount.render.ast.CustomDirectiveNode;
import com.beancount.render.ast.DirectiveNode;
import com.beancount.render.ast.DocumentDirectiveNode;
import com.beancount.render.ast.EventDirectiveNode;
import com.beancount.render.ast.Flag;
import com.beancount.render.ast.IncludeDirectiveNode;
import com.beancount.render.ast.IncompleteAmount;
import com.beancount.render.ast.NoteDirectiveNode;
import com.beancount.render.ast.OpenDirectiveNode;
import com.beancount.render.ast.OptionDirectiveNode;
import com.beancount.render.ast.PadDirectiveNode;
import com.beancount.render.ast.PluginDirectiveNode;
import com.beancount.render.ast.PostingNode;
import com.beancount.render.ast.PriceDirectiveNode;
import com.beancount.render.ast.QueryDirectiveNode;
import com.beancount.render.ast.TransactionNode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class DirectiveRendererTest {

    private static final LocalDate DATE = LocalDate.of(2023, 1, 1);
    private static final Account CHECKING =
            new Account(AccountType.ASSETS, List.of("Bank", "Checking"));

    private final LedgerRenderer renderer = new LedgerRenderer();

    @Test
    void openWithStrictBooking() throws Exception {
        OpenDirectiveNode open =
                new OpenDirectiveNode(null, DATE, CHECKING, List.of("USD"), Booking.STRICT, Map.of());
        assertEquals("2023-01-01 open Assets:Bank:Checking USD \"strict\"\n", render(open));
    }

    @Test
    void openWithoutBookingHasNoSuffix() throws Exception {
        OpenDirectiveNode open =
                new OpenDirectiveNode(
                        null, DATE, CHECKING, List.of("USD", "EUR"), Booking.NONE, Map.of());
        assertEquals("2023-01-01 open Assets:Bank:Checking USD EUR\n", render(open));
    }

    @Test
    void openWithoutCurrencies() throws Exception {
        OpenDirectiveNode open =
                new OpenDirectiveNode(null, DATE, CHECKING, List.of(), Booking.FIFO, Map.of());
        assertEquals("2023-01-01 open Assets:Bank:Checking \"fifo\"\n", render(open));
    }

    @Test
    void everyBookingRendersOneLowercaseSuffix() throws Exception {
        for (Booking booking : List.of(Booking.STRICT, Booking.AVERAGE, Booking.FIFO, Booking.LIFO)) {
            OpenDirectiveNode open =
                    new OpenDirectiveNode(null, DATE, CHECKING, List.of("USD"), booking, Map.of());
            assertEquals(
                    "2023-01-01 open Assets:Bank:Checking USD \"" + booking.getKeyword() + "\"\n",
                    render(open));
        }
    }

    @Test
    void openWithMetadata() throws Exception {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("institution", "\"First Bank\"");
        metadata.put("opened-by", "alice");
        OpenDirectiveNode open =
                new OpenDirectiveNode(null, DATE, CHECKING, List.of("USD"), Booking.NONE, metadata);
        assertEquals(
                "2023-01-01 open Assets:Bank:Checking USD\n"
                        + "\tinstitution: \"First Bank\"\n"
                        + "\topened-by: alice\n",
                render(open));
    }

    @Test
    void close() throws Exception {
        assertEquals(
                "2023-01-01 close Assets:Bank:Checking\n",
                render(new CloseDirectiveNode(null, DATE, CHECKING, Map.of())));
    }

    @Test
    void balance() throws Exception {
        BalanceDirectiveNode balance =
                new BalanceDirectiveNode(
                        null, LocalDate.of(2023, 2, 1), CHECKING, Amount.of("100.00", "USD"), null, Map.of());
        assertEquals("2023-02-01 balance Assets:Bank:Checking\t100.00 USD\n", render(balance));
    }

    @Test
    void balanceWithTolerance() throws Exception {
        BalanceDirectiveNode balance =
                new BalanceDirectiveNode(
                        null,
                        LocalDate.of(2023, 2, 1),
                        CHECKING,
                        Amount.of("100.00", "USD"),
                        new BigDecimal("0.01"),
                        Map.of());
        assertEquals("2023-02-01 balance Assets:Bank:Checking\t100.00 USD ~ 0.01\n", render(balance));
    }

    @Test
    void option() throws Exception {
        assertEquals(
                "option \"operating_currency\" \"USD\"\n",
                render(new OptionDirectiveNode(null, "operating_currency", "USD")));
    }

    @Test
    void commodity() throws Exception {
        assertEquals(
                "2023-01-01 commodity HOOL\n\tname: \"Hooli Inc.\"\n",
                render(new CommodityDirectiveNode(null, DATE, "HOOL", Map.of("name", "\"Hooli Inc.\""))));
    }

    @Test
    void customJoinsArgsWithSpaces() throws Exception {
        CustomDirectiveNode custom =
                new CustomDirectiveNode(
                        null, DATE, "budget", List.of("Expenses:Food", "\"monthly\"", "400.00 USD"), Map.of());
        assertEquals(
                "2023-01-01 custom \"budget\" Expenses:Food \"monthly\" 400.00 USD\n", render(custom));
    }

    @Test
    void customWithoutArgsHasNoTrailingSpace() throws Exception {
        assertEquals(
                "2023-01-01 custom \"marker\"\n",
                render(new CustomDirectiveNode(null, DATE, "marker", List.of(), Map.of())));
    }

    @Test
    void document() throws Exception {
        assertEquals(
                "2023-01-01 document Assets:Bank:Checking \"statements/2023-01.pdf\"\n",
                render(new DocumentDirectiveNode(null, DATE, CHECKING, "statements/2023-01.pdf", Map.of())));
    }

    @Test
    void documentWithTagsAndLinks() throws Exception {
        DocumentDirectiveNode document =
                new DocumentDirectiveNode(
                        null, DATE, CHECKING, "a.pdf", List.of("tax"), List.of("stmt-1"), Map.of());
        assertEquals(
                "2023-01-01 document Assets:Bank:Checking \"a.pdf\" #tax ^stmt-1\n", render(document));
    }

    @Test
    void emptyTagsAndLinksAreSkipped() throws Exception {
        TransactionNode transaction =
                new TransactionNode(
                        null,
                        DATE,
                        Flag.OKAY,
                        null,
                        "Rent",
                        List.of("", "home", "#"),
                        List.of("^", ""),
                        List.of(),
                        Map.of());
        assertEquals("2023-01-01 * \"Rent\" #home\n", render(transaction));

        DocumentDirectiveNode document =
                new DocumentDirectiveNode(
                        null, DATE, CHECKING, "a.pdf", List.of(""), List.of("", "stmt-1"), Map.of());
        assertEquals(
                "2023-01-01 document Assets:Bank:Checking \"a.pdf\" ^stmt-1\n", render(document));
    }

    @Test
    void event() throws Exception {
        assertEquals(
                "2023-01-01 event \"location\" \"Paris, France\"\n",
                render(new EventDirectiveNode(null, DATE, "location", "Paris, France", Map.of())));
    }

    @Test
    void includeIsUndatedAndUnquoted() throws Exception {
        assertEquals(
                "include accounts/2023.beancount\n",
                render(new IncludeDirectiveNode(null, "accounts/2023.beancount")));
    }

    @Test
    void noteEscapesQuotes() throws Exception {
        assertEquals(
                "2023-01-01 note Assets:Bank:Checking \"Called about \\\"fees\\\"\"\n",
                render(new NoteDirectiveNode(null, DATE, CHECKING, "Called about \"fees\"", Map.of())));
    }

    @Test
    void pad() throws Exception {
        PadDirectiveNode pad =
                new PadDirectiveNode(
                        null, DATE, CHECKING, Account.parse("Equity:Opening-Balances"), Map.of());
        assertEquals(
                "2023-01-01 pad Assets:Bank:Checking Equity:Opening-Balances\n", render(pad));
    }

    @Test
    void pluginWithAndWithoutConfig() throws Exception {
        assertEquals(
                "plugin \"beancount.plugins.auto_accounts\"\n",
                render(new PluginDirectiveNode(null, "beancount.plugins.auto_accounts", null)));
        assertEquals(
                "plugin \"beancount.plugins.check_commodity\" \"strict\"\n",
                render(new PluginDirectiveNode(null, "beancount.plugins.check_commodity", "strict")));
    }

    @Test
    void price() throws Exception {
        assertEquals(
                "2023-01-01 price EUR 1.0832 USD\n",
                render(new PriceDirectiveNode(null, DATE, "EUR", Amount.of("1.0832", "USD"), Map.of())));
    }

    @Test
    void query() throws Exception {
        assertEquals(
                "2023-01-01 query \"cash\" \"SELECT account, sum(position) GROUP BY account\"\n",
                render(
                        new QueryDirectiveNode(
                                null,
                                DATE,
                                "cash",
                                "SELECT account, sum(position) GROUP BY account",
                                Map.of())));
    }

    @Test
    void simpleTransaction() throws Exception {
        TransactionNode transaction =
                new TransactionNode(
                        null,
                        LocalDate.of(2023, 3, 1),
                        Flag.OKAY,
                        null,
                        "Coffee",
                        List.of(),
                        List.of(),
                        List.of(PostingNode.of(Account.parse("Expenses:Food"), IncompleteAmount.of("5.00", "USD"))),
                        Map.of());
        assertEquals("2023-03-01 * \"Coffee\"\n\tExpenses:Food\t5.00 USD\n", render(transaction));
    }

    @Test
    void transactionWithPayeeTagsLinksAndMetadata() throws Exception {
        PostingNode stock =
                new PostingNode(
                        Flag.WARNING,
                        Account.parse("Assets:Broker:HOOL"),
                        IncompleteAmount.of("10", "HOOL"),
                        Amount.of("152.00", "USD"),
                        CostSpec.perUnit(new BigDecimal("150.00"), "USD"),
                        Map.of("lot", "\"a\""));
        PostingNode cash = PostingNode.of(Account.parse("Assets:Broker:Cash"), IncompleteAmount.empty());
        TransactionNode transaction =
                new TransactionNode(
                        null,
                        LocalDate.of(2023, 3, 2),
                        Flag.WARNING,
                        "Broker",
                        "Buy HOOL",
                        List.of("invest", "#q1"),
                        List.of("trade-1"),
                        List.of(stock, cash),
                        Map.of("source", "\"import\""));
        assertEquals(
                "2023-03-02 ! \"Broker\" \"Buy HOOL\" #invest #q1 ^trade-1\n"
                        + "\t! Assets:Broker:HOOL\t10 HOOL @ 152.00 USD {150.00 USD}\n"
                        + "\tlot: \"a\"\n"
                        + "\tAssets:Broker:Cash\n"
                        + "\tsource: \"import\"\n",
                render(transaction));
    }

    @Test
    void postingWithCurrencyOnlyUnits() throws Exception {
        StringBuilder out = new StringBuilder();
        renderer.render(
                PostingNode.of(Account.parse("Assets:Cash"), IncompleteAmount.of(null, "USD")), out);
        assertEquals("\tAssets:Cash\tUSD\n", out.toString());
    }

    private String render(DirectiveNode directive) throws RenderException {
        StringBuilder out = new StringBuilder();
        renderer.render(directive, out);
        return out.toString();
    }
}
