package domain.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static domain.lexer.TokenKind.*;
import static domain.parse.Symbol.location;
import static domain.parse.Symbol.number;
import static domain.parse.Symbol.productType;
import static domain.parse.Symbol.products;
import static domain.parse.Symbol.t;

/**
 * Immutable production table of the stock-question grammar.
 *
 * <p>Order matters only for ties: when two productions match the same tokens,
 * the one listed first wins ("WHAT products ARE AVAILABLE" is a list query,
 * not an availability query).</p>
 */
public final class GrammarRules {

    public static final int DEFAULT_LOW_STOCK_THRESHOLD = 10;

    private static final GrammarRules DEFAULTS = new GrammarRules(buildDefaultProductions(), DEFAULT_LOW_STOCK_THRESHOLD);

    private final List<Production> productions;
    private final int lowStockThreshold;

    public GrammarRules(List<Production> productions, int lowStockThreshold) {
        if (productions == null || productions.isEmpty()) throw new IllegalArgumentException("productions is empty");
        if (lowStockThreshold < 0) throw new IllegalArgumentException("lowStockThreshold must be >= 0");
        this.productions = Collections.unmodifiableList(new ArrayList<>(productions));
        this.lowStockThreshold = lowStockThreshold;
    }

    public static GrammarRules defaults() {
        return DEFAULTS;
    }

    public GrammarRules withLowStockThreshold(int threshold) {
        return new GrammarRules(productions, threshold);
    }

    private static List<Production> buildDefaultProductions() {
        List<Production> p = new ArrayList<>(40);

        // quantity
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), productType(), t(IN), location()));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(UNITS), t(OF), productType(), t(IN), location()));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), productType()));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), productType(), t(WE), t(HAVE)));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), productType(), t(DO), t(WE), t(HAVE)));
        p.add(prod(QueryShape.QUANTITY, t(CAN), t(YOU), t(TELL), t(ME), t(HOW_MANY), productType(), t(WE), t(HAVE)));
        p.add(prod(QueryShape.QUANTITY, t(I), t(WANT), t(TO), t(KNOW), t(HOW_MANY), productType(), t(IN), location()));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(ITEM), t(ITEM_ID)));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(ITEM), t(ITEM_ID), t(IN), location()));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(UNITS), t(OF), t(ITEM), t(ITEM_ID), t(IN), location()));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(ITEM), t(ITEM_ID), t(WE), t(HAVE)));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(ITEM), t(ITEM_ID), t(DO), t(WE), t(HAVE)));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(ITEM_ID)));
        p.add(prod(QueryShape.QUANTITY, t(HOW_MANY), t(ITEM_ID), t(IN), location()));

        // list
        p.add(prod(QueryShape.LIST, t(SHOW), t(ALL), products()));
        p.add(prod(QueryShape.LIST, t(LIST), t(ALL), products()));
        p.add(prod(QueryShape.LIST, t(WHAT), products(), t(ARE), t(AVAILABLE)));

        // availability
        p.add(prod(QueryShape.AVAILABILITY, t(WHAT), t(IS), t(AVAILABLE)));
        p.add(prod(QueryShape.AVAILABILITY, t(SHOW), t(AVAILABLE), products()));

        // low stock
        p.add(prod(QueryShape.LOW_STOCK, t(WHAT), products(), t(ARE), t(LOW)));
        p.add(prod(QueryShape.LOW_STOCK, t(SHOW), t(LOW), t(STOCK)));
        p.add(prod(QueryShape.LOW_STOCK, t(WHAT), t(IS), t(LOW), t(IN), t(STOCK)));
        p.add(prod(QueryShape.LOW_STOCK, t(WHAT), products(), t(ARE), t(OUT), t(OF), t(STOCK)));
        p.add(prod(QueryShape.LOW_STOCK, t(SHOW), t(EMPTY), products()));

        // comparison
        p.add(prod(QueryShape.COMPARISON, t(SHOW), products(), t(LESS), t(THAN), number()));
        p.add(prod(QueryShape.COMPARISON, t(SHOW), products(), t(MORE), t(THAN), number()));
        p.add(prod(QueryShape.COMPARISON, t(SHOW), products(), t(GREATER), t(THAN), number()));

        return p;
    }

    private static Production prod(QueryShape shape, Symbol... symbols) {
        return new Production(shape, List.of(symbols));
    }

    public List<Production> productions() {
        return productions;
    }

    public int getLowStockThreshold() {
        return lowStockThreshold;
    }
}
