package domain.parse;

import domain.ast.AstNode;
import domain.ast.NodeType;
import domain.lexer.Token;
import domain.lexer.TokenKind;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lowers a matched production to its AST shape.
 */
final class QueryNodeFactory {

    static final String TARGET_ALL = "all_products";
    static final String TARGET_AVAILABLE = "available_products";
    static final String LESS_THAN = "less_than";
    static final String GREATER_THAN = "greater_than";
    static final String DEFAULT_LOCATION = "store";

    private static final Map<TokenKind, String> CANONICAL_PRODUCTS = new EnumMap<>(TokenKind.class);

    static {
        CANONICAL_PRODUCTS.put(TokenKind.TVS, "TV");
        CANONICAL_PRODUCTS.put(TokenKind.TV, "TV");
        CANONICAL_PRODUCTS.put(TokenKind.PHONES, "PHONE");
        CANONICAL_PRODUCTS.put(TokenKind.PHONE, "PHONE");
        CANONICAL_PRODUCTS.put(TokenKind.MOBILES, "MOBILE");
        CANONICAL_PRODUCTS.put(TokenKind.MOBILE, "MOBILE");
        CANONICAL_PRODUCTS.put(TokenKind.SMARTPHONE, "SMARTPHONE");
        CANONICAL_PRODUCTS.put(TokenKind.LAPTOPS, "LAPTOP");
        CANONICAL_PRODUCTS.put(TokenKind.LAPTOP, "LAPTOP");
        CANONICAL_PRODUCTS.put(TokenKind.COMPUTERS, "COMPUTER");
        CANONICAL_PRODUCTS.put(TokenKind.COMPUTER, "COMPUTER");
        CANONICAL_PRODUCTS.put(TokenKind.TABLETS, "TABLET");
        CANONICAL_PRODUCTS.put(TokenKind.TABLET, "TABLET");
        CANONICAL_PRODUCTS.put(TokenKind.DRIVES, "DRIVE");
        CANONICAL_PRODUCTS.put(TokenKind.DRIVE, "DRIVE");
        CANONICAL_PRODUCTS.put(TokenKind.PRODUCTS, "ALL");
        CANONICAL_PRODUCTS.put(TokenKind.ITEMS, "ALL");
    }

    private final int lowStockThreshold;

    QueryNodeFactory(int lowStockThreshold) {
        this.lowStockThreshold = lowStockThreshold;
    }

    AstNode build(QueryShape shape, List<Token> matched) {
        String phrase = matched.stream().map(Token::getText).collect(Collectors.joining(" "));
        AstNode original = AstNode.leaf(NodeType.ORIGINAL_PHRASE, phrase);

        return switch (shape) {
            case QUANTITY -> quantity(original, phrase, matched);
            case LIST -> AstNode.branch(NodeType.LIST_QUERY,
                    original, AstNode.leaf(NodeType.TARGET, TARGET_ALL));
            case AVAILABILITY -> AstNode.branch(NodeType.AVAILABILITY_QUERY,
                    original, AstNode.leaf(NodeType.TARGET, TARGET_AVAILABLE));
            case LOW_STOCK -> AstNode.branch(NodeType.LOW_STOCK_QUERY,
                    original, AstNode.leaf(NodeType.THRESHOLD, lowStockThreshold(matched)));
            case COMPARISON -> comparison(original, matched);
        };
    }

    private AstNode quantity(AstNode original, String phrase, List<Token> matched) {
        String itemId = null;
        String productType = null;
        String location = DEFAULT_LOCATION;

        for (int i = 0; i < matched.size(); i++) {
            Token t = matched.get(i);
            TokenKind k = t.getKind();
            if (k == TokenKind.ITEM_ID) {
                itemId = t.getText().toUpperCase(Locale.ROOT);
            } else if (k == TokenKind.HARD && i + 1 < matched.size() && matched.get(i + 1).is(TokenKind.DRIVE)) {
                productType = "HARD_DRIVE";
                i++;
            } else if (CANONICAL_PRODUCTS.containsKey(k)) {
                productType = CANONICAL_PRODUCTS.get(k);
            } else if (k == TokenKind.STORE || k == TokenKind.STOCK) {
                location = t.getText().toLowerCase(Locale.ROOT);
            }
        }

        List<AstNode> children = new ArrayList<>(4);
        children.add(original);
        children.add(AstNode.leaf(NodeType.QUERY_STYLE, QueryStyle.fromPhrase(phrase).value()));
        if (itemId != null) {
            children.add(AstNode.leaf(NodeType.ITEM_ID, itemId));
        } else if (productType != null) {
            children.add(AstNode.leaf(NodeType.PRODUCT_TYPE, productType));
        }
        children.add(AstNode.leaf(NodeType.LOCATION, location));
        return AstNode.branch(NodeType.QUANTITY_QUERY, children);
    }

    private int lowStockThreshold(List<Token> matched) {
        for (Token t : matched) {
            if (t.is(TokenKind.OUT) || t.is(TokenKind.EMPTY)) return 0;
        }
        return lowStockThreshold;
    }

    private static AstNode comparison(AstNode original, List<Token> matched) {
        String operator = GREATER_THAN;
        Number value = null;
        for (Token t : matched) {
            if (t.is(TokenKind.LESS)) operator = LESS_THAN;
            if (t.is(TokenKind.NUMBER)) value = numberValue(t.getText());
        }
        if (value == null) throw new IllegalStateException("comparison without NUMBER: " + original.getValue());
        return AstNode.branch(NodeType.COMPARISON_QUERY,
                original,
                AstNode.leaf(NodeType.OPERATOR, operator),
                AstNode.leaf(NodeType.VALUE, value));
    }

    /**
     * Long when the digits fit, otherwise an exact BigDecimal.
     */
    static Number numberValue(String digits) {
        try {
            return Long.valueOf(digits);
        } catch (NumberFormatException e) {
            return new BigDecimal(digits);
        }
    }
}
