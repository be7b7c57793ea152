package domain.ast;

import java.util.Locale;
import java.util.Map;

/**
 * Indented, human-readable text tree of an AST (two spaces per level).
 */
public final class AstTextRenderer {

    private static final Map<String, String> PRODUCT_NAMES = Map.ofEntries(
            Map.entry("TV", "Television"),
            Map.entry("PHONE", "Mobile Phone"),
            Map.entry("MOBILE", "Mobile Phone"),
            Map.entry("SMARTPHONE", "Smartphone"),
            Map.entry("LAPTOP", "Laptop"),
            Map.entry("COMPUTER", "Computer/Laptop"),
            Map.entry("TABLET", "Tablet"),
            Map.entry("DRIVE", "Storage Drive"),
            Map.entry("HARD_DRIVE", "Hard Drive"),
            Map.entry("ALL", "All Products")
    );

    private static final Map<String, String> STYLE_NAMES = Map.of(
            "basic", "Direct Question",
            "conversational", "Conversational ('we have')",
            "polite_request", "Polite Request ('can you tell me')",
            "formal_request", "Formal Request ('I want to know')"
    );

    private AstTextRenderer() {
    }

    public static String render(AstNode root) {
        if (root == null) return "";
        StringBuilder sb = new StringBuilder(256);
        render(root, 0, sb);
        return sb.toString();
    }

    private static void render(AstNode node, int indent, StringBuilder sb) {
        sb.append("  ".repeat(indent))
                .append(line(node))
                .append('\n');
        for (AstNode c : node.getChildren()) render(c, indent + 1, sb);
    }

    static String line(AstNode node) {
        NodeType t = node.getType();
        if (!t.isLeaf()) return t.label();

        String v = String.valueOf(node.getValue());
        return switch (t) {
            case PRODUCT_TYPE -> t.label() + ": " + productName(v);
            case LOCATION -> t.label() + ": " + ("stock".equalsIgnoreCase(v) ? "Warehouse" : "Store");
            case THRESHOLD -> t.label() + ": " + ("0".equals(v) ? "Out of Stock (0)" : "Low Stock (<= " + v + ")");
            case OPERATOR -> t.label() + ": " + ("less_than".equals(v) ? "Less Than" : "Greater Than");
            case TARGET -> t.label() + ": " + (v.contains("all") ? "All Products" : "Available Products");
            case ORIGINAL_PHRASE -> t.label() + ": \"" + v + "\"";
            case QUERY_STYLE -> t.label() + ": " + STYLE_NAMES.getOrDefault(v, v);
            default -> t.label() + ": " + v;
        };
    }

    static String productName(String productType) {
        String key = productType == null ? "" : productType.toUpperCase(Locale.ROOT);
        return PRODUCT_NAMES.getOrDefault(key, productType);
    }
}
