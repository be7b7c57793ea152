package domain.translate;

import domain.ast.AstNode;
import domain.ast.NodeType;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.DiagnosticSink;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * AST -> SELECT statements over the {@code stock} table.
 *
 * <p>Never fails: shapes it cannot translate fall back to the full stock
 * listing and report {@link DiagnosticCode#TRANSLATION_FALLBACK}. Item ids and
 * numbers are always bound parameters.</p>
 */
public final class SqlTranslator {

    static final String BASE_SELECT = "SELECT item_id, name, quantity FROM stock";
    static final String CATCH_ALL = BASE_SELECT + ";";

    private static final Pattern FORBIDDEN = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|MERGE|DROP|CREATE|ALTER|TRUNCATE|GRANT|REVOKE|EXEC|EXECUTE|CALL)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SELECT_HEAD = Pattern.compile("^\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FROM_CLAUSE = Pattern.compile("\\bFROM\\b", Pattern.CASE_INSENSITIVE);

    private final ProductPredicateTable predicates;

    public SqlTranslator() {
        this(ProductPredicateTable.defaults());
    }

    public SqlTranslator(ProductPredicateTable predicates) {
        this.predicates = Objects.requireNonNull(predicates, "predicates");
    }

    public List<StockSql> translate(AstNode ast) {
        return translate(ast, DiagnosticSink.none());
    }

    /**
     * One statement per single question; a compound yields its children's
     * statements in order.
     */
    public List<StockSql> translate(AstNode ast, DiagnosticSink sink) {
        DiagnosticSink s = sink == null ? DiagnosticSink.none() : sink;
        List<StockSql> out = new ArrayList<>(2);
        collect(ast, s, out);
        return out;
    }

    /**
     * Rendered text of {@link #translate(AstNode)}.
     */
    public List<String> toSql(AstNode ast) {
        List<String> out = new ArrayList<>(2);
        for (StockSql sql : translate(ast)) out.add(sql.render());
        return out;
    }

    private void collect(AstNode node, DiagnosticSink sink, List<StockSql> out) {
        if (node == null) {
            sink.report(Diagnostic.of(DiagnosticCode.TRANSLATION_FALLBACK, "", "no AST to translate"));
            out.add(StockSql.of(CATCH_ALL));
            return;
        }

        switch (node.getType()) {
            case COMPOUND_QUERY -> {
                for (AstNode child : node.getChildren()) collect(child, sink, out);
            }
            case QUANTITY_QUERY -> out.add(quantity(node, sink));
            case LIST_QUERY -> out.add(StockSql.of(BASE_SELECT + " ORDER BY name;"));
            case AVAILABILITY_QUERY -> out.add(StockSql.of(BASE_SELECT + " WHERE quantity > 0 ORDER BY name;"));
            case LOW_STOCK_QUERY -> out.add(lowStock(node, sink));
            case COMPARISON_QUERY -> out.add(comparison(node, sink));
            case ORIGINAL_PHRASE, QUERY_STYLE, ITEM_ID, PRODUCT_TYPE, LOCATION, TARGET, THRESHOLD, OPERATOR, VALUE ->
                    out.add(fallback(node, sink, "not a query node"));
        }
    }

    /**
     * Item ids arrive uppercased from the parser and are bound as-is, so the
     * equality match assumes uppercase ids in {@code stock.item_id}.
     */
    private StockSql quantity(AstNode node, DiagnosticSink sink) {
        Object itemId = node.childValue(NodeType.ITEM_ID);
        if (itemId != null) {
            return StockSql.builder()
                    .append(BASE_SELECT + " WHERE item_id = ")
                    .bind(itemId.toString())
                    .append(";")
                    .build();
        }

        Object productType = node.childValue(NodeType.PRODUCT_TYPE);
        if (productType != null) {
            String token = productType.toString();
            String predicate = predicates.find(token);
            if (predicate == null) {
                sink.report(new Diagnostic(DiagnosticCode.PRODUCT_PREDICATE_MISSING, phraseOf(node), -1,
                        "no predicate for product type, matching all rows", token));
                predicate = ProductPredicateTable.ALWAYS_TRUE;
            }
            return StockSql.of(BASE_SELECT + " WHERE " + predicate + ";");
        }

        return StockSql.of(CATCH_ALL);
    }

    private static StockSql lowStock(AstNode node, DiagnosticSink sink) {
        Number threshold = numberValue(node.childValue(NodeType.THRESHOLD));
        if (threshold == null) return fallback(node, sink, "low stock query without threshold");
        return StockSql.builder()
                .append(BASE_SELECT + " WHERE quantity <= ")
                .bind(threshold)
                .append(" ORDER BY quantity;")
                .build();
    }

    private static StockSql comparison(AstNode node, DiagnosticSink sink) {
        Number value = numberValue(node.childValue(NodeType.VALUE));
        Object operator = node.childValue(NodeType.OPERATOR);
        if (value == null || operator == null) return fallback(node, sink, "comparison query without operator/value");

        if ("less_than".equals(operator)) {
            return StockSql.builder()
                    .append(BASE_SELECT + " WHERE quantity < ")
                    .bind(value)
                    .append(" ORDER BY quantity;")
                    .build();
        }
        return StockSql.builder()
                .append(BASE_SELECT + " WHERE quantity > ")
                .bind(value)
                .append(" ORDER BY quantity DESC;")
                .build();
    }

    private static StockSql fallback(AstNode node, DiagnosticSink sink, String reason) {
        sink.report(new Diagnostic(DiagnosticCode.TRANSLATION_FALLBACK, phraseOf(node), -1,
                reason, node.getType().tag()));
        return StockSql.of(CATCH_ALL);
    }

    private static String phraseOf(AstNode node) {
        Object phrase = node.isLeaf() ? node.getValue() : node.childValue(NodeType.ORIGINAL_PHRASE);
        return phrase == null ? "" : phrase.toString();
    }

    // Integer/Long/BigDecimal are bound as they are; JDBC has no BigInteger mapping
    private static Number numberValue(Object v) {
        if (v instanceof BigInteger) return new BigDecimal((BigInteger) v);
        if (v instanceof Number) return (Number) v;
        if (v instanceof String) {
            String digits = ((String) v).trim();
            try {
                return Long.valueOf(digits);
            } catch (NumberFormatException e) {
                return wholeDecimal(digits);
            }
        }
        return null;
    }

    private static BigDecimal wholeDecimal(String digits) {
        try {
            BigDecimal d = new BigDecimal(digits);
            return d.scale() <= 0 ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Read-only check for statements headed to an executor: a single SELECT
     * with a FROM clause, no DDL/DML keyword, no comment marker.
     */
    public static boolean isSafeSelect(String sql) {
        if (sql == null || sql.isBlank()) return false;
        String s = sql.trim();
        if (!SELECT_HEAD.matcher(s).find()) return false;
        if (!FROM_CLAUSE.matcher(s).find()) return false;
        if (s.contains("--") || s.contains("/*") || s.contains("*/")) return false;

        String body = stripLiterals(s.endsWith(";") ? s.substring(0, s.length() - 1) : s);
        if (body.indexOf(';') >= 0) return false;
        return !FORBIDDEN.matcher(body.toUpperCase(Locale.ROOT)).find();
    }

    // keywords inside quoted literals ('Update Pack') are data
    private static String stripLiterals(String sql) {
        StringBuilder sb = new StringBuilder(sql.length());
        boolean inQuote = false;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
                sb.append(c);
            } else if (!inQuote) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public ProductPredicateTable getPredicates() {
        return predicates;
    }
}
