package domain.translate;

import domain.ast.AstNode;
import domain.ast.NodeType;
import domain.model.Diagnostic;
import domain.model.DiagnosticCode;
import domain.model.ListDiagnosticSink;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlTranslatorTest {

    private final SqlTranslator translator = new SqlTranslator();

    private static AstNode phrase(String s) {
        return AstNode.leaf(NodeType.ORIGINAL_PHRASE, s);
    }

    private static AstNode quantityOfProduct(String product) {
        return AstNode.branch(NodeType.QUANTITY_QUERY,
                phrase("how many " + product),
                AstNode.leaf(NodeType.QUERY_STYLE, "basic"),
                AstNode.leaf(NodeType.PRODUCT_TYPE, product),
                AstNode.leaf(NodeType.LOCATION, "store"));
    }

    private static AstNode quantityOfItem(String itemId) {
        return AstNode.branch(NodeType.QUANTITY_QUERY,
                phrase("how many " + itemId),
                AstNode.leaf(NodeType.QUERY_STYLE, "basic"),
                AstNode.leaf(NodeType.ITEM_ID, itemId),
                AstNode.leaf(NodeType.LOCATION, "store"));
    }

    private static AstNode list() {
        return AstNode.branch(NodeType.LIST_QUERY, phrase("show all products"),
                AstNode.leaf(NodeType.TARGET, "all_products"));
    }

    private static AstNode lowStock(int threshold) {
        return AstNode.branch(NodeType.LOW_STOCK_QUERY, phrase("show low stock"),
                AstNode.leaf(NodeType.THRESHOLD, threshold));
    }

    private static AstNode comparison(String op, Object value) {
        return AstNode.branch(NodeType.COMPARISON_QUERY, phrase("show products"),
                AstNode.leaf(NodeType.OPERATOR, op),
                AstNode.leaf(NodeType.VALUE, value));
    }

    @Test
    void should_translate_list_query_exactly() {
        assertEquals(List.of("SELECT item_id, name, quantity FROM stock ORDER BY name;"), translator.toSql(list()));
    }

    @Test
    void should_translate_availability_query() {
        AstNode a = AstNode.branch(NodeType.AVAILABILITY_QUERY, phrase("what is available"),
                AstNode.leaf(NodeType.TARGET, "available_products"));
        assertEquals(List.of("SELECT item_id, name, quantity FROM stock WHERE quantity > 0 ORDER BY name;"),
                translator.toSql(a));
    }

    @Test
    void should_translate_product_quantity_with_predicate() {
        assertEquals(List.of("SELECT item_id, name, quantity FROM stock WHERE item_id LIKE 'LP%';"),
                translator.toSql(quantityOfProduct("LAPTOP")));
        assertEquals(List.of("SELECT item_id, name, quantity FROM stock WHERE category = 'Tablets';"),
                translator.toSql(quantityOfProduct("TABLET")));
        assertEquals(List.of("SELECT item_id, name, quantity FROM stock WHERE 1=1;"),
                translator.toSql(quantityOfProduct("ALL")));
    }

    @Test
    void should_bind_item_id_as_parameter() {
        List<StockSql> out = translator.translate(quantityOfItem("TV-1234"));
        assertEquals(1, out.size());

        StockSql sql = out.get(0);
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE item_id = ?;", sql.getTemplate());
        assertEquals(List.of("TV-1234"), sql.getParameters());
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE item_id = 'TV-1234';", sql.render());
    }

    @Test
    void should_escape_quote_in_rendered_item_id_and_keep_raw_parameter() {
        StockSql sql = translator.translate(quantityOfItem("TV-1'; DROP")).get(0);
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE item_id = 'TV-1''; DROP';", sql.render());
        assertEquals(List.of("TV-1'; DROP"), sql.getParameters());
        assertTrue(SqlTranslator.isSafeSelect(sql.getTemplate()));
        assertTrue(SqlTranslator.isSafeSelect(sql.render()));
    }

    @Test
    void should_translate_low_stock_thresholds() {
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE quantity <= 10 ORDER BY quantity;",
                translator.toSql(lowStock(10)).get(0));
        StockSql zero = translator.translate(lowStock(0)).get(0);
        assertTrue(zero.render().contains("quantity <= 0"));
        assertEquals(List.of(0), zero.getParameters());
    }

    @Test
    void should_translate_comparisons() {
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE quantity < 10 ORDER BY quantity;",
                translator.toSql(comparison("less_than", 10)).get(0));
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE quantity > 50 ORDER BY quantity DESC;",
                translator.toSql(comparison("greater_than", 50)).get(0));
    }

    @Test
    void should_bind_wide_comparison_values() {
        StockSql big = translator.translate(comparison("greater_than", 3_000_000_000L)).get(0);
        assertEquals(List.of(3_000_000_000L), big.getParameters());
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE quantity > 3000000000 ORDER BY quantity DESC;",
                big.render());

        StockSql huge = translator.translate(
                comparison("less_than", new BigInteger("123456789012345678901234567890"))).get(0);
        assertEquals(List.of(new BigDecimal("123456789012345678901234567890")), huge.getParameters());
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE quantity < 123456789012345678901234567890 ORDER BY quantity;",
                huge.render());
    }

    @Test
    void should_flatten_compound_into_concatenated_statements() {
        AstNode a = quantityOfProduct("TV");
        AstNode b = AstNode.compound(lowStock(10), comparison("less_than", 5));
        AstNode root = AstNode.compound(a, b);

        List<String> expected = new ArrayList<>(translator.toSql(a));
        expected.addAll(translator.toSql(b));
        assertEquals(expected, translator.toSql(root));
        assertEquals(3, translator.toSql(root).size());
    }

    @Test
    void should_fall_back_to_catch_all_for_quantity_without_target() {
        AstNode q = AstNode.branch(NodeType.QUANTITY_QUERY, phrase("how many"),
                AstNode.leaf(NodeType.LOCATION, "store"));
        assertEquals(List.of("SELECT item_id, name, quantity FROM stock;"), translator.toSql(q));
    }

    @Test
    void should_report_fallback_for_non_query_root() {
        List<Diagnostic> diags = new ArrayList<>();
        List<StockSql> out = translator.translate(AstNode.leaf(NodeType.VALUE, 3), new ListDiagnosticSink(diags));

        assertEquals("SELECT item_id, name, quantity FROM stock;", out.get(0).render());
        assertEquals(1, diags.size());
        assertEquals(DiagnosticCode.TRANSLATION_FALLBACK, diags.get(0).getCode());
    }

    @Test
    void should_report_missing_product_predicate_and_match_all() {
        List<Diagnostic> diags = new ArrayList<>();
        List<StockSql> out = translator.translate(quantityOfProduct("MONITOR"), new ListDiagnosticSink(diags));

        assertEquals("SELECT item_id, name, quantity FROM stock WHERE 1=1;", out.get(0).render());
        assertEquals(DiagnosticCode.PRODUCT_PREDICATE_MISSING, diags.get(0).getCode());
        assertEquals("MONITOR", diags.get(0).getDetail());
    }

    @Test
    void should_use_custom_predicate_table() {
        SqlTranslator custom = new SqlTranslator(ProductPredicateTable.defaults()
                .withMapping("monitor", "category = 'Monitors'"));
        assertEquals("SELECT item_id, name, quantity FROM stock WHERE category = 'Monitors';",
                custom.toSql(quantityOfProduct("MONITOR")).get(0));
    }

    @Test
    void should_validate_safe_select() {
        assertTrue(SqlTranslator.isSafeSelect("SELECT item_id, name, quantity FROM stock ORDER BY name;"));
        assertTrue(SqlTranslator.isSafeSelect("select * from stock where name = 'Update Pack'"));
        assertFalse(SqlTranslator.isSafeSelect("DELETE FROM stock"));
        assertFalse(SqlTranslator.isSafeSelect("SELECT 1"));
        assertFalse(SqlTranslator.isSafeSelect("SELECT * FROM stock; DROP TABLE stock;"));
        assertFalse(SqlTranslator.isSafeSelect("SELECT * FROM stock -- comment"));
        assertFalse(SqlTranslator.isSafeSelect(""));
        assertFalse(SqlTranslator.isSafeSelect(null));
    }
}
