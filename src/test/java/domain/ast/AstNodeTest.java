package domain.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AstNodeTest {

    private static AstNode quantity(String product) {
        return AstNode.branch(NodeType.QUANTITY_QUERY,
                AstNode.leaf(NodeType.ORIGINAL_PHRASE, "how many " + product + " we have"),
                AstNode.leaf(NodeType.QUERY_STYLE, "conversational"),
                AstNode.leaf(NodeType.PRODUCT_TYPE, product),
                AstNode.leaf(NodeType.LOCATION, "store"));
    }

    private static AstNode lowStock(int threshold) {
        return AstNode.branch(NodeType.LOW_STOCK_QUERY,
                AstNode.leaf(NodeType.ORIGINAL_PHRASE, "show low stock"),
                AstNode.leaf(NodeType.THRESHOLD, threshold));
    }

    @Test
    void should_reject_leaf_without_value_and_branch_without_children() {
        assertThrows(IllegalArgumentException.class, () -> AstNode.leaf(NodeType.ITEM_ID, null));
        assertThrows(IllegalArgumentException.class, () -> AstNode.branch(NodeType.LIST_QUERY, List.of()));
        assertThrows(IllegalArgumentException.class, () -> AstNode.leaf(NodeType.LIST_QUERY, "x"));
        assertThrows(IllegalArgumentException.class,
                () -> AstNode.branch(NodeType.VALUE, AstNode.leaf(NodeType.VALUE, 1)));
    }

    @Test
    void should_require_exactly_two_children_for_compound() {
        AstNode a = lowStock(10);
        assertThrows(IllegalArgumentException.class, () -> AstNode.branch(NodeType.COMPOUND_QUERY, a));
        assertThrows(IllegalArgumentException.class, () -> AstNode.branch(NodeType.COMPOUND_QUERY, a, a, a));
        assertEquals(2, AstNode.compound(a, quantity("TV")).getChildren().size());
    }

    @Test
    void should_copy_children_and_expose_unmodifiable_list() {
        List<AstNode> kids = new ArrayList<>();
        kids.add(AstNode.leaf(NodeType.ORIGINAL_PHRASE, "show all products"));
        kids.add(AstNode.leaf(NodeType.TARGET, "all_products"));
        AstNode list = AstNode.branch(NodeType.LIST_QUERY, kids);

        kids.clear();
        assertEquals(2, list.getChildren().size());
        assertThrows(UnsupportedOperationException.class, () -> list.getChildren().add(AstNode.leaf(NodeType.TARGET, "x")));
    }

    @Test
    void should_count_and_find_nodes() {
        AstNode root = AstNode.compound(quantity("TV"), quantity("PHONE"));
        assertEquals(11, root.nodeCount());
        assertEquals(2, root.findByType(NodeType.PRODUCT_TYPE).size());
        assertEquals(1, root.findByType(NodeType.COMPOUND_QUERY).size());
        assertEquals("TV", root.getChildren().get(0).childValue(NodeType.PRODUCT_TYPE));
        assertNull(root.childValue(NodeType.PRODUCT_TYPE));
    }

    @Test
    void should_convert_to_map_and_back() {
        AstNode root = AstNode.compound(quantity("LAPTOP"), lowStock(0));
        Map<String, Object> m = root.toMap();

        assertEquals("CompoundQuery", m.get("type"));
        assertNull(m.get("value"));
        assertEquals(2, ((List<?>) m.get("children")).size());
        assertEquals(root, AstNode.fromMap(m));
    }

    @Test
    void should_reject_map_with_non_map_child() {
        Map<String, Object> m = Map.of(
                "type", "CompoundQuery",
                "children", List.of(quantity("TV").toMap(), "not a node"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> AstNode.fromMap(m));
        assertTrue(e.getMessage().contains("CompoundQuery"));
    }

    @Test
    void should_render_indented_text_tree() {
        String text = AstTextRenderer.render(quantity("HARD_DRIVE"));
        String[] lines = text.split("\n");

        assertEquals("Quantity Query", lines[0]);
        assertEquals("  Original Input: \"how many HARD_DRIVE we have\"", lines[1]);
        assertEquals("  Query Style: Conversational ('we have')", lines[2]);
        assertEquals("  Product Type: Hard Drive", lines[3]);
        assertEquals("  Location: Store", lines[4]);
    }

    @Test
    void should_render_threshold_labels() {
        assertTrue(AstTextRenderer.render(lowStock(0)).contains("Threshold: Out of Stock (0)"));
        assertTrue(AstTextRenderer.render(lowStock(10)).contains("Threshold: Low Stock (<= 10)"));
        assertEquals("", AstTextRenderer.render(null));
    }

    @Test
    void should_summarize_compound_tree() {
        AstNode root = AstNode.compound(quantity("TV"), AstNode.compound(lowStock(10), quantity("PHONE")));
        AstSummary s = AstSummary.of(root);

        assertEquals(NodeType.COMPOUND_QUERY, s.getRootType());
        assertEquals(root.nodeCount(), s.getTotalNodes());
        assertTrue(s.isCompound());
        assertEquals(List.of(NodeType.QUANTITY_QUERY, NodeType.LOW_STOCK_QUERY, NodeType.QUANTITY_QUERY),
                s.getQueryTypes());
        assertTrue(s.getNodeTypes().contains(NodeType.THRESHOLD));
    }

    @Test
    void should_summarize_single_query() {
        AstSummary s = AstSummary.of(lowStock(10));
        assertFalse(s.isCompound());
        assertEquals(List.of(NodeType.LOW_STOCK_QUERY), s.getQueryTypes());
        assertEquals(3, s.getTotalNodes());
    }
}
