package domain.ast;

/**
 * Closed set of AST node types.
 *
 * <p>Each type is either a LEAF (carries a scalar value) or a BRANCH (carries
 * child nodes). {@link AstNode} enforces the shape at construction.</p>
 */
public enum NodeType {

    QUANTITY_QUERY("QuantityQuery", Shape.BRANCH, "Quantity Query"),
    LIST_QUERY("ListQuery", Shape.BRANCH, "List Query"),
    AVAILABILITY_QUERY("AvailabilityQuery", Shape.BRANCH, "Availability Query"),
    LOW_STOCK_QUERY("LowStockQuery", Shape.BRANCH, "Low Stock Query"),
    COMPARISON_QUERY("ComparisonQuery", Shape.BRANCH, "Comparison Query"),
    COMPOUND_QUERY("CompoundQuery", Shape.BRANCH, "Compound Query (Multiple Questions)"),

    ORIGINAL_PHRASE("OriginalPhrase", Shape.LEAF, "Original Input"),
    QUERY_STYLE("QueryStyle", Shape.LEAF, "Query Style"),
    /** Item id, uppercased by the parser ({@code tv-1234} is stored as {@code TV-1234}). */
    ITEM_ID("ItemID", Shape.LEAF, "Specific Item"),
    PRODUCT_TYPE("ProductType", Shape.LEAF, "Product Type"),
    LOCATION("Location", Shape.LEAF, "Location"),
    TARGET("Target", Shape.LEAF, "Target"),
    THRESHOLD("Threshold", Shape.LEAF, "Threshold"),
    OPERATOR("Operator", Shape.LEAF, "Comparison"),
    VALUE("Value", Shape.LEAF, "Value");

    public enum Shape {
        LEAF,
        BRANCH
    }

    private final String tag;
    private final Shape shape;
    private final String label;

    NodeType(String tag, Shape shape, String label) {
        this.tag = tag;
        this.shape = shape;
        this.label = label;
    }

    /**
     * Stable external name, used in serialized trees and reports.
     */
    public String tag() {
        return tag;
    }

    public Shape shape() {
        return shape;
    }

    public String label() {
        return label;
    }

    public boolean isLeaf() {
        return shape == Shape.LEAF;
    }

    /**
     * True for the root shapes a grammar production can produce.
     */
    public boolean isQuery() {
        return shape == Shape.BRANCH;
    }

    public static NodeType fromTag(String tag) {
        for (NodeType t : values()) {
            if (t.tag.equals(tag)) return t;
        }
        throw new IllegalArgumentException("unknown node type tag: " + tag);
    }
}
