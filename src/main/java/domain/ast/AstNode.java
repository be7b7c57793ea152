package domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable AST node.
 *
 * <p>A leaf carries a non-null scalar value and no children; a branch carries a
 * non-empty child list and no value. Which one a node is follows from its
 * {@link NodeType}.</p>
 */
public final class AstNode {

    private final NodeType type;
    private final Object value;
    private final List<AstNode> children;

    private AstNode(NodeType type, Object value, List<AstNode> children) {
        this.type = type;
        this.value = value;
        this.children = children;
    }

    public static AstNode leaf(NodeType type, Object value) {
        Objects.requireNonNull(type, "type");
        if (!type.isLeaf()) throw new IllegalArgumentException(type.tag() + " is not a leaf type");
        if (value == null) throw new IllegalArgumentException(type.tag() + " requires a value");
        return new AstNode(type, value, List.of());
    }

    public static AstNode branch(NodeType type, List<AstNode> children) {
        Objects.requireNonNull(type, "type");
        if (type.isLeaf()) throw new IllegalArgumentException(type.tag() + " is not a branch type");
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException(type.tag() + " requires children");
        }
        List<AstNode> copy = new ArrayList<>(children.size());
        for (AstNode c : children) copy.add(Objects.requireNonNull(c, "child"));
        if (type == NodeType.COMPOUND_QUERY && copy.size() != 2) {
            throw new IllegalArgumentException("CompoundQuery requires exactly two children, got " + copy.size());
        }
        return new AstNode(type, null, Collections.unmodifiableList(copy));
    }

    public static AstNode branch(NodeType type, AstNode... children) {
        return branch(type, children == null ? null : List.of(children));
    }

    public static AstNode compound(AstNode left, AstNode right) {
        return branch(NodeType.COMPOUND_QUERY, left, right);
    }

    public NodeType getType() {
        return type;
    }

    /**
     * Scalar payload of a leaf, null for a branch.
     */
    public Object getValue() {
        return value;
    }

    public List<AstNode> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return type.isLeaf();
    }

    /**
     * First direct child of the given type, or null.
     */
    public AstNode child(NodeType childType) {
        for (AstNode c : children) {
            if (c.type == childType) return c;
        }
        return null;
    }

    /**
     * Value of the first direct child of the given type, or null.
     */
    public Object childValue(NodeType childType) {
        AstNode c = child(childType);
        return c == null ? null : c.value;
    }

    public int nodeCount() {
        int count = 1;
        for (AstNode c : children) count += c.nodeCount();
        return count;
    }

    /**
     * All nodes of the given type, pre-order, including this node.
     */
    public List<AstNode> findByType(NodeType nodeType) {
        List<AstNode> out = new ArrayList<>();
        collect(this, nodeType, out);
        return out;
    }

    private static void collect(AstNode node, NodeType nodeType, List<AstNode> out) {
        if (node.type == nodeType) out.add(node);
        for (AstNode c : node.children) collect(c, nodeType, out);
    }

    /**
     * Serializable form: {@code {type, value, children}} with external tags.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type.tag());
        m.put("value", value);
        List<Map<String, Object>> kids = new ArrayList<>(children.size());
        for (AstNode c : children) kids.add(c.toMap());
        m.put("children", kids);
        return m;
    }

    /**
     * Inverse of {@link #toMap()}.
     */
    public static AstNode fromMap(Map<String, Object> m) {
        if (m == null) throw new IllegalArgumentException("map is null");
        return fromAnyMap(m);
    }

    private static AstNode fromAnyMap(Map<?, ?> m) {
        NodeType t = NodeType.fromTag(String.valueOf(m.get("type")));
        if (t.isLeaf()) return leaf(t, m.get("value"));

        Object raw = m.get("children");
        List<AstNode> kids = new ArrayList<>();
        if (raw instanceof List) {
            for (Object o : (List<?>) raw) {
                if (!(o instanceof Map)) {
                    throw new IllegalArgumentException("child of " + t.tag() + " is not a map: " + o);
                }
                kids.add(fromAnyMap((Map<?, ?>) o));
            }
        }
        return branch(t, kids);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstNode)) return false;
        AstNode other = (AstNode) o;
        return type == other.type && Objects.equals(value, other.value) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, children);
    }

    @Override
    public String toString() {
        if (isLeaf()) return type.tag() + "(" + value + ")";
        return type.tag() + children;
    }
}
