package domain.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Compact description of an AST for reports.
 */
public final class AstSummary {

    private final NodeType rootType;
    private final int totalNodes;
    private final Set<NodeType> nodeTypes;
    private final boolean compound;
    private final List<NodeType> queryTypes;

    private AstSummary(NodeType rootType, int totalNodes, Set<NodeType> nodeTypes,
                       boolean compound, List<NodeType> queryTypes) {
        this.rootType = rootType;
        this.totalNodes = totalNodes;
        this.nodeTypes = Collections.unmodifiableSet(nodeTypes);
        this.compound = compound;
        this.queryTypes = Collections.unmodifiableList(queryTypes);
    }

    public static AstSummary of(AstNode root) {
        if (root == null) throw new IllegalArgumentException("root is null");

        Set<NodeType> types = new LinkedHashSet<>();
        collectTypes(root, types);

        // query shapes of the individual questions, compounds flattened
        List<NodeType> queries = new ArrayList<>();
        collectQueries(root, queries);

        return new AstSummary(
                root.getType(),
                root.nodeCount(),
                types,
                !root.findByType(NodeType.COMPOUND_QUERY).isEmpty(),
                queries
        );
    }

    private static void collectTypes(AstNode node, Set<NodeType> out) {
        out.add(node.getType());
        for (AstNode c : node.getChildren()) collectTypes(c, out);
    }

    private static void collectQueries(AstNode node, List<NodeType> out) {
        if (node.getType() == NodeType.COMPOUND_QUERY) {
            for (AstNode c : node.getChildren()) collectQueries(c, out);
        } else if (node.getType().isQuery()) {
            out.add(node.getType());
        }
    }

    public NodeType getRootType() {
        return rootType;
    }

    public int getTotalNodes() {
        return totalNodes;
    }

    public Set<NodeType> getNodeTypes() {
        return nodeTypes;
    }

    public boolean isCompound() {
        return compound;
    }

    public List<NodeType> getQueryTypes() {
        return queryTypes;
    }
}
