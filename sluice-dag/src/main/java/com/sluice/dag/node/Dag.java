package com.sluice.dag.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable compiled DAG. Produced only by {@link DagCompiler}, so every instance satisfies the
 * structural invariants: one start node, exactly one success and one fail node, no cycles,
 * every non-terminal node has a successor.
 */
public final class Dag {

    private final String internalBranchName;
    private final String description;
    private final String startAt;
    private final int maxTimeSeconds;
    private final Map<String, Node> nodes;

    Dag(String internalBranchName, String description, String startAt, int maxTimeSeconds, Map<String, Node> nodes) {
        this.internalBranchName = internalBranchName;
        this.description = description;
        this.startAt = startAt;
        this.maxTimeSeconds = maxTimeSeconds;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    /** Path template of the branch this DAG is the body of; null for the root DAG. */
    public String getInternalBranchName() {
        return internalBranchName;
    }

    public String getDescription() {
        return description;
    }

    public String getStartAt() {
        return startAt;
    }

    public int getMaxTimeSeconds() {
        return maxTimeSeconds;
    }

    /** Nodes in declaration order. */
    public Collection<Node> getNodes() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    /** Node by plain name in this DAG; null if absent. */
    public Node getNode(String name) {
        return name != null ? nodes.get(name) : null;
    }

    public Node getStartNode() {
        return nodes.get(startAt);
    }

    public Node getSuccessNode() {
        return findByKind(NodeKind.SUCCESS);
    }

    public Node getFailNode() {
        return findByKind(NodeKind.FAIL);
    }

    public List<Edge> getEdges() {
        List<Edge> edges = new ArrayList<>();
        for (Node n : nodes.values()) {
            edges.addAll(n.getEdges());
        }
        return edges;
    }

    /**
     * Finds a node by its internal name anywhere in this DAG or its branches. Returns null if not found.
     */
    public Node findByInternalName(String internalName) {
        if (internalName == null) return null;
        for (Node n : nodes.values()) {
            if (internalName.equals(n.getInternalName())) return n;
            for (Dag sub : bodies(n)) {
                Node found = sub.findByInternalName(internalName);
                if (found != null) return found;
            }
        }
        return null;
    }

    /**
     * Finds the node a concrete node path points at, e.g. {@code par.left.step} or {@code fan.item_3.step}.
     * A map iteration segment matches any value. Returns null if the path does not name a node of this DAG.
     */
    public Node locate(String path) {
        if (path == null || path.isBlank()) return null;
        return locate(path.split("\\."), 0);
    }

    private Node locate(String[] parts, int index) {
        Node node = nodes.get(parts[index]);
        if (node == null || index == parts.length - 1) {
            return node;
        }
        if (index + 2 >= parts.length) {
            return null;
        }
        Dag body = bodyFor(node, parts[index + 1]);
        return body != null ? body.locate(parts, index + 2) : null;
    }

    /**
     * Body DAG of a composite node for the given branch segment: the named branch for parallel,
     * the single branch for map (any segment) and for dag (segment {@value NodePaths#DAG_BRANCH}).
     */
    public static Dag bodyFor(Node node, String segment) {
        return switch (node.getKind()) {
            case PARALLEL -> node.getBranches().get(segment);
            case MAP -> node.getBranch();
            case DAG -> NodePaths.DAG_BRANCH.equals(segment) ? node.getBranch() : null;
            default -> null;
        };
    }

    private static List<Dag> bodies(Node n) {
        if (n.getKind() == NodeKind.PARALLEL) {
            return new ArrayList<>(n.getBranches().values());
        }
        return n.getBranch() != null ? List.of(n.getBranch()) : List.of();
    }

    private Node findByKind(NodeKind kind) {
        for (Node n : nodes.values()) {
            if (n.getKind() == kind) return n;
        }
        return null;
    }
}
