package com.sluice.dag.node;

import com.sluice.dag.declaration.CatalogSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled node: one type for every kind. Composite kinds carry their body as {@link Dag} values
 * ({@link #getBranches()} for parallel, {@link #getBranch()} for map and dag), so traversal recurses uniformly.
 */
public final class Node {

    private final String name;
    private final String internalName;
    private final NodeKind kind;
    private final String description;
    private final String next;
    private final String onFailure;
    private final String command;
    private final String commandType;
    private final int maxAttempts;
    private final CatalogSettings catalog;
    private final Map<String, Object> modeConfig;
    private final Map<String, Dag> branches;
    private final Dag branch;
    private final String iterateOn;
    private final String iterateAs;

    private Node(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.internalName = Objects.requireNonNull(b.internalName, "internalName");
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.description = b.description;
        this.next = b.next;
        this.onFailure = b.onFailure;
        this.command = b.command;
        this.commandType = b.commandType != null ? b.commandType : "shell";
        this.maxAttempts = Math.max(1, b.maxAttempts);
        this.catalog = b.catalog;
        this.modeConfig = b.modeConfig != null ? Collections.unmodifiableMap(new LinkedHashMap<>(b.modeConfig)) : Map.of();
        this.branches = Collections.unmodifiableMap(new LinkedHashMap<>(b.branches));
        this.branch = b.branch;
        this.iterateOn = b.iterateOn;
        this.iterateAs = b.iterateAs;
    }

    static Builder builder(String name, String internalName, NodeKind kind) {
        return new Builder(name, internalName, kind);
    }

    public String getName() {
        return name;
    }

    /** Path template of this node; contains {@link NodePaths#MAP_PLACEHOLDER} inside map branches. */
    public String getInternalName() {
        return internalName;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    /** Name of the successor on success; null only for terminal nodes. */
    public String getNext() {
        return next;
    }

    /** Name of the successor on failure; null when failure ends the branch. */
    public String getOnFailure() {
        return onFailure;
    }

    public String getCommand() {
        return command;
    }

    public String getCommandType() {
        return commandType;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Catalog settings; null when the step declares none. */
    public CatalogSettings getCatalog() {
        return catalog;
    }

    public Map<String, Object> getModeConfig() {
        return modeConfig;
    }

    public Map<String, Dag> getBranches() {
        return branches;
    }

    public Dag getBranch() {
        return branch;
    }

    public String getIterateOn() {
        return iterateOn;
    }

    public String getIterateAs() {
        return iterateAs;
    }

    public boolean isTerminal() {
        return kind.isTerminal();
    }

    public boolean isComposite() {
        return kind.isComposite();
    }

    public List<Edge> getEdges() {
        List<Edge> edges = new ArrayList<>(2);
        if (next != null) edges.add(new Edge(name, next, EdgeKind.NEXT));
        if (onFailure != null) edges.add(new Edge(name, onFailure, EdgeKind.ON_FAILURE));
        return edges;
    }

    @Override
    public String toString() {
        return "Node{" + internalName + ", kind=" + kind.toValue() + "}";
    }

    static final class Builder {
        private final String name;
        private final String internalName;
        private final NodeKind kind;
        private String description;
        private String next;
        private String onFailure;
        private String command;
        private String commandType;
        private int maxAttempts = 1;
        private CatalogSettings catalog;
        private Map<String, Object> modeConfig;
        private final Map<String, Dag> branches = new LinkedHashMap<>();
        private Dag branch;
        private String iterateOn;
        private String iterateAs;

        private Builder(String name, String internalName, NodeKind kind) {
            this.name = name;
            this.internalName = internalName;
            this.kind = kind;
        }

        Builder description(String description) {
            this.description = description;
            return this;
        }

        Builder next(String next) {
            this.next = next;
            return this;
        }

        Builder onFailure(String onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        Builder command(String command, String commandType) {
            this.command = command;
            this.commandType = commandType;
            return this;
        }

        Builder maxAttempts(Integer maxAttempts) {
            this.maxAttempts = maxAttempts != null ? maxAttempts : 1;
            return this;
        }

        Builder catalog(CatalogSettings catalog) {
            this.catalog = catalog;
            return this;
        }

        Builder modeConfig(Map<String, Object> modeConfig) {
            this.modeConfig = modeConfig;
            return this;
        }

        Builder branch(String branchName, Dag dag) {
            this.branches.put(branchName, dag);
            return this;
        }

        Builder body(Dag dag) {
            this.branch = dag;
            return this;
        }

        Builder iterate(String iterateOn, String iterateAs) {
            this.iterateOn = iterateOn;
            this.iterateAs = iterateAs;
            return this;
        }

        Node build() {
            return new Node(this);
        }
    }
}
