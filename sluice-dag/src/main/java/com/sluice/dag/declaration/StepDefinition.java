package com.sluice.dag.declaration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sluice.dag.node.NodeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step as declared in the pipeline file, before compilation. Which fields apply depends on {@link #getType()}:
 * task uses command/commandType/retry, map uses iterateOn/iterateAs/branch, parallel uses branches,
 * dag uses dagFile or dag. Catalog settings and modeConfig apply to task and as-is.
 */
public final class StepDefinition {

    private final NodeKind type;
    private final String description;
    private final String next;
    private final String onFailure;
    private final String command;
    private final String commandType;
    private final Integer retry;
    private final CatalogSettings catalog;
    private final Map<String, Object> modeConfig;
    private final Map<String, DagDefinition> branches;
    private final DagDefinition branch;
    private final String iterateOn;
    private final String iterateAs;
    private final String dagFile;
    private final DagDefinition dag;

    @JsonCreator
    public StepDefinition(
            @JsonProperty("type") NodeKind type,
            @JsonProperty("description") String description,
            @JsonProperty("next") String next,
            @JsonProperty("onFailure") String onFailure,
            @JsonProperty("command") String command,
            @JsonProperty("commandType") String commandType,
            @JsonProperty("retry") Integer retry,
            @JsonProperty("catalog") CatalogSettings catalog,
            @JsonProperty("modeConfig") Map<String, Object> modeConfig,
            @JsonProperty("branches") Map<String, DagDefinition> branches,
            @JsonProperty("branch") DagDefinition branch,
            @JsonProperty("iterateOn") String iterateOn,
            @JsonProperty("iterateAs") String iterateAs,
            @JsonProperty("dagFile") String dagFile,
            @JsonProperty("dag") DagDefinition dag) {
        this.type = type != null ? type : NodeKind.UNKNOWN;
        this.description = description;
        this.next = next;
        this.onFailure = onFailure;
        this.command = command;
        this.commandType = commandType;
        this.retry = retry;
        this.catalog = catalog;
        this.modeConfig = modeConfig != null ? Collections.unmodifiableMap(new LinkedHashMap<>(modeConfig)) : Map.of();
        this.branches = branches != null ? Collections.unmodifiableMap(new LinkedHashMap<>(branches)) : Map.of();
        this.branch = branch;
        this.iterateOn = iterateOn;
        this.iterateAs = iterateAs;
        this.dagFile = dagFile;
        this.dag = dag;
    }

    public static StepDefinition task(String command, String next) {
        return builder(NodeKind.TASK).command(command).next(next).build();
    }

    public static StepDefinition success() {
        return builder(NodeKind.SUCCESS).build();
    }

    public static StepDefinition fail() {
        return builder(NodeKind.FAIL).build();
    }

    public static Builder builder(NodeKind type) {
        return new Builder(type);
    }

    public NodeKind getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public String getNext() {
        return next;
    }

    public String getOnFailure() {
        return onFailure;
    }

    public String getCommand() {
        return command;
    }

    /** {@code shell} or {@code java}; null means shell. */
    public String getCommandType() {
        return commandType;
    }

    /** Max attempts for the compute backend; null means one attempt. */
    public Integer getRetry() {
        return retry;
    }

    public CatalogSettings getCatalog() {
        return catalog;
    }

    public Map<String, Object> getModeConfig() {
        return modeConfig;
    }

    /** Named branches of a parallel step, in declaration order. */
    public Map<String, DagDefinition> getBranches() {
        return branches;
    }

    public DagDefinition getBranch() {
        return branch;
    }

    public String getIterateOn() {
        return iterateOn;
    }

    public String getIterateAs() {
        return iterateAs;
    }

    public String getDagFile() {
        return dagFile;
    }

    public DagDefinition getDag() {
        return dag;
    }

    public static final class Builder {
        private final NodeKind type;
        private String description;
        private String next;
        private String onFailure;
        private String command;
        private String commandType;
        private Integer retry;
        private CatalogSettings catalog;
        private Map<String, Object> modeConfig;
        private final Map<String, DagDefinition> branches = new LinkedHashMap<>();
        private DagDefinition branch;
        private String iterateOn;
        private String iterateAs;
        private String dagFile;
        private DagDefinition dag;

        private Builder(NodeKind type) {
            this.type = type;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public Builder onFailure(String onFailure) {
            this.onFailure = onFailure;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder commandType(String commandType) {
            this.commandType = commandType;
            return this;
        }

        public Builder retry(Integer retry) {
            this.retry = retry;
            return this;
        }

        public Builder catalog(CatalogSettings catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder modeConfig(Map<String, Object> modeConfig) {
            this.modeConfig = modeConfig;
            return this;
        }

        public Builder branch(String name, DagDefinition branchDag) {
            this.branches.put(name, branchDag);
            return this;
        }

        public Builder iterate(String iterateOn, String iterateAs, DagDefinition branchDag) {
            this.iterateOn = iterateOn;
            this.iterateAs = iterateAs;
            this.branch = branchDag;
            return this;
        }

        public Builder dagFile(String dagFile) {
            this.dagFile = dagFile;
            return this;
        }

        public Builder dag(DagDefinition dag) {
            this.dag = dag;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(type, description, next, onFailure, command, commandType, retry, catalog,
                    modeConfig, branches, branch, iterateOn, iterateAs, dagFile, dag);
        }
    }
}
