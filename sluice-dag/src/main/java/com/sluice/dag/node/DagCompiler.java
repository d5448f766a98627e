package com.sluice.dag.node;

import com.sluice.dag.declaration.DagDefinition;
import com.sluice.dag.declaration.StepDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a {@link DagDefinition} into an immutable {@link Dag}, validating the root DAG and every
 * branch DAG independently. All problems are collected and raised together as one {@link DagCompileException}.
 */
public final class DagCompiler {

    private static final Logger log = LoggerFactory.getLogger(DagCompiler.class);

    private static final Set<String> COMMAND_TYPES = Set.of("shell", "java");

    private final DagFileResolver dagFileResolver;

    /** Compiler without dag file support; dag steps must declare their body inline. */
    public DagCompiler() {
        this(null);
    }

    public DagCompiler(DagFileResolver dagFileResolver) {
        this.dagFileResolver = dagFileResolver;
    }

    public Dag compile(DagDefinition definition) {
        List<String> problems = new ArrayList<>();
        Dag dag = compile(definition, null, problems, new ArrayDeque<>());
        if (!problems.isEmpty()) {
            log.warn("DAG compile failed | problems={}", problems.size());
            throw new DagCompileException(problems);
        }
        log.debug("DAG compiled | startAt={} | nodes={}", dag.getStartAt(), dag.size());
        return dag;
    }

    private Dag compile(DagDefinition def, String branchName, List<String> problems, Deque<String> dagFiles) {
        String where = branchName == null ? "dag" : "branch " + branchName;
        if (def == null) {
            problems.add(where + ": missing declaration");
            return null;
        }
        Map<String, StepDefinition> steps = def.getSteps();
        if (steps.isEmpty()) {
            problems.add(where + ": no steps declared");
        }
        String startAt = def.getStartAt();
        if (startAt == null || startAt.isBlank()) {
            problems.add(where + ": startAt is required");
        } else if (!steps.containsKey(startAt)) {
            problems.add(where + ": startAt '" + startAt + "' is not a step");
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        int successCount = 0;
        int failCount = 0;
        for (Map.Entry<String, StepDefinition> e : steps.entrySet()) {
            String name = e.getKey();
            StepDefinition step = e.getValue();
            if (!NodePaths.isValidSegment(name)) {
                problems.add(where + ": step name '" + name + "' must be non-blank and must not contain '.' or '%'");
            }
            if (step == null) {
                problems.add(where + ": step '" + name + "' has no definition");
                continue;
            }
            NodeKind kind = step.getType();
            String internalName = NodePaths.child(branchName, name);
            Node.Builder b = Node.builder(name, internalName, kind)
                    .description(step.getDescription())
                    .next(step.getNext())
                    .onFailure(step.getOnFailure());
            switch (kind) {
                case UNKNOWN -> problems.add(where + ": step '" + name + "' has an unknown type");
                case SUCCESS -> successCount++;
                case FAIL -> failCount++;
                case TASK -> {
                    if (step.getCommand() == null || step.getCommand().isBlank()) {
                        problems.add(where + ": task '" + name + "' has no command");
                    }
                    compileLeaf(b, step, where, name, problems);
                }
                case AS_IS -> compileLeaf(b, step, where, name, problems);
                case PARALLEL -> {
                    if (step.getBranches().isEmpty()) {
                        problems.add(where + ": parallel '" + name + "' has no branches");
                    }
                    for (Map.Entry<String, DagDefinition> br : step.getBranches().entrySet()) {
                        if (!NodePaths.isValidSegment(br.getKey())) {
                            problems.add(where + ": branch name '" + br.getKey() + "' of '" + name + "' is invalid");
                        }
                        Dag body = compile(br.getValue(), NodePaths.child(internalName, br.getKey()), problems, dagFiles);
                        if (body != null) b.branch(br.getKey(), body);
                    }
                }
                case MAP -> {
                    if (step.getIterateOn() == null || step.getIterateOn().isBlank()) {
                        problems.add(where + ": map '" + name + "' has no iterateOn");
                    }
                    if (step.getIterateAs() == null || step.getIterateAs().isBlank()) {
                        problems.add(where + ": map '" + name + "' has no iterateAs");
                    }
                    b.iterate(step.getIterateOn(), step.getIterateAs());
                    if (step.getBranch() == null) {
                        problems.add(where + ": map '" + name + "' has no branch");
                    } else {
                        b.body(compile(step.getBranch(), NodePaths.child(internalName, NodePaths.MAP_PLACEHOLDER), problems, dagFiles));
                    }
                }
                case DAG -> b.body(compileEmbedded(step, where, name, internalName, problems, dagFiles));
            }
            checkEdges(step, kind, where, name, steps, problems);
            nodes.put(name, b.build());
        }
        if (successCount != 1) {
            problems.add(where + ": expected exactly one success step, found " + successCount);
        }
        if (failCount != 1) {
            problems.add(where + ": expected exactly one fail step, found " + failCount);
        }
        checkAcyclic(nodes, where, problems);
        checkTerminalReachable(nodes, where, problems);
        int maxTime = def.getMaxTime() != null ? def.getMaxTime() : DagDefinition.DEFAULT_MAX_TIME_SECONDS;
        return new Dag(branchName, def.getDescription(), startAt, maxTime, nodes);
    }

    private static void compileLeaf(Node.Builder b, StepDefinition step, String where, String name, List<String> problems) {
        String commandType = step.getCommandType() != null ? step.getCommandType().trim().toLowerCase() : null;
        if (commandType != null && !COMMAND_TYPES.contains(commandType)) {
            problems.add(where + ": step '" + name + "' has unsupported commandType '" + step.getCommandType() + "'");
        }
        if (step.getRetry() != null && step.getRetry() < 1) {
            problems.add(where + ": step '" + name + "' retry must be at least 1");
        }
        b.command(step.getCommand(), commandType)
                .maxAttempts(step.getRetry())
                .catalog(step.getCatalog())
                .modeConfig(step.getModeConfig());
    }

    private Dag compileEmbedded(StepDefinition step, String where, String name, String internalName,
                                List<String> problems, Deque<String> dagFiles) {
        String branchName = NodePaths.child(internalName, NodePaths.DAG_BRANCH);
        if (step.getDag() != null) {
            return compile(step.getDag(), branchName, problems, dagFiles);
        }
        String dagFile = step.getDagFile();
        if (dagFile == null || dagFile.isBlank()) {
            problems.add(where + ": dag '" + name + "' has neither dagFile nor an inline dag");
            return null;
        }
        if (dagFileResolver == null) {
            problems.add(where + ": dag '" + name + "' references dagFile '" + dagFile + "' but no resolver is configured");
            return null;
        }
        if (dagFiles.contains(dagFile)) {
            problems.add(where + ": dag '" + name + "' includes '" + dagFile + "' recursively");
            return null;
        }
        DagDefinition resolved;
        try {
            resolved = dagFileResolver.resolve(dagFile);
        } catch (RuntimeException e) {
            problems.add(where + ": dag '" + name + "' could not load '" + dagFile + "': " + e.getMessage());
            return null;
        }
        dagFiles.push(dagFile);
        try {
            return compile(resolved, branchName, problems, dagFiles);
        } finally {
            dagFiles.pop();
        }
    }

    private static void checkEdges(StepDefinition step, NodeKind kind, String where, String name,
                                   Map<String, StepDefinition> steps, List<String> problems) {
        String next = step.getNext();
        String onFailure = step.getOnFailure();
        if (kind.isTerminal()) {
            if (next != null || onFailure != null) {
                problems.add(where + ": terminal step '" + name + "' must not declare next or onFailure");
            }
            return;
        }
        if (kind != NodeKind.UNKNOWN && (next == null || next.isBlank())) {
            problems.add(where + ": step '" + name + "' has no next step");
        }
        if (next != null && !next.isBlank() && !steps.containsKey(next)) {
            problems.add(where + ": next '" + next + "' of step '" + name + "' is not a step");
        }
        if (onFailure != null && !steps.containsKey(onFailure)) {
            problems.add(where + ": onFailure '" + onFailure + "' of step '" + name + "' is not a step");
        }
    }

    private static void checkAcyclic(Map<String, Node> nodes, String where, List<String> problems) {
        Map<String, Integer> state = new HashMap<>();
        for (String name : nodes.keySet()) {
            if (!state.containsKey(name) && hasCycle(name, nodes, state)) {
                problems.add(where + ": cycle detected through step '" + name + "'");
                return;
            }
        }
    }

    /** Depth-first search; state 1 = on the current path, 2 = finished. */
    private static boolean hasCycle(String name, Map<String, Node> nodes, Map<String, Integer> state) {
        state.put(name, 1);
        for (Edge edge : nodes.get(name).getEdges()) {
            if (!nodes.containsKey(edge.to())) continue;
            Integer s = state.get(edge.to());
            if (s != null && s == 1) return true;
            if (s == null && hasCycle(edge.to(), nodes, state)) return true;
        }
        state.put(name, 2);
        return false;
    }

    private static void checkTerminalReachable(Map<String, Node> nodes, String where, List<String> problems) {
        Map<String, List<String>> reverse = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (Node n : nodes.values()) {
            if (n.isTerminal()) queue.add(n.getName());
            for (Edge edge : n.getEdges()) {
                reverse.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge.from());
            }
        }
        Set<String> reaching = new HashSet<>(queue);
        while (!queue.isEmpty()) {
            for (String from : reverse.getOrDefault(queue.poll(), List.of())) {
                if (reaching.add(from)) queue.add(from);
            }
        }
        for (String name : nodes.keySet()) {
            if (!reaching.contains(name)) {
                problems.add(where + ": step '" + name + "' cannot reach a success or fail step");
            }
        }
    }
}
