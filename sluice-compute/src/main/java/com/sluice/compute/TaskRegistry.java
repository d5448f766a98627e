package com.sluice.compute;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Java task functions by name. A {@code java} node's command is the name it was registered under.
 */
public final class TaskRegistry {

    private final Map<String, TaskFunction> tasks = new ConcurrentHashMap<>();

    public TaskRegistry register(String name, TaskFunction task) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(task, "task");
        if (tasks.putIfAbsent(name, task) != null) {
            throw new IllegalArgumentException("Task already registered: " + name);
        }
        return this;
    }

    public Optional<TaskFunction> find(String name) {
        return Optional.ofNullable(name != null ? tasks.get(name) : null);
    }

    public Set<String> names() {
        return Set.copyOf(tasks.keySet());
    }
}
