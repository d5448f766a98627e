package com.sluice.compute;

import java.util.Map;

/**
 * In-process task body for {@code java} nodes.
 */
@FunctionalInterface
public interface TaskFunction {

    /**
     * @return parameters to merge into the run, or null for none
     * @throws Exception any failure; it fails the attempt
     */
    Map<String, Object> run(TaskContext context) throws Exception;
}
