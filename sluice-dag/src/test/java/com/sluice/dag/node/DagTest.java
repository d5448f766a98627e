package com.sluice.dag.node;

import com.sluice.dag.declaration.DagDefinition;
import com.sluice.dag.declaration.StepDefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DagTest {

    private static DagDefinition single(String task) {
        return DagDefinition.builder(task)
                .step(task, StepDefinition.task("echo", "success"))
                .step("success", StepDefinition.success())
                .step("fail", StepDefinition.fail())
                .build();
    }

    private final Dag dag = new DagCompiler().compile(DagDefinition.builder("par")
            .step("par", StepDefinition.builder(NodeKind.PARALLEL)
                    .branch("left", single("l1"))
                    .branch("right", single("r1"))
                    .next("fan").build())
            .step("fan", StepDefinition.builder(NodeKind.MAP).iterate("items", "item", single("m1")).next("sub").build())
            .step("sub", StepDefinition.builder(NodeKind.DAG).dag(single("s1")).next("success").build())
            .step("success", StepDefinition.success())
            .step("fail", StepDefinition.fail())
            .build());

    @Test
    void locate_findsTopLevelAndNestedNodes() {
        assertEquals("par", dag.locate("par").getName());
        assertEquals("par.right.r1", dag.locate("par.right.r1").getInternalName());
        assertEquals("fan.map_variable_placeholder.m1", dag.locate("fan.anything.m1").getInternalName());
        assertEquals("sub.dag.s1", dag.locate("sub.dag.s1").getInternalName());
        assertEquals(NodeKind.SUCCESS, dag.locate("par.left.success").getKind());
    }

    @Test
    void locate_returnsNullForUnknownPaths() {
        assertNull(dag.locate("missing"));
        assertNull(dag.locate("par.middle.l1"));
        assertNull(dag.locate("par.left"));
        assertNull(dag.locate("sub.notdag.s1"));
        assertNull(dag.locate("par.left.l1.deeper"));
        assertNull(dag.locate(""));
    }
}
