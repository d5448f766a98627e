package com.sluice.engine.traversal;

import com.sluice.dag.node.Dag;
import com.sluice.engine.EngineInvariantException;
import com.sluice.engine.EngineTestSupport;
import com.sluice.runlog.StepStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BranchCursorTest {

    private static final Dag DAG = EngineTestSupport.compile("""
            {"startAt": "a", "steps": {
              "a": {"type": "task", "command": "echo a", "next": "b", "onFailure": "recover"},
              "b": {"type": "task", "command": "echo b", "next": "success"},
              "recover": {"type": "task", "command": "echo r", "next": "success"},
              "success": {"type": "success"},
              "fail": {"type": "fail"}}}
            """);

    private static void step(BranchCursor cursor, StepStatus outcome) {
        cursor.dispatch();
        cursor.resolve(outcome);
        cursor.advance();
    }

    @Test
    void successFollowsNextUntilSuccessNode() {
        BranchCursor cursor = new BranchCursor(DAG, null);
        assertEquals(CursorState.READY, cursor.getState());

        step(cursor, StepStatus.SUCCESS);
        assertEquals("b", cursor.current().getName());
        assertEquals(CursorState.ADVANCED, cursor.getState());
        step(cursor, StepStatus.SUCCESS);
        step(cursor, StepStatus.SUCCESS);

        assertTrue(cursor.isFinished());
        assertEquals(StepStatus.SUCCESS, cursor.getTerminalStatus());
    }

    @Test
    void failureFollowsOnFailureThenFailNode() {
        BranchCursor cursor = new BranchCursor(DAG, "par.left");

        step(cursor, StepStatus.FAILED);
        assertEquals("recover", cursor.current().getName());
        step(cursor, StepStatus.FAILED);
        assertEquals("fail", cursor.current().getName());
        step(cursor, StepStatus.SUCCESS);

        assertEquals(StepStatus.FAILED, cursor.getTerminalStatus());
    }

    @Test
    void transitionsOutOfOrderAreRejected() {
        BranchCursor cursor = new BranchCursor(DAG, null);

        assertThrows(EngineInvariantException.class, cursor::advance);
        cursor.dispatch();
        assertThrows(EngineInvariantException.class, cursor::dispatch);
        assertThrows(EngineInvariantException.class, () -> cursor.resolve(StepStatus.RUNNING));
        assertFalse(cursor.isFinished());
    }
}
