package com.sluice.runlog.schema;

import com.sluice.runlog.RunLogException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunLogSchemaBootstrapperTest {

    @Test
    void statements_dropCommentsAndBlanks() {
        List<String> statements = RunLogSchemaBootstrapper.statements("""
                -- header
                CREATE TABLE t (a INT);
                  -- indented comment
                CREATE INDEX i ON t (a);
                ;
                """);

        assertEquals(List.of("CREATE TABLE t (a INT)", "CREATE INDEX i ON t (a)"), statements);
    }

    @Test
    void bundledScriptCreatesRunLogTable() {
        List<String> statements = RunLogSchemaBootstrapper.statements(new RunLogSchemaBootstrapper().loadSchemaScript());

        assertEquals(2, statements.size());
        assertTrue(statements.get(0).startsWith("CREATE TABLE IF NOT EXISTS sluice_run_log"));
    }

    @Test
    void missingScriptIsReported() {
        RunLogSchemaBootstrapper bootstrapper = new RunLogSchemaBootstrapper("schema/none.sql");

        assertThrows(RunLogException.class, () -> bootstrapper.ensureSchema(() -> {
            throw new AssertionError("no connection expected");
        }));
    }
}
