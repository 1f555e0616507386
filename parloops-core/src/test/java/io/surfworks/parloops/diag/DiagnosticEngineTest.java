package io.surfworks.parloops.diag;

import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.Operation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticEngineTest {

    private static Operation op() {
        return Operation.create("lhlo.reduce_window", Location.of("pool.mlir", 3, 5), List.of(), List.of(),
                Map.of(), 1);
    }

    @Test
    void formatsLikeCompilerDiagnostics() {
        Diagnostic d = new DiagnosticEngine().emitError(op(), "requires window strides");

        assertEquals("pool.mlir:3:5: error: 'lhlo.reduce_window' op requires window strides", d.toString());
        assertTrue(d.isError());
    }

    @Test
    void functionLevelDiagnosticsHaveNoOpName() {
        Diagnostic d = new DiagnosticEngine().emit(Severity.WARNING, Location.UNKNOWN, "nothing to do");

        assertNull(d.opName());
        assertEquals("<unknown>: warning: nothing to do", d.toString());
    }

    @Test
    void countsBySeverity() {
        DiagnosticEngine engine = new DiagnosticEngine();
        engine.emitError(op(), "a");
        engine.emitRemark(op(), "b");
        engine.emitRemark(op(), "c");

        assertEquals(1, engine.count(Severity.ERROR));
        assertEquals(0, engine.count(Severity.WARNING));
        assertEquals(2, engine.diagnostics(Severity.REMARK).size());
        assertTrue(engine.hasErrors());
        assertEquals("DiagnosticEngine[errors=1, warnings=0, remarks=2]", engine.toString());

        engine.clear();
        assertFalse(engine.hasErrors());
        assertTrue(engine.diagnostics().isEmpty());
    }

    @Test
    void diagnosticsAreKeptInEmissionOrder() {
        DiagnosticEngine engine = new DiagnosticEngine();
        engine.emitWarning(op(), "first");
        engine.emitError(op(), "second");

        assertEquals(List.of("first", "second"),
                engine.diagnostics().stream().map(Diagnostic::message).toList());
    }

    @Test
    void nullLocationBecomesUnknown() {
        assertEquals(Location.UNKNOWN, new Diagnostic(Severity.REMARK, null, null, "x").location());
    }

    @Test
    void severitiesMapToLogLevels() {
        assertEquals(Level.SEVERE, Severity.ERROR.logLevel());
        assertEquals(Level.WARNING, Severity.WARNING.logLevel());
        assertEquals(Level.INFO, Severity.REMARK.logLevel());
        assertEquals("remark", Severity.REMARK.label());
    }
}
