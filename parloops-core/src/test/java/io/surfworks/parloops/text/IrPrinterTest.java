package io.surfworks.parloops.text;

import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.Module;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Value;
import io.surfworks.parloops.lowering.LegalizeToParallelLoopsPass;
import io.surfworks.parloops.pass.PassContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrPrinterTest {

    @Test
    void printsGenericForm() {
        Function f = new Function("copy_first", List.of(MemRefType.of(ScalarType.F32, 4), MemRefType.scalar(ScalarType.F32)));
        OpBuilder b = OpBuilder.atEnd(f.body());
        Value c0 = StdOps.constantIndex(b, Location.UNKNOWN, 0);
        Value v = StdOps.load(b, Location.UNKNOWN, f.argument(0), List.of(c0));
        StdOps.store(b, Location.UNKNOWN, v, f.argument(1), List.of());
        StdOps.ret(b, Location.UNKNOWN);

        String expected = """
            func.func @copy_first(%arg0: memref<4xf32>, %arg1: memref<f32>) {
              %0 = "std.constant"() {value = 0} : () -> index
              %1 = "std.load"(%arg0, %0) : (memref<4xf32>, index) -> f32
              "std.store"(%1, %arg1) : (f32, memref<f32>) -> ()
              "std.return"() : () -> ()
            }
            """;
        assertEquals(expected, IrPrinter.print(f));
    }

    @Test
    void printsRegionsWithBlockLabels() {
        Function f = new Function("loop", List.of());
        OpBuilder b = OpBuilder.atEnd(f.body());
        Value c0 = StdOps.constantIndex(b, Location.UNKNOWN, 0);
        Value c4 = StdOps.constantIndex(b, Location.UNKNOWN, 4);
        Value c1 = StdOps.constantIndex(b, Location.UNKNOWN, 1);
        LoopOps.parallel(b, Location.UNKNOWN, List.of(c0), List.of(c4), List.of(c1));

        String text = IrPrinter.print(f);
        assertTrue(text.contains("\"loop.parallel\"(%0, %1, %2) ({\n  ^bb0(%arg0: index):\n"), text);
        assertTrue(text.contains("    \"loop.yield\"() : () -> ()\n  }) {operand_segment_sizes = dense<[1, 1, 1, 0]>}"),
                text);
    }

    @Test
    void loweredModuleRoundTrips() {
        Module module = IrParser.parse(IrParserTest.ROW_SUM);
        new LegalizeToParallelLoopsPass().run(module.functions().get(0), new PassContext());

        String printed = IrPrinter.print(module);
        String reprinted = IrPrinter.print(IrParser.parse(printed));

        assertEquals(printed, reprinted);
        assertFalse(printed.contains("lhlo.reduce\""));
        assertTrue(printed.startsWith("module @test {\n"));
    }

    @Test
    void printingIsDeterministic() {
        Module module = IrParser.parse(IrParserTest.ROW_SUM);
        assertEquals(IrPrinter.print(module), IrPrinter.print(module));
    }
}
