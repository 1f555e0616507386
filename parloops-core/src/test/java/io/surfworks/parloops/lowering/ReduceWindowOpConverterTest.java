package io.surfworks.parloops.lowering;

import io.surfworks.parloops.config.AttributePolicy;
import io.surfworks.parloops.config.DilationPolicy;
import io.surfworks.parloops.config.LoweringOptions;
import io.surfworks.parloops.diag.Diagnostic;
import io.surfworks.parloops.diag.DiagnosticEngine;
import io.surfworks.parloops.diag.Severity;
import io.surfworks.parloops.dialect.CmpIPredicate;
import io.surfworks.parloops.dialect.IrVerifier;
import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.exec.Buffer;
import io.surfworks.parloops.exec.Interpreter;
import io.surfworks.parloops.ir.Attributes.BoolAttr;
import io.surfworks.parloops.ir.Attributes.DenseIntAttr;
import io.surfworks.parloops.ir.Attributes.StringAttr;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.pass.PassResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.surfworks.parloops.lowering.LoweringFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReduceWindowOpConverterTest {

    private static Function maxPool() {
        return windowFunction(f32(4, 4), f32(2, 2), List.of(2L, 2L), List.of(2L, 2L),
                symmetricPadding(0, 2), LhloOps.MAXIMUM);
    }

    private static Function paddedSum() {
        return windowFunction(f32(3, 3), f32(3, 3), List.of(3L, 3L), List.of(1L, 1L),
                symmetricPadding(1, 2), LhloOps.ADD);
    }

    private static Buffer iota(int rows, int cols) {
        double[] values = new double[rows * cols];
        for (int i = 0; i < values.length; i++) {
            values[i] = i + 1;
        }
        return Buffer.of(ScalarType.F32, new int[] {rows, cols}, values);
    }

    @Nested
    @DisplayName("Generated loop structure")
    class StructureTests {

        @Test
        void outputLoopContainsWindowLoop() {
            Function f = maxPool();
            PassResult result = lower(f);

            assertTrue(result.succeeded(), result.message());
            assertEquals(0, count(f, LhloOps.REDUCE_WINDOW));
            List<Operation> loops = ops(f, LoopOps.PARALLEL);
            assertEquals(2, loops.size());

            LoopOps.ParallelOp outer = new LoopOps.ParallelOp(loops.get(0));
            LoopOps.ParallelOp window = new LoopOps.ParallelOp(loops.get(1));
            assertEquals(2, outer.numLoops());
            assertTrue(outer.initValues().isEmpty());
            assertEquals(2, window.numLoops());
            assertEquals(1, window.initValues().size());
            assertSame(outer.op(), window.op().parentOp());

            Operation store = outer.body().operations().stream()
                    .filter(op -> op.isA(StdOps.STORE)).findFirst().orElseThrow();
            assertSame(window.results().get(0), store.operand(0));
            assertSame(f.argument(2), store.operand(1));
            assertEquals(outer.inductionVars(), store.operands().subList(2, 4));
        }

        @Test
        void boundsCheckStartsFromTrueAndUsesUnsignedCompares() {
            Function f = maxPool();
            lower(f);

            List<Operation> compares = ops(f, StdOps.CMPI);
            assertEquals(2, compares.size());
            for (Operation cmp : compares) {
                assertEquals(new StringAttr(CmpIPredicate.ULT.mnemonic()), cmp.attribute(StdOps.PREDICATE_ATTR));
            }
            List<Operation> ands = ops(f, StdOps.AND);
            assertEquals(2, ands.size());
            Operation seed = ands.get(0).operand(0).definingOp();
            assertEquals(new BoolAttr(true), seed.attribute(StdOps.VALUE_ATTR));
            assertSame(ands.get(0).result(), ands.get(1).operand(0));
        }

        @Test
        void elseBranchYieldsInit() {
            Function f = paddedSum();
            lower(f);

            LoopOps.ParallelOp window = new LoopOps.ParallelOp(ops(f, LoopOps.PARALLEL).get(1));
            LoopOps.IfOp ifOp = new LoopOps.IfOp(ops(f, LoopOps.IF).get(0));

            assertTrue(ifOp.hasElse());
            assertEquals(List.of(StdOps.LOAD, LoopOps.YIELD),
                    ifOp.thenBlock().operations().stream().map(Operation::name).toList());
            Operation elseYield = ifOp.elseBlock().terminator();
            assertSame(window.initValues().get(0), elseYield.operand(0));

            Operation reduce = ops(f, LoopOps.REDUCE).get(0);
            assertSame(ifOp.results().get(0), reduce.operand(0));
        }

        @Test
        void dynamicOutputAndOperandExtentsAreQueried() {
            Function f = windowFunction(f32(IrTypes.DYNAMIC, 4), f32(IrTypes.DYNAMIC, 4), List.of(1L, 1L),
                    List.of(1L, 1L), symmetricPadding(0, 2), LhloOps.ADD);
            lower(f);

            List<Operation> dims = ops(f, StdOps.DIM);
            assertEquals(2, dims.size());
            assertSame(f.argument(2), dims.get(0).operand(0));
            assertSame(f.argument(0), dims.get(1).operand(0));
        }

        @Test
        void loweredFunctionVerifies() {
            Function f = paddedSum();
            lower(f);
            assertEquals(List.of(), new IrVerifier().validate(f));
        }
    }

    @Nested
    @DisplayName("Execution of lowered windows")
    class ExecutionTests {

        @Test
        void maxPoolTwoByTwo() {
            Function f = maxPool();
            lower(f);

            Buffer out = Buffer.zeros(ScalarType.F32, 2, 2);
            new Interpreter().run(f, iota(4, 4), Buffer.scalar(ScalarType.F32, Double.NEGATIVE_INFINITY), out);

            assertArrayEquals(new double[] {6, 8, 14, 16}, out.toArray());
        }

        @Test
        void paddedNeighborhoodSum() {
            Function f = paddedSum();
            lower(f);

            Buffer input = iota(3, 3);
            Buffer out = Buffer.zeros(ScalarType.F32, 3, 3);
            new Interpreter().run(f, input, Buffer.scalar(ScalarType.F32, 0), out);

            double[] expected = new double[9];
            for (int i = 0; i < 3; i++) {
                for (int j = 0; j < 3; j++) {
                    double sum = 0;
                    for (int di = -1; di <= 1; di++) {
                        for (int dj = -1; dj <= 1; dj++) {
                            int r = i + di;
                            int c = j + dj;
                            if (r >= 0 && r < 3 && c >= 0 && c < 3) {
                                sum += input.get(r, c);
                            }
                        }
                    }
                    expected[i * 3 + j] = sum;
                }
            }
            assertArrayEquals(expected, out.toArray());
            assertEquals(12, out.get(0, 0));
            assertEquals(45, out.get(1, 1));
        }

        @Test
        void paddingTapsNeverReadTheOperand() {
            Function f = paddedSum();
            lower(f);

            Buffer input = Buffer.filled(ScalarType.F32, 1, 3, 3);
            Buffer out = Buffer.zeros(ScalarType.F32, 3, 3);
            new Interpreter().run(f, input, Buffer.scalar(ScalarType.F32, 0), out);

            // 4 corners see 4 taps, 4 edges 6, the center 9.
            assertEquals(4 * 4 + 4 * 6 + 9, input.loadCount());
            assertArrayEquals(new double[] {4, 6, 4, 6, 9, 6, 4, 6, 4}, out.toArray());
        }

        @Test
        void asymmetricStrides() {
            Function f = windowFunction(f32(2, 6), f32(2, 2), List.of(1L, 3L), List.of(1L, 3L),
                    symmetricPadding(0, 2), LhloOps.ADD);
            lower(f);

            Buffer out = Buffer.zeros(ScalarType.F32, 2, 2);
            new Interpreter().run(f, iota(2, 6), Buffer.scalar(ScalarType.F32, 0), out);

            assertArrayEquals(new double[] {1 + 2 + 3, 4 + 5 + 6, 7 + 8 + 9, 10 + 11 + 12}, out.toArray());
        }
    }

    @Nested
    @DisplayName("Attribute policies")
    class PolicyTests {

        private Function withoutStridesAndPadding() {
            return windowFunction(f32(4), f32(3), List.of(2L), null, null, LhloOps.ADD);
        }

        @Test
        void lenientReportsAndLowersWithDefaults() {
            Function f = withoutStridesAndPadding();
            DiagnosticEngine diagnostics = new DiagnosticEngine();

            PassResult result = lower(f, LoweringOptions.defaults(), diagnostics);

            assertTrue(result.succeeded(), result.message());
            List<String> messages = diagnostics.diagnostics(Severity.ERROR).stream()
                    .map(Diagnostic::message).toList();
            assertEquals(List.of(ReduceWindowOpConverter.NO_STRIDES, ReduceWindowOpConverter.NO_PADDING), messages);

            Buffer out = Buffer.zeros(ScalarType.F32, 3);
            new Interpreter().run(f, Buffer.of(ScalarType.F32, new int[] {4}, 1, 2, 3, 4),
                    Buffer.scalar(ScalarType.F32, 0), out);
            assertArrayEquals(new double[] {3, 5, 7}, out.toArray());
        }

        @Test
        void strictRefusesAndLeavesFunctionUntouched() {
            Function f = withoutStridesAndPadding();
            List<String> before = opNames(f);
            DiagnosticEngine diagnostics = new DiagnosticEngine();

            PassResult result = lower(f, LoweringOptions.defaults().withAttributePolicy(AttributePolicy.STRICT),
                    diagnostics);

            assertFalse(result.succeeded());
            assertEquals(2, diagnostics.count(Severity.ERROR));
            assertEquals(before, opNames(f));
            assertEquals(1, count(f, LhloOps.REDUCE_WINDOW));
        }

        @Test
        void strictAcceptsCompleteAttributes() {
            Function f = maxPool();
            DiagnosticEngine diagnostics = new DiagnosticEngine();
            PassResult result = lower(f, LoweringOptions.defaults().withAttributePolicy(AttributePolicy.STRICT),
                    diagnostics);

            assertTrue(result.succeeded());
            assertTrue(diagnostics.diagnostics().isEmpty());
        }

        @Test
        void dilationIsIgnoredWithRemark() {
            Function f = maxPool();
            Operation op = f.body().operations().get(0);
            op.setAttribute(LhloOps.WINDOW_DILATIONS_ATTR, DenseIntAttr.vector(2, 2));
            DiagnosticEngine diagnostics = new DiagnosticEngine();

            PassResult result = lower(f, LoweringOptions.defaults(), diagnostics);

            assertTrue(result.succeeded());
            List<Diagnostic> remarks = diagnostics.diagnostics(Severity.REMARK);
            assertEquals(1, remarks.size());
            assertEquals(ReduceWindowOpConverter.DILATION_IGNORED, remarks.get(0).message());
            assertEquals(LhloOps.REDUCE_WINDOW, remarks.get(0).opName());
            assertFalse(diagnostics.hasErrors());
        }

        @Test
        void dilationRejected() {
            Function f = maxPool();
            f.body().operations().get(0).setAttribute(LhloOps.BASE_DILATIONS_ATTR, DenseIntAttr.vector(1, 2));
            DiagnosticEngine diagnostics = new DiagnosticEngine();

            PassResult result = lower(f, LoweringOptions.defaults().withDilationPolicy(DilationPolicy.REJECT),
                    diagnostics);

            assertFalse(result.succeeded());
            assertEquals(ReduceWindowOpConverter.DILATION_REJECTED,
                    diagnostics.diagnostics(Severity.ERROR).get(0).message());
            assertEquals(1, count(f, LhloOps.REDUCE_WINDOW));
        }

        @Test
        void mismatchedStrideLengthIsReported() {
            Function f = windowFunction(f32(4, 4), f32(2, 2), List.of(2L, 2L), List.of(2L),
                    symmetricPadding(0, 2), LhloOps.MAXIMUM);
            DiagnosticEngine diagnostics = new DiagnosticEngine();

            PassResult result = lower(f, LoweringOptions.defaults(), diagnostics);

            assertFalse(result.succeeded());
            assertTrue(diagnostics.hasErrors());
            assertEquals(0, count(f, LoopOps.PARALLEL));
        }
    }
}
