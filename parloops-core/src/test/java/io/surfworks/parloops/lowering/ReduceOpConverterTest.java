package io.surfworks.parloops.lowering;

import io.surfworks.parloops.diag.DiagnosticEngine;
import io.surfworks.parloops.diag.Severity;
import io.surfworks.parloops.config.LoweringOptions;
import io.surfworks.parloops.dialect.IrVerifier;
import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.exec.Buffer;
import io.surfworks.parloops.exec.Interpreter;
import io.surfworks.parloops.ir.Attributes.IntegerAttr;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes;
import io.surfworks.parloops.ir.IrTypes.IndexType;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;
import io.surfworks.parloops.pass.PassResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.surfworks.parloops.lowering.LoweringFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReduceOpConverterTest {

    private static List<String> names(Block block) {
        return block.operations().stream().map(Operation::name).toList();
    }

    @Nested
    @DisplayName("Generated loop structure")
    class StructureTests {

        @Test
        void rowSumBuildsOuterAndReductionLoops() {
            Function f = reduceFunction(f32(2, 3), f32(2), List.of(1L), LhloOps.ADD);

            PassResult result = lower(f);

            assertTrue(result.succeeded(), result.message());
            assertEquals(1, result.rewrites());
            assertEquals(0, count(f, LhloOps.REDUCE));
            assertEquals(List.of(StdOps.CONSTANT, StdOps.CONSTANT, StdOps.CONSTANT, StdOps.CONSTANT,
                    StdOps.LOAD, LoopOps.PARALLEL, StdOps.RETURN), names(f.body()));

            LoopOps.ParallelOp outer = new LoopOps.ParallelOp(f.body().operations().get(5));
            assertEquals(1, outer.numLoops());
            assertTrue(outer.initValues().isEmpty());
            assertEquals(List.of(LoopOps.PARALLEL, StdOps.STORE, LoopOps.YIELD), names(outer.body()));

            LoopOps.ParallelOp inner = new LoopOps.ParallelOp(outer.body().operations().get(0));
            assertEquals(1, inner.numLoops());
            assertEquals(1, inner.initValues().size());
            assertSame(f.body().operations().get(4).result(), inner.initValues().get(0));
            assertEquals(List.of(StdOps.LOAD, LoopOps.REDUCE, LoopOps.YIELD), names(inner.body()));

            Operation store = outer.body().operations().get(1);
            assertSame(inner.results().get(0), store.operand(0));
            assertSame(f.argument(2), store.operand(1));
            assertSame(outer.inductionVars().get(0), store.operand(2));
        }

        @Test
        void combinerBridgesBuffersAndScalars() {
            Function f = reduceFunction(f32(2, 3), f32(2), List.of(1L), LhloOps.ADD);
            lower(f);

            LoopOps.ReduceOp reduce = new LoopOps.ReduceOp(ops(f, LoopOps.REDUCE).get(0));
            assertEquals(List.of(StdOps.ALLOC, StdOps.ALLOC, StdOps.STORE, StdOps.STORE, LhloOps.ADD,
                    StdOps.LOAD, LoopOps.REDUCE_RETURN), names(reduce.body()));
        }

        @Test
        void bounds() {
            Function f = reduceFunction(f32(2, 3), f32(2), List.of(1L), LhloOps.ADD);
            lower(f);

            LoopOps.ParallelOp outer = new LoopOps.ParallelOp(ops(f, LoopOps.PARALLEL).get(0));
            LoopOps.ParallelOp inner = new LoopOps.ParallelOp(ops(f, LoopOps.PARALLEL).get(1));
            assertEquals(0, constant(outer.lowerBounds().get(0)));
            assertEquals(2, constant(outer.upperBounds().get(0)));
            assertEquals(1, constant(outer.steps().get(0)));
            assertEquals(3, constant(inner.upperBounds().get(0)));
        }

        @Test
        void operandSubscriptInterleavesInductionVariables() {
            Function f = reduceFunction(f32(2, 3, 4), f32(2, 4), List.of(1L), LhloOps.ADD);
            lower(f);

            LoopOps.ParallelOp outer = new LoopOps.ParallelOp(ops(f, LoopOps.PARALLEL).get(0));
            LoopOps.ParallelOp inner = new LoopOps.ParallelOp(ops(f, LoopOps.PARALLEL).get(1));
            Operation load = inner.body().operations().get(0);

            assertEquals(2, outer.numLoops());
            assertSame(f.argument(0), load.operand(0));
            assertSame(outer.inductionVars().get(0), load.operand(1));
            assertSame(inner.inductionVars().get(0), load.operand(2));
            assertSame(outer.inductionVars().get(1), load.operand(3));
        }

        @Test
        void interleaveFollowsDimensionOrder() {
            Block scratch = new Block();
            Value p0 = scratch.addArgument(IndexType.INSTANCE, "p0");
            Value p1 = scratch.addArgument(IndexType.INSTANCE, "p1");
            Value r0 = scratch.addArgument(IndexType.INSTANCE, "r0");
            Value r1 = scratch.addArgument(IndexType.INSTANCE, "r1");

            List<Value> indices = ReduceOpConverter.interleave(4, Set.of(0L, 2L), List.of(p0, p1), List.of(r0, r1));
            assertEquals(List.of(r0, p0, r1, p1), indices);
        }

        @Test
        void fullReductionHasNoOuterLoop() {
            Function f = reduceFunction(f32(3), MemRefType.scalar(ScalarType.F32), List.of(0L), LhloOps.MAXIMUM);
            lower(f);

            assertEquals(1, count(f, LoopOps.PARALLEL));
            Operation store = f.body().operations().stream().filter(op -> op.isA(StdOps.STORE)).findFirst()
                    .orElseThrow();
            assertEquals(3, store.numOperands());
            assertEquals(0, constant(store.operand(2)));
        }

        @Test
        void dynamicExtentsAreQueried() {
            Function f = reduceFunction(f32(IrTypes.DYNAMIC, 3), f32(IrTypes.DYNAMIC), List.of(1L), LhloOps.ADD);
            lower(f);

            List<Operation> dims = ops(f, StdOps.DIM);
            assertEquals(1, dims.size());
            assertSame(f.argument(0), dims.get(0).operand(0));
            assertEquals(new IntegerAttr(0), dims.get(0).attribute(StdOps.INDEX_ATTR));
        }

        @Test
        void loweredFunctionVerifies() {
            Function f = reduceFunction(f32(2, 3, 4), f32(3), List.of(0L, 2L), LhloOps.MULTIPLY);
            lower(f);
            assertEquals(List.of(), new IrVerifier().validate(f));
        }

        private long constant(Value v) {
            return v.definingOp().attribute(StdOps.VALUE_ATTR, IntegerAttr.class).value();
        }
    }

    @Nested
    @DisplayName("Execution of lowered reductions")
    class ExecutionTests {

        @Test
        void rowSum() {
            Function f = reduceFunction(f32(2, 3), f32(2), List.of(1L), LhloOps.ADD);
            lower(f);

            Buffer input = Buffer.of(ScalarType.F32, new int[] {2, 3}, 1, 2, 3, 4, 5, 6);
            Buffer init = Buffer.scalar(ScalarType.F32, 0);
            Buffer out = Buffer.zeros(ScalarType.F32, 2);
            new Interpreter().run(f, input, init, out);

            assertArrayEquals(new double[] {6, 15}, out.toArray());
        }

        @Test
        void maxToRankZero() {
            Function f = reduceFunction(f32(3), MemRefType.scalar(ScalarType.F32), List.of(0L), LhloOps.MAXIMUM);
            lower(f);

            Buffer input = Buffer.of(ScalarType.F32, new int[] {3}, -4, 7.5, 2);
            Buffer init = Buffer.scalar(ScalarType.F32, Double.NEGATIVE_INFINITY);
            Buffer out = Buffer.scalar(ScalarType.F32, 0);
            new Interpreter().run(f, input, init, out);

            assertEquals(7.5, out.get());
        }

        @Test
        void reducingOuterAndInnerDimensions() {
            Function f = reduceFunction(f32(2, 3, 4), f32(3), List.of(0L, 2L), LhloOps.ADD);
            lower(f);

            double[] values = new double[24];
            for (int i = 0; i < values.length; i++) {
                values[i] = i;
            }
            Buffer input = Buffer.of(ScalarType.F32, new int[] {2, 3, 4}, values);
            Buffer out = Buffer.zeros(ScalarType.F32, 3);
            new Interpreter().run(f, input, Buffer.scalar(ScalarType.F32, 0), out);

            double[] expected = new double[3];
            for (int a = 0; a < 2; a++) {
                for (int b = 0; b < 3; b++) {
                    for (int c = 0; c < 4; c++) {
                        expected[b] += input.get(a, b, c);
                    }
                }
            }
            assertArrayEquals(expected, out.toArray());
        }

        @Test
        void everyElementIsReadOnce() {
            Function f = reduceFunction(f32(4, 5), f32(5), List.of(0L), LhloOps.ADD);
            lower(f);

            Buffer input = Buffer.filled(ScalarType.F32, 1, 4, 5);
            Buffer init = Buffer.scalar(ScalarType.F32, 0);
            Buffer out = Buffer.zeros(ScalarType.F32, 5);
            new Interpreter().run(f, input, init, out);

            assertEquals(20, input.loadCount());
            assertEquals(1, init.loadCount());
            assertEquals(5, out.storeCount());
            assertArrayEquals(new double[] {4, 4, 4, 4, 4}, out.toArray());
        }

        @Test
        void dynamicShapes() {
            Function f = reduceFunction(f32(IrTypes.DYNAMIC, 3), f32(IrTypes.DYNAMIC), List.of(1L), LhloOps.ADD);
            lower(f);

            Buffer input = Buffer.of(ScalarType.F32, new int[] {4, 3}, 1, 1, 1, 2, 2, 2, 3, 3, 3, 0, 0, 1);
            Buffer out = Buffer.zeros(ScalarType.F32, 4);
            new Interpreter().run(f, input, Buffer.scalar(ScalarType.F32, 0), out);

            assertArrayEquals(new double[] {3, 6, 9, 1}, out.toArray());
        }

        @Test
        void emptyReducedDimensionYieldsInit() {
            Function f = reduceFunction(f32(2, 0), f32(2), List.of(1L), LhloOps.ADD);
            lower(f);

            Buffer out = Buffer.zeros(ScalarType.F32, 2);
            new Interpreter().run(f, Buffer.zeros(ScalarType.F32, 2, 0), Buffer.scalar(ScalarType.F32, 42), out);

            assertArrayEquals(new double[] {42, 42}, out.toArray());
        }

        @Test
        void integerElements() {
            MemRefType operand = MemRefType.of(ScalarType.I32, 2, 2);
            Function f = reduceFunction(operand, MemRefType.of(ScalarType.I32, 2), List.of(0L), LhloOps.MINIMUM);
            lower(f);

            Buffer out = Buffer.zeros(ScalarType.I32, 2);
            new Interpreter().run(f, Buffer.of(ScalarType.I32, new int[] {2, 2}, 5, -3, 2, 8),
                    Buffer.scalar(ScalarType.I32, 100), out);

            assertArrayEquals(new double[] {2, -3}, out.toArray());
        }
    }

    @Nested
    @DisplayName("Unsupported reductions")
    class NoMatchTests {

        @Test
        void variadicReduceIsLeftAlone() {
            Function f = new Function("variadic", List.of(f32(2, 3), f32(2, 3),
                    MemRefType.scalar(ScalarType.F32), MemRefType.scalar(ScalarType.F32), f32(2), f32(2)));
            OpBuilder b = OpBuilder.atEnd(f.body());
            LhloOps.ReduceOp reduce = LhloOps.reduce(b, LOC,
                    List.of(f.argument(0), f.argument(1)),
                    List.of(f.argument(2), f.argument(3)),
                    List.of(f.argument(4), f.argument(5)),
                    List.of(1L));
            LhloOps.populateBinaryBody(reduce.body(), LhloOps.ADD, LOC);
            StdOps.ret(b, LOC);
            List<String> before = opNames(f);

            DiagnosticEngine diagnostics = new DiagnosticEngine();
            PassResult result = lower(f, LoweringOptions.defaults(), diagnostics);

            assertFalse(result.succeeded());
            assertTrue(result.message().contains(LhloOps.REDUCE));
            assertEquals(before, opNames(f));
            assertFalse(diagnostics.hasErrors());
        }

        @Test
        void bodyWithWrongArityIsReported() {
            Function f = reduceFunction(f32(2, 3), f32(2), List.of(1L), LhloOps.ADD);
            LhloOps.ReduceOp reduce = new LhloOps.ReduceOp(f.body().operations().get(0));
            reduce.body().addArgument(MemRefType.scalar(ScalarType.F32));
            List<String> before = opNames(f);

            DiagnosticEngine diagnostics = new DiagnosticEngine();
            PassResult result = lower(f, LoweringOptions.defaults(), diagnostics);

            assertFalse(result.succeeded());
            assertEquals(1, diagnostics.count(Severity.ERROR));
            assertTrue(diagnostics.diagnostics().get(0).message().contains("got 4"));
            assertEquals(before, opNames(f));
        }
    }
}
