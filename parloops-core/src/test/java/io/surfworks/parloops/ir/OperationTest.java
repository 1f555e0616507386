package io.surfworks.parloops.ir;

import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.IrTypes.IndexType;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationTest {

    private static final Location LOC = Location.UNKNOWN;
    private static final MemRefType SCALAR_F32 = MemRefType.scalar(ScalarType.F32);

    @Nested
    @DisplayName("Cloning")
    class CloneTests {

        @Test
        void operandsAreRemappedAndResultsRecorded() {
            Function f = new Function("f", List.of(SCALAR_F32, SCALAR_F32));
            OpBuilder b = OpBuilder.atEnd(f.body());
            Operation load = b.create(StdOps.LOAD, LOC, List.of(f.argument(0)), List.of(ScalarType.F32));

            IrMapping mapping = new IrMapping().map(f.argument(0), f.argument(1));
            Operation copy = load.clone(mapping);

            assertNotSame(load, copy);
            assertNull(copy.parentBlock());
            assertSame(f.argument(1), copy.operand(0));
            assertSame(copy.result(), mapping.lookup(load.result()));
        }

        @Test
        void unmappedOperandsAreKept() {
            Function f = new Function("f", List.of(SCALAR_F32));
            OpBuilder b = OpBuilder.atEnd(f.body());
            Operation load = b.create(StdOps.LOAD, LOC, List.of(f.argument(0)), List.of(ScalarType.F32));

            Operation copy = load.clone(new IrMapping());
            assertSame(f.argument(0), copy.operand(0));
        }

        @Test
        void regionsAreDeepCopied() {
            Function f = new Function("f", List.of(MemRefType.of(ScalarType.F32, 4)));
            OpBuilder b = OpBuilder.atEnd(f.body());
            Value c0 = StdOps.constantIndex(b, LOC, 0);
            Value c4 = StdOps.constantIndex(b, LOC, 4);
            Value c1 = StdOps.constantIndex(b, LOC, 1);
            LoopOps.ParallelOp loop = LoopOps.parallel(b, LOC, List.of(c0), List.of(c4), List.of(c1));
            OpBuilder inner = OpBuilder.atStart(loop.body());
            StdOps.load(inner, LOC, f.argument(0), loop.inductionVars());

            IrMapping mapping = new IrMapping();
            LoopOps.ParallelOp copy = new LoopOps.ParallelOp(loop.op().clone(mapping));

            assertNotSame(loop.body(), copy.body());
            Value copiedIv = copy.inductionVars().get(0);
            assertNotSame(loop.inductionVars().get(0), copiedIv);
            Operation copiedLoad = copy.body().operations().get(0);
            assertSame(copiedIv, copiedLoad.operand(1));
            assertSame(f.argument(0), copiedLoad.operand(0));
            assertSame(copy.op(), copy.body().parentOp());
        }
    }

    @Nested
    @DisplayName("Structure")
    class StructureTests {

        @Test
        void terminatorsBySuffix() {
            Function f = new Function("f", List.of());
            OpBuilder b = OpBuilder.atEnd(f.body());
            assertTrue(b.create(LhloOps.TERMINATOR, LOC, List.of(), List.of()).isTerminator());
            assertTrue(b.create(LoopOps.YIELD, LOC, List.of(), List.of()).isTerminator());
            assertTrue(b.create(StdOps.RETURN, LOC, List.of(), List.of()).isTerminator());
            assertFalse(b.create(LhloOps.COPY, LOC, List.of(), List.of()).isTerminator());
        }

        @Test
        void withoutTerminatorDropsOnlyTheTrailingTerminator() {
            Block block = new Block();
            Value arg = block.addArgument(SCALAR_F32);
            OpBuilder b = OpBuilder.atEnd(block);
            LhloOps.elementwise(b, LOC, LhloOps.ADD, arg, arg, arg);
            LhloOps.terminator(b, LOC);

            assertEquals(1, block.withoutTerminator().size());
            assertEquals(LhloOps.TERMINATOR, block.terminator().name());
        }

        @Test
        void walkIsPreOrder() {
            Function f = new Function("f", List.of());
            OpBuilder b = OpBuilder.atEnd(f.body());
            Value c0 = StdOps.constantIndex(b, LOC, 0);
            LoopOps.parallel(b, LOC, List.of(c0), List.of(c0), List.of(c0));
            StdOps.ret(b, LOC);

            List<String> names = new ArrayList<>();
            f.walk(op -> names.add(op.name()));
            assertEquals(List.of(StdOps.CONSTANT, LoopOps.PARALLEL, LoopOps.YIELD, StdOps.RETURN), names);
        }

        @Test
        void ancestry() {
            Function f = new Function("f", List.of());
            OpBuilder b = OpBuilder.atEnd(f.body());
            Value c0 = StdOps.constantIndex(b, LOC, 0);
            LoopOps.ParallelOp outer = LoopOps.parallel(b, LOC, List.of(c0), List.of(c0), List.of(c0));
            LoopOps.ParallelOp inner = LoopOps.parallel(OpBuilder.atStart(outer.body()), LOC,
                    List.of(c0), List.of(c0), List.of(c0));

            assertSame(outer.op(), inner.op().parentOp());
            assertTrue(outer.op().isProperAncestor(inner.body().terminator()));
            assertFalse(inner.op().isProperAncestor(outer.op()));
            assertNull(outer.op().parentOp());
        }

        @Test
        void eraseDetaches() {
            Function f = new Function("f", List.of());
            OpBuilder b = OpBuilder.atEnd(f.body());
            Operation c = b.create(StdOps.CONSTANT, LOC, List.of(), List.of(IndexType.INSTANCE));
            c.erase();

            assertTrue(f.body().isEmpty());
            assertNull(c.parentBlock());
            assertThrows(IllegalStateException.class, c::erase);
        }

        @Test
        void replaceAllUsesWith() {
            Function f = new Function("f", List.of(SCALAR_F32, SCALAR_F32));
            OpBuilder b = OpBuilder.atEnd(f.body());
            Operation copy = b.create(LhloOps.COPY, LOC, List.of(f.argument(0), f.argument(0)), List.of());

            assertEquals(2, f.replaceAllUsesWith(f.argument(0), f.argument(1)));
            assertSame(f.argument(1), copy.operand(0));
            assertSame(f.argument(1), copy.operand(1));
        }
    }
}
