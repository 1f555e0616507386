package io.surfworks.parloops.lowering;

import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.surfworks.parloops.lowering.LoweringFixtures.LOC;
import static org.junit.jupiter.api.Assertions.*;

class ReductionBodyBuilderTest {

    private Function function;
    private OpBuilder builder;
    private LoopOps.ReduceOp reduce;
    private Block lhloBody;

    @BeforeEach
    void setUp() {
        function = new Function("f", List.of(MemRefType.scalar(ScalarType.F32)));
        builder = OpBuilder.atEnd(function.body());
        Value c0 = StdOps.constantIndex(builder, LOC, 0);
        LoopOps.ParallelOp loop = LoopOps.parallel(builder, LOC, List.of(c0), List.of(c0), List.of(c0),
                List.of(StdOps.load(builder, LOC, function.argument(0), List.of())));
        OpBuilder inner = OpBuilder.atStart(loop.body());
        Value element = StdOps.load(inner, LOC, function.argument(0), List.of());
        reduce = LoopOps.reduce(inner, LOC, element);

        lhloBody = new Block();
        MemRefType scalar = MemRefType.scalar(ScalarType.F32);
        lhloBody.addArgument(scalar, "lhs");
        lhloBody.addArgument(scalar, "rhs");
        lhloBody.addArgument(scalar, "res");
        LhloOps.populateBinaryBody(lhloBody, LhloOps.MAXIMUM, LOC);
    }

    @Test
    void clonedBodyWritesIntoTheAccumulatorBuffer() {
        ReductionBodyBuilder.build(builder, LOC, reduce, lhloBody);

        Block combiner = reduce.body();
        List<Operation> ops = combiner.operations();
        Value elemBuf = ops.get(0).result();
        Value accBuf = ops.get(1).result();
        assertSame(combiner.argument(0), ops.get(2).operand(0));
        assertSame(elemBuf, ops.get(2).operand(1));
        assertSame(combiner.argument(1), ops.get(3).operand(0));
        assertSame(accBuf, ops.get(3).operand(1));

        Operation max = ops.get(4);
        assertEquals(LhloOps.MAXIMUM, max.name());
        assertEquals(List.of(elemBuf, accBuf, accBuf), max.operands());

        Operation ret = combiner.terminator();
        assertEquals(LoopOps.REDUCE_RETURN, ret.name());
        assertSame(ops.get(5).result(), ret.operand(0));
        assertSame(accBuf, ops.get(5).operand(0));
    }

    @Test
    void sourceBodyIsLeftUntouched() {
        Operation original = lhloBody.operations().get(0);
        ReductionBodyBuilder.build(builder, LOC, reduce, lhloBody);

        assertEquals(2, lhloBody.size());
        assertSame(original, lhloBody.operations().get(0));
        assertSame(lhloBody.argument(2), original.operand(2));
    }

    @Test
    void insertionPointIsRestored() {
        Block before = builder.insertionBlock();
        ReductionBodyBuilder.build(builder, LOC, reduce, lhloBody);

        assertSame(before, builder.insertionBlock());
        StdOps.ret(builder, LOC);
        assertEquals(StdOps.RETURN, function.body().terminator().name());
    }

    @Test
    void eachCombinerGetsItsOwnBuffers() {
        ReductionBodyBuilder.build(builder, LOC, reduce, lhloBody);
        Block loopBody = reduce.op().parentBlock();
        Value element = reduce.operand();
        OpBuilder beforeYield = new OpBuilder();
        beforeYield.setInsertionPoint(loopBody.terminator());
        LoopOps.ReduceOp second = LoopOps.reduce(beforeYield, LOC, element);
        ReductionBodyBuilder.build(builder, LOC, second, lhloBody);

        Value firstAcc = reduce.body().operations().get(1).result();
        Value secondAcc = second.body().operations().get(1).result();
        assertNotSame(firstAcc, secondAcc);
        assertSame(secondAcc, second.body().operations().get(4).operand(1));
    }

    @Test
    void rejectsWrongArity() {
        Block twoArgs = new Block();
        twoArgs.addArgument(MemRefType.scalar(ScalarType.F32));
        twoArgs.addArgument(MemRefType.scalar(ScalarType.F32));

        assertThrows(IllegalArgumentException.class, () -> ReductionBodyBuilder.build(builder, LOC, reduce, twoArgs));
        assertTrue(reduce.body().isEmpty());
    }

    @Test
    void rejectsPopulatedCombiner() {
        ReductionBodyBuilder.build(builder, LOC, reduce, lhloBody);
        assertThrows(IllegalArgumentException.class, () -> ReductionBodyBuilder.build(builder, LOC, reduce, lhloBody));
    }
}
