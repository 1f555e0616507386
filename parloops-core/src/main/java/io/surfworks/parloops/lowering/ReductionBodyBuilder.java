package io.surfworks.parloops.lowering;

import java.util.List;

import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.InsertionGuard;
import io.surfworks.parloops.ir.IrMapping;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;

/**
 * Fills a {@code loop.reduce} combiner from a buffer-based lhlo reduction body.
 *
 * <p>The lhlo body takes three rank-0 buffers (element, accumulator, result)
 * and writes its answer into the result buffer, which aliases the
 * accumulator. The combiner takes two scalars and returns one. The bridge
 * spills both scalars into fresh rank-0 buffers, clones the body against
 * those buffers and reloads the accumulator:
 *
 * <pre>{@code
 * "loop.reduce"(%elem) ({
 * ^bb0(%lhs: f32, %rhs: f32):
 *   %elemBuf = "std.alloc"() : () -> memref<f32>
 *   %accBuf = "std.alloc"() : () -> memref<f32>
 *   "std.store"(%lhs, %elemBuf) : (f32, memref<f32>) -> ()
 *   "std.store"(%rhs, %accBuf) : (f32, memref<f32>) -> ()
 *   "lhlo.add"(%elemBuf, %accBuf, %accBuf) : (...) -> ()
 *   %acc = "std.load"(%accBuf) : (memref<f32>) -> f32
 *   "loop.reduce.return"(%acc) : (f32) -> ()
 * }) : (f32) -> ()
 * }</pre>
 *
 * <p>The scratch buffers are never deallocated here.
 */
public final class ReductionBodyBuilder {

    private ReductionBodyBuilder() {}

    /**
     * Populates the combiner of {@code reduce} from {@code lhloBody}.
     *
     * @param b builder whose insertion point is restored on return
     * @param loc location for the created operations
     * @param reduce an empty {@code loop.reduce}
     * @param lhloBody the three-argument reduction body; left untouched
     * @throws IllegalArgumentException if {@code lhloBody} does not have exactly three arguments
     */
    public static void build(OpBuilder b, Location loc, LoopOps.ReduceOp reduce, Block lhloBody) {
        if (lhloBody.numArguments() != 3) {
            throw new IllegalArgumentException(
                    "Reduction body must have 3 buffer arguments, got " + lhloBody.numArguments());
        }
        Block combiner = reduce.body();
        if (!combiner.isEmpty()) {
            throw new IllegalArgumentException("loop.reduce combiner is already populated");
        }

        try (InsertionGuard guard = b.guard()) {
            b.setInsertionPointToStart(combiner);

            MemRefType scalarBuffer = MemRefType.scalar(reduce.elementType());
            Value elemBuf = StdOps.alloc(b, loc, scalarBuffer);
            Value accBuf = StdOps.alloc(b, loc, scalarBuffer);
            StdOps.store(b, loc, combiner.argument(0), elemBuf, List.of());
            StdOps.store(b, loc, combiner.argument(1), accBuf, List.of());

            // The result argument aliases the accumulator.
            IrMapping mapping = new IrMapping()
                    .map(lhloBody.argument(0), elemBuf)
                    .map(lhloBody.argument(1), accBuf)
                    .map(lhloBody.argument(2), accBuf);
            for (Operation op : lhloBody.withoutTerminator()) {
                b.clone(op, mapping);
            }

            Value result = StdOps.load(b, loc, accBuf, List.of());
            LoopOps.reduceReturn(b, loc, result);
        }
    }
}
