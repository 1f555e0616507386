package io.surfworks.parloops.lowering;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;
import io.surfworks.parloops.rewrite.ConversionPattern;
import io.surfworks.parloops.rewrite.PatternRewriter;
import io.surfworks.parloops.rewrite.RewriteStatus;

/**
 * Lowers {@code lhlo.reduce} to a pair of nested {@code loop.parallel} ops.
 *
 * <p>The outer loop runs over the dimensions that are kept, the inner loop
 * over the reduced ones and carries the accumulator:
 *
 * <pre>{@code
 * "lhlo.reduce"(%arg, %init, %out) ({ ... }) {dimensions = dense<[1]>}
 *     : (memref<100x10x5xf32>, memref<f32>, memref<100x5xf32>) -> ()
 * }</pre>
 *
 * becomes
 *
 * <pre>{@code
 * %init_val = load %init[]
 * loop.parallel (%i, %k) = (0, 0) to (100, 5) step (1, 1) {
 *   %result = loop.parallel (%j) = (0) to (10) step (1) init (%init_val) {
 *     %elem = load %arg[%i, %j, %k]
 *     loop.reduce(%elem) {
 *     ^bb0(%lhs: f32, %rhs: f32):
 *       ...
 *       loop.reduce.return %acc
 *     }
 *   }
 *   store %result, %out[%i, %k]
 * }
 * }</pre>
 *
 * When every dimension is reduced there is no outer loop and the rank-0
 * output is written at index 0. Reductions with more than one output are
 * not matched.
 */
public final class ReduceOpConverter implements ConversionPattern {

    private static final Logger LOG = Logger.getLogger(ReduceOpConverter.class.getName());

    public ReduceOpConverter() {}

    @Override
    public String rootOpName() {
        return LhloOps.REDUCE;
    }

    @Override
    public RewriteStatus matchAndRewrite(Operation op, PatternRewriter rewriter) {
        LhloOps.ReduceOp reduce = new LhloOps.ReduceOp(op);
        int[] sizes = reduce.segmentSizes();
        if (sizes == null || sizes[0] != 1 || sizes[1] != 1 || sizes[2] != 1) {
            LOG.fine(() -> "Variadic lhlo.reduce is not supported at " + op.location());
            return RewriteStatus.NO_MATCH;
        }
        if (reduce.body().numArguments() != 3) {
            rewriter.diagnostics().emitError(op, String.format(
                    "reduction body must have 3 buffer arguments, got %d", reduce.body().numArguments()));
            return RewriteStatus.NO_MATCH;
        }

        Location loc = op.location();
        Value operand = reduce.inputs().get(0);
        Value initBuf = reduce.initValues().get(0);
        Value out = reduce.outputs().get(0);
        MemRefType operandType = StdOps.memRefType(operand);
        Set<Long> reducedDims = new HashSet<>(reduce.dimensions());

        // Bounds of the parallel and reduced dimensions, each in original order.
        Value zero = StdOps.constantIndex(rewriter, loc, 0);
        Value one = StdOps.constantIndex(rewriter, loc, 1);
        List<Value> parallelLower = new ArrayList<>();
        List<Value> parallelUpper = new ArrayList<>();
        List<Value> parallelSteps = new ArrayList<>();
        List<Value> reduceLower = new ArrayList<>();
        List<Value> reduceUpper = new ArrayList<>();
        List<Value> reduceSteps = new ArrayList<>();
        for (int i = 0; i < operandType.rank(); i++) {
            Value upper = DimensionResolver.resolve(rewriter, loc, operand, i);
            if (reducedDims.contains((long) i)) {
                reduceLower.add(zero);
                reduceUpper.add(upper);
                reduceSteps.add(one);
            } else {
                parallelLower.add(zero);
                parallelUpper.add(upper);
                parallelSteps.add(one);
            }
        }

        Value initValue = StdOps.load(rewriter, loc, initBuf, List.of());

        List<Value> outIndices;
        List<Value> parallelIvs;
        if (parallelUpper.isEmpty()) {
            outIndices = List.of(zero);
            parallelIvs = List.of();
        } else {
            LoopOps.ParallelOp outer = LoopOps.parallel(rewriter, loc, parallelLower, parallelUpper, parallelSteps);
            rewriter.setInsertionPointToStart(outer.body());
            outIndices = outer.inductionVars();
            parallelIvs = outer.inductionVars();
        }

        LoopOps.ParallelOp inner = LoopOps.parallel(
                rewriter, loc, reduceLower, reduceUpper, reduceSteps, List.of(initValue));
        StdOps.store(rewriter, loc, inner.results().get(0), out, outIndices);

        rewriter.setInsertionPointToStart(inner.body());
        List<Value> indices = interleave(operandType.rank(), reducedDims, parallelIvs, inner.inductionVars());
        Value element = StdOps.load(rewriter, loc, operand, indices);
        LoopOps.ReduceOp combiner = LoopOps.reduce(rewriter, loc, element);
        ReductionBodyBuilder.build(rewriter, loc, combiner, reduce.body());

        rewriter.eraseOp(op);
        return RewriteStatus.REWRITTEN;
    }

    /**
     * Builds the operand subscript: dimension {@code i} takes the next reduced
     * induction variable if {@code i} is reduced, else the next parallel one.
     */
    static List<Value> interleave(int rank, Set<Long> reducedDims, List<Value> parallelIvs, List<Value> reduceIvs) {
        List<Value> indices = new ArrayList<>(rank);
        int nextParallel = 0;
        int nextReduced = 0;
        for (int i = 0; i < rank; i++) {
            if (reducedDims.contains((long) i)) {
                indices.add(reduceIvs.get(nextReduced++));
            } else {
                indices.add(parallelIvs.get(nextParallel++));
            }
        }
        return indices;
    }
}
