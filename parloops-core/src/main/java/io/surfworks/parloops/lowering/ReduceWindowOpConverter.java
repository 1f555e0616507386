package io.surfworks.parloops.lowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.surfworks.parloops.config.LoweringOptions;
import io.surfworks.parloops.dialect.CmpIPredicate;
import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.diag.DiagnosticEngine;
import io.surfworks.parloops.ir.Attributes.DenseIntAttr;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;
import io.surfworks.parloops.rewrite.ConversionPattern;
import io.surfworks.parloops.rewrite.PatternRewriter;
import io.surfworks.parloops.rewrite.RewriteStatus;

/**
 * Lowers {@code lhlo.reduce_window} to nested {@code loop.parallel} ops.
 *
 * <p>The outer loop visits every output element, the inner loop every
 * position of the window. The operand subscript of a window tap is
 * {@code out * stride + win - padLow} per dimension; taps that land in the
 * padding contribute the init value and the operand is not read there:
 *
 * <pre>{@code
 * %init_val = load %init[]
 * loop.parallel (%i, %j) = (0, 0) to (56, 56) step (1, 1) {
 *   %result = loop.parallel (%iw, %jw) = (0, 0) to (3, 3) step (1, 1) init (%init_val) {
 *     %in_bounds = <unsigned compare of each subscript against the operand extent>
 *     %elem_or_init = loop.if %in_bounds -> f32 {
 *       %elem = load %operand[%ii, %jj]
 *       loop.yield %elem
 *     } else {
 *       loop.yield %init_val
 *     }
 *     loop.reduce(%elem_or_init) { ... }
 *   }
 *   store %result, %out[%i, %j]
 * }
 * }</pre>
 *
 * <p>A missing {@code window_strides} or {@code padding} and the presence of
 * dilation attributes are handled according to {@link LoweringOptions}.
 */
public final class ReduceWindowOpConverter implements ConversionPattern {

    static final String NO_STRIDES = "No window strides specified.";
    static final String NO_PADDING = "No padding specified.";
    static final String DILATION_IGNORED = "Lowering to parallel loops does not support `base_dilations` or "
            + "`window_dilations` attributes yet. The attributes will be ignored.";
    static final String DILATION_REJECTED = "Lowering to parallel loops does not support `base_dilations` or "
            + "`window_dilations` attributes.";

    private final LoweringOptions options;

    public ReduceWindowOpConverter() {
        this(LoweringOptions.defaults());
    }

    public ReduceWindowOpConverter(LoweringOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    @Override
    public String rootOpName() {
        return LhloOps.REDUCE_WINDOW;
    }

    @Override
    public RewriteStatus matchAndRewrite(Operation op, PatternRewriter rewriter) {
        LhloOps.ReduceWindowOp window = new LhloOps.ReduceWindowOp(op);
        DiagnosticEngine diagnostics = rewriter.diagnostics();
        if (window.body().numArguments() != 3) {
            diagnostics.emitError(op, String.format(
                    "reduction body must have 3 buffer arguments, got %d", window.body().numArguments()));
            return RewriteStatus.NO_MATCH;
        }

        MemRefType operandType = StdOps.memRefType(window.operand());
        int rank = operandType.rank();
        if (window.windowDimensions().size() != rank || StdOps.memRefType(window.out()).rank() != rank) {
            diagnostics.emitError(op, String.format(
                    "window of rank %d and output of rank %d don't match operand rank %d",
                    window.windowDimensions().size(), StdOps.memRefType(window.out()).rank(), rank));
            return RewriteStatus.NO_MATCH;
        }

        boolean refuse = false;
        Optional<List<Long>> strides = window.windowStrides();
        Optional<DenseIntAttr> padding = window.padding();
        if (strides.isEmpty()) {
            diagnostics.emitError(op, NO_STRIDES);
            refuse |= options.strictAttributes();
        }
        if (padding.isEmpty()) {
            diagnostics.emitError(op, NO_PADDING);
            refuse |= options.strictAttributes();
        }
        if (window.hasDilations()) {
            if (options.rejectDilation()) {
                diagnostics.emitError(op, DILATION_REJECTED);
                refuse = true;
            } else {
                diagnostics.emitRemark(op, DILATION_IGNORED);
            }
        }
        if (refuse) {
            return RewriteStatus.NO_MATCH;
        }
        if (strides.isPresent() && strides.get().size() != rank
                || padding.isPresent() && padding.get().rows() != rank) {
            diagnostics.emitError(op, String.format(
                    "window_strides and padding must have %d entries", rank));
            return RewriteStatus.NO_MATCH;
        }

        Location loc = op.location();
        Value initValue = StdOps.load(rewriter, loc, window.initValue(), List.of());
        Value zero = StdOps.constantIndex(rewriter, loc, 0);
        Value one = StdOps.constantIndex(rewriter, loc, 1);

        // Outer loop over the output, inner loop over the window.
        List<Value> outputUpper = DimensionResolver.resolveAll(rewriter, loc, window.out());
        LoopOps.ParallelOp outputLoop = LoopOps.parallel(rewriter, loc,
                repeat(zero, rank), outputUpper, repeat(one, rank));
        rewriter.setInsertionPointToStart(outputLoop.body());

        List<Value> windowUpper = new ArrayList<>(rank);
        for (long extent : window.windowDimensions()) {
            windowUpper.add(StdOps.constantIndex(rewriter, loc, extent));
        }
        LoopOps.ParallelOp windowLoop = LoopOps.parallel(rewriter, loc,
                repeat(zero, rank), windowUpper, repeat(one, rank), List.of(initValue));
        StdOps.store(rewriter, loc, windowLoop.results().get(0), window.out(), outputLoop.inductionVars());

        rewriter.setInsertionPointToStart(windowLoop.body());
        List<Value> outputIvs = outputLoop.inductionVars();
        List<Value> windowIvs = windowLoop.inductionVars();
        List<Value> operandIndices = new ArrayList<>(rank);
        // An index below zero wraps to a huge unsigned value, so one ult per
        // dimension checks both ends.
        Value inBounds = StdOps.constantBool(rewriter, loc, true);
        for (int i = 0; i < rank; i++) {
            long stride = strides.isPresent() ? strides.get().get(i) : 1;
            long padLow = padding.isPresent() ? padding.get().get(i, 0) : 0;
            Value strideVal = StdOps.constantIndex(rewriter, loc, stride);
            Value padLowVal = StdOps.constantIndex(rewriter, loc, padLow);

            Value center = StdOps.muli(rewriter, loc, outputIvs.get(i), strideVal);
            Value offset = StdOps.subi(rewriter, loc, windowIvs.get(i), padLowVal);
            Value index = StdOps.addi(rewriter, loc, center, offset);
            operandIndices.add(index);

            Value upper = DimensionResolver.resolve(rewriter, loc, window.operand(), i);
            Value inRange = StdOps.cmpi(rewriter, loc, CmpIPredicate.ULT, index, upper);
            inBounds = StdOps.and(rewriter, loc, inBounds, inRange);
        }

        LoopOps.IfOp elemOrInit = LoopOps.ifOp(rewriter, loc,
                List.of(operandType.elementType()), inBounds, true);
        OpBuilder thenBuilder = elemOrInit.thenBuilder();
        Value element = StdOps.load(thenBuilder, loc, window.operand(), operandIndices);
        LoopOps.yield(thenBuilder, loc, List.of(element));
        OpBuilder elseBuilder = elemOrInit.elseBuilder();
        LoopOps.yield(elseBuilder, loc, windowLoop.initValues());

        LoopOps.ReduceOp combiner = LoopOps.reduce(rewriter, loc, elemOrInit.results().get(0));
        ReductionBodyBuilder.build(rewriter, loc, combiner, window.body());

        rewriter.eraseOp(op);
        return RewriteStatus.REWRITTEN;
    }

    private static List<Value> repeat(Value value, int count) {
        List<Value> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(value);
        }
        return values;
    }
}
