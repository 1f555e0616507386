package io.surfworks.parloops.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.surfworks.parloops.ir.Attributes.DenseIntAttr;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.IrTypes.IndexType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.IrTypes.Type;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;

/**
 * Structured parallel-loop operations: {@code loop.parallel}, {@code loop.reduce},
 * {@code loop.reduce.return}, {@code loop.if} and {@code loop.yield}.
 *
 * <p>A parallel loop with init values carries one running accumulator per
 * init value. Each {@code loop.reduce} in the body folds its operand into the
 * accumulator of the same position; the loop results are the final
 * accumulators.
 *
 * <pre>{@code
 * %r = "loop.parallel"(%c0, %c10, %c1, %init) ({
 * ^bb0(%j: index):
 *   %e = "std.load"(%buf, %j) : (memref<10xf32>, index) -> f32
 *   "loop.reduce"(%e) ({
 *   ^bb0(%elem: f32, %acc: f32):
 *     ...
 *     "loop.reduce.return"(%sum) : (f32) -> ()
 *   }) : (f32) -> ()
 *   "loop.yield"() : () -> ()
 * }) {operand_segment_sizes = dense<[1, 1, 1, 1]>} : (index, index, index, f32) -> f32
 * }</pre>
 */
public final class LoopOps {

    public static final String DIALECT = "loop";

    public static final String PARALLEL = "loop.parallel";
    public static final String REDUCE = "loop.reduce";
    public static final String REDUCE_RETURN = "loop.reduce.return";
    public static final String IF = "loop.if";
    public static final String YIELD = "loop.yield";

    public static final String SEGMENT_SIZES_ATTR = "operand_segment_sizes";

    private LoopOps() {}

    /**
     * Creates a parallel loop with an empty body ending in {@code loop.yield}.
     *
     * @param lowerBounds one lower bound per induction variable
     * @param upperBounds one exclusive upper bound per induction variable
     * @param steps one step per induction variable
     * @param initValues seeds of the accumulators; empty for a loop without results
     */
    public static ParallelOp parallel(
            OpBuilder b,
            Location loc,
            List<Value> lowerBounds,
            List<Value> upperBounds,
            List<Value> steps,
            List<Value> initValues) {
        int n = lowerBounds.size();
        if (upperBounds.size() != n || steps.size() != n) {
            throw new IllegalArgumentException(String.format(
                    "Parallel loop bounds mismatch: %d lower, %d upper, %d steps",
                    n, upperBounds.size(), steps.size()));
        }
        List<Value> operands = new ArrayList<>();
        operands.addAll(lowerBounds);
        operands.addAll(upperBounds);
        operands.addAll(steps);
        operands.addAll(initValues);
        List<Type> resultTypes = initValues.stream().map(Value::type).toList();

        Operation op = b.create(PARALLEL, loc, operands, resultTypes,
                Map.of(SEGMENT_SIZES_ATTR, DenseIntAttr.vector(n, n, n, initValues.size())), 1);
        Block body = op.region(0).addBlock();
        for (int i = 0; i < n; i++) {
            body.addArgument(IndexType.INSTANCE);
        }
        OpBuilder.atEnd(body).create(YIELD, loc, List.of(), List.of());
        return new ParallelOp(op);
    }

    public static ParallelOp parallel(
            OpBuilder b,
            Location loc,
            List<Value> lowerBounds,
            List<Value> upperBounds,
            List<Value> steps) {
        return parallel(b, loc, lowerBounds, upperBounds, steps, List.of());
    }

    /**
     * Creates a {@code loop.reduce} whose region has an empty block with
     * (element, accumulator) scalar arguments. The caller fills the block and
     * terminates it with {@link #reduceReturn}.
     */
    public static ReduceOp reduce(OpBuilder b, Location loc, Value operand) {
        Operation op = b.create(REDUCE, loc, List.of(operand), List.of(), Map.of(), 1);
        Block block = op.region(0).addBlock();
        block.addArgument(operand.type());
        block.addArgument(operand.type());
        return new ReduceOp(op);
    }

    public static void reduceReturn(OpBuilder b, Location loc, Value result) {
        b.create(REDUCE_RETURN, loc, List.of(result), List.of());
    }

    public static void yield(OpBuilder b, Location loc, List<Value> values) {
        b.create(YIELD, loc, values, List.of());
    }

    /**
     * Creates a two-armed {@code loop.if}. Both blocks start empty; each arm
     * must end with a {@code loop.yield} of the result values.
     */
    public static IfOp ifOp(OpBuilder b, Location loc, List<Type> resultTypes, Value condition, boolean withElse) {
        Operation op = b.create(IF, loc, List.of(condition), resultTypes, Map.of(), 2);
        op.region(0).addBlock();
        if (withElse) {
            op.region(1).addBlock();
        }
        return new IfOp(op);
    }

    // ==================== Views ====================

    /**
     * Typed view of {@code loop.parallel}.
     */
    public record ParallelOp(Operation op) {

        public ParallelOp {
            requireName(op, PARALLEL);
        }

        public int numLoops() {
            return segment(0);
        }

        public List<Value> lowerBounds() {
            return segmentValues(0);
        }

        public List<Value> upperBounds() {
            return segmentValues(1);
        }

        public List<Value> steps() {
            return segmentValues(2);
        }

        public List<Value> initValues() {
            return segmentValues(3);
        }

        public List<Value> inductionVars() {
            return body().arguments();
        }

        public Block body() {
            return op.region(0).front();
        }

        public List<Value> results() {
            return op.results();
        }

        private int segment(int i) {
            DenseIntAttr sizes = op.attribute(SEGMENT_SIZES_ATTR, DenseIntAttr.class);
            if (sizes == null) {
                throw new IllegalStateException("loop.parallel without " + SEGMENT_SIZES_ATTR);
            }
            return (int) sizes.get(i);
        }

        private List<Value> segmentValues(int index) {
            int start = 0;
            for (int i = 0; i < index; i++) {
                start += segment(i);
            }
            return op.operands().subList(start, start + segment(index));
        }
    }

    /**
     * Typed view of {@code loop.reduce}.
     */
    public record ReduceOp(Operation op) {

        public ReduceOp {
            requireName(op, REDUCE);
        }

        public Value operand() {
            return op.operand(0);
        }

        /**
         * The combiner block with (element, accumulator) arguments.
         */
        public Block body() {
            return op.region(0).front();
        }

        public ScalarType elementType() {
            return (ScalarType) operand().type();
        }
    }

    /**
     * Typed view of {@code loop.if}.
     */
    public record IfOp(Operation op) {

        public IfOp {
            requireName(op, IF);
        }

        public Value condition() {
            return op.operand(0);
        }

        public Block thenBlock() {
            return op.region(0).front();
        }

        public boolean hasElse() {
            return !op.region(1).isEmpty();
        }

        public Block elseBlock() {
            return op.region(1).front();
        }

        public List<Value> results() {
            return op.results();
        }

        public OpBuilder thenBuilder() {
            return OpBuilder.atEnd(thenBlock());
        }

        public OpBuilder elseBuilder() {
            return OpBuilder.atEnd(elseBlock());
        }
    }

    static void requireName(Operation op, String expected) {
        if (!op.isA(expected)) {
            throw new IllegalArgumentException("Expected " + expected + ", got " + op.name());
        }
    }
}
