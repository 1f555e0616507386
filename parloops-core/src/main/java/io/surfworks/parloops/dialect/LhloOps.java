package io.surfworks.parloops.dialect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.surfworks.parloops.ir.Attributes.Attribute;
import io.surfworks.parloops.ir.Attributes.DenseIntAttr;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;

/**
 * Buffer-level high-level operations.
 *
 * <p>Every lhlo operation writes its result into an output buffer operand
 * instead of producing an SSA result. The reduction operations carry a body
 * region with exactly three rank-0 buffer arguments: element, accumulator and
 * result, where the result aliases the accumulator.
 *
 * <pre>{@code
 * "lhlo.reduce"(%operand, %init, %out) ({
 * ^bb0(%lhs: memref<f32>, %rhs: memref<f32>, %res: memref<f32>):
 *   "lhlo.add"(%lhs, %rhs, %res) : (memref<f32>, memref<f32>, memref<f32>) -> ()
 *   "lhlo.terminator"() : () -> ()
 * }) {dimensions = dense<[1]>} : (memref<2x3xf32>, memref<f32>, memref<2xf32>) -> ()
 * }</pre>
 */
public final class LhloOps {

    public static final String DIALECT = "lhlo";

    public static final String REDUCE = "lhlo.reduce";
    public static final String REDUCE_WINDOW = "lhlo.reduce_window";
    public static final String ADD = "lhlo.add";
    public static final String SUBTRACT = "lhlo.subtract";
    public static final String MULTIPLY = "lhlo.multiply";
    public static final String MAXIMUM = "lhlo.maximum";
    public static final String MINIMUM = "lhlo.minimum";
    public static final String AND = "lhlo.and";
    public static final String OR = "lhlo.or";
    public static final String COPY = "lhlo.copy";
    public static final String TERMINATOR = "lhlo.terminator";

    public static final String DIMENSIONS_ATTR = "dimensions";
    public static final String SEGMENT_SIZES_ATTR = "operand_segment_sizes";
    public static final String WINDOW_DIMENSIONS_ATTR = "window_dimensions";
    public static final String WINDOW_STRIDES_ATTR = "window_strides";
    public static final String PADDING_ATTR = "padding";
    public static final String BASE_DILATIONS_ATTR = "base_dilations";
    public static final String WINDOW_DILATIONS_ATTR = "window_dilations";

    /** Binary element-wise buffer ops usable inside reduction bodies. */
    public static final Set<String> BINARY_ELEMENTWISE = Set.of(ADD, SUBTRACT, MULTIPLY, MAXIMUM, MINIMUM, AND, OR);

    private LhloOps() {}

    /**
     * Creates a single-output {@code lhlo.reduce} with an empty three-argument body.
     */
    public static ReduceOp reduce(OpBuilder b, Location loc, Value operand, Value init, Value out, List<Long> dimensions) {
        return reduce(b, loc, List.of(operand), List.of(init), List.of(out), dimensions);
    }

    /**
     * Creates a (possibly variadic) {@code lhlo.reduce} with an empty three-argument body.
     */
    public static ReduceOp reduce(
            OpBuilder b,
            Location loc,
            List<Value> operands,
            List<Value> initValues,
            List<Value> outputs,
            List<Long> dimensions) {
        List<Value> all = new ArrayList<>();
        all.addAll(operands);
        all.addAll(initValues);
        all.addAll(outputs);
        Map<String, Attribute> attrs = new LinkedHashMap<>();
        attrs.put(DIMENSIONS_ATTR, DenseIntAttr.vector(dimensions));
        if (operands.size() != 1 || initValues.size() != 1 || outputs.size() != 1) {
            attrs.put(SEGMENT_SIZES_ATTR,
                    DenseIntAttr.vector(operands.size(), initValues.size(), outputs.size()));
        }
        Operation op = b.create(REDUCE, loc, all, List.of(), attrs, 1);
        addBodyBlock(op, StdOps.memRefType(operands.get(0)));
        return new ReduceOp(op);
    }

    /**
     * Creates an {@code lhlo.reduce_window} with an empty three-argument body.
     *
     * @param windowStrides per-dimension strides, or null to omit the attribute
     * @param padding per-dimension (low, high) padding, or null to omit the attribute
     */
    public static ReduceWindowOp reduceWindow(
            OpBuilder b,
            Location loc,
            Value operand,
            Value init,
            Value out,
            List<Long> windowDimensions,
            List<Long> windowStrides,
            long[][] padding) {
        Map<String, Attribute> attrs = new LinkedHashMap<>();
        attrs.put(WINDOW_DIMENSIONS_ATTR, DenseIntAttr.vector(windowDimensions));
        if (windowStrides != null) {
            attrs.put(WINDOW_STRIDES_ATTR, DenseIntAttr.vector(windowStrides));
        }
        if (padding != null) {
            attrs.put(PADDING_ATTR, DenseIntAttr.pairs(padding));
        }
        Operation op = b.create(REDUCE_WINDOW, loc, List.of(operand, init, out), List.of(), attrs, 1);
        addBodyBlock(op, StdOps.memRefType(operand));
        return new ReduceWindowOp(op);
    }

    /**
     * Fills a reduction body with {@code opName(element, accumulator, result)} and a terminator.
     */
    public static void populateBinaryBody(Block body, String opName, Location loc) {
        if (!BINARY_ELEMENTWISE.contains(opName)) {
            throw new IllegalArgumentException("Not a binary element-wise lhlo op: " + opName);
        }
        OpBuilder b = OpBuilder.atEnd(body);
        elementwise(b, loc, opName, body.argument(0), body.argument(1), body.argument(2));
        terminator(b, loc);
    }

    public static void elementwise(OpBuilder b, Location loc, String opName, Value lhs, Value rhs, Value out) {
        b.create(opName, loc, List.of(lhs, rhs, out), List.of());
    }

    public static void copy(OpBuilder b, Location loc, Value source, Value target) {
        b.create(COPY, loc, List.of(source, target), List.of());
    }

    public static void terminator(OpBuilder b, Location loc) {
        b.create(TERMINATOR, loc, List.of(), List.of());
    }

    private static void addBodyBlock(Operation op, MemRefType operandType) {
        MemRefType scalarBuffer = MemRefType.scalar(operandType.elementType());
        Block body = op.region(0).addBlock();
        body.addArgument(scalarBuffer, "lhs");
        body.addArgument(scalarBuffer, "rhs");
        body.addArgument(scalarBuffer, "res");
    }

    // ==================== Views ====================

    /**
     * Typed view of {@code lhlo.reduce}.
     *
     * <p>Operands are split into inputs, init buffers and outputs by
     * {@code operand_segment_sizes}; without that attribute the operands are
     * divided into three equal groups.
     */
    public record ReduceOp(Operation op) {

        public ReduceOp {
            LoopOps.requireName(op, REDUCE);
        }

        public List<Value> inputs() {
            return segmentValues(0);
        }

        public List<Value> initValues() {
            return segmentValues(1);
        }

        public List<Value> outputs() {
            return segmentValues(2);
        }

        public List<Long> dimensions() {
            DenseIntAttr dims = op.attribute(DIMENSIONS_ATTR, DenseIntAttr.class);
            return dims == null ? List.of() : dims.values();
        }

        public Block body() {
            return op.region(0).front();
        }

        /**
         * Returns the three segment sizes, or null if the operands cannot be split.
         */
        public int[] segmentSizes() {
            DenseIntAttr sizes = op.attribute(SEGMENT_SIZES_ATTR, DenseIntAttr.class);
            if (sizes != null) {
                if (sizes.size() != 3) {
                    return null;
                }
                return new int[] {(int) sizes.get(0), (int) sizes.get(1), (int) sizes.get(2)};
            }
            int n = op.numOperands();
            if (n % 3 != 0) {
                return null;
            }
            return new int[] {n / 3, n / 3, n / 3};
        }

        private List<Value> segmentValues(int index) {
            int[] sizes = segmentSizes();
            if (sizes == null) {
                throw new IllegalStateException("Cannot split operands of " + op.name());
            }
            int start = 0;
            for (int i = 0; i < index; i++) {
                start += sizes[i];
            }
            return op.operands().subList(start, start + sizes[index]);
        }
    }

    /**
     * Typed view of {@code lhlo.reduce_window}.
     */
    public record ReduceWindowOp(Operation op) {

        public ReduceWindowOp {
            LoopOps.requireName(op, REDUCE_WINDOW);
        }

        public Value operand() {
            return op.operand(0);
        }

        public Value initValue() {
            return op.operand(1);
        }

        public Value out() {
            return op.operand(2);
        }

        public List<Long> windowDimensions() {
            DenseIntAttr dims = op.attribute(WINDOW_DIMENSIONS_ATTR, DenseIntAttr.class);
            return dims == null ? List.of() : dims.values();
        }

        public Optional<List<Long>> windowStrides() {
            return Optional.ofNullable(op.attribute(WINDOW_STRIDES_ATTR, DenseIntAttr.class))
                    .map(DenseIntAttr::values);
        }

        /**
         * Returns the [rank, 2] (low, high) padding matrix, if present.
         */
        public Optional<DenseIntAttr> padding() {
            return Optional.ofNullable(op.attribute(PADDING_ATTR, DenseIntAttr.class));
        }

        public boolean hasDilations() {
            return op.hasAttribute(BASE_DILATIONS_ATTR) || op.hasAttribute(WINDOW_DILATIONS_ATTR);
        }

        public Block body() {
            return op.region(0).front();
        }
    }
}
