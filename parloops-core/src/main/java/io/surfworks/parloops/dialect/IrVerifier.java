package io.surfworks.parloops.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import io.surfworks.parloops.ir.Attributes.DenseIntAttr;
import io.surfworks.parloops.ir.Attributes.IntegerAttr;
import io.surfworks.parloops.ir.Attributes.StringAttr;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes.IndexType;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.IrTypes.Type;
import io.surfworks.parloops.ir.Module;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Region;
import io.surfworks.parloops.ir.Value;

/**
 * Structural verifier for the lhlo / loop / std IR.
 *
 * Performs validation including:
 * - Value availability: operands must be defined before use in an enclosing scope
 * - Reduction invariants: three-argument bodies, reduced dimensions, output ranks
 * - Window invariants: window, stride and padding lengths match the operand rank
 * - Loop invariants: bound lists, induction variables, results and terminators
 * - Memory access: subscript counts match buffer ranks
 */
public final class IrVerifier {

    private final List<String> errors = new ArrayList<>();

    public IrVerifier() {}

    /**
     * Validates a module and returns a list of errors.
     * Returns empty list if validation passes.
     */
    public List<String> validate(Module module) {
        errors.clear();
        for (Function function : module.functions()) {
            validateFunction(function);
        }
        return new ArrayList<>(errors);
    }

    /**
     * Validates a single function and returns a list of errors.
     */
    public List<String> validate(Function function) {
        errors.clear();
        validateFunction(function);
        return new ArrayList<>(errors);
    }

    /**
     * Validates a module and throws if any errors are found.
     */
    public void check(Module module) {
        List<String> validationErrors = validate(module);
        if (!validationErrors.isEmpty()) {
            StringBuilder sb = new StringBuilder("IR verification failed:\n");
            for (String error : validationErrors) {
                sb.append("  - ").append(error).append("\n");
            }
            throw new IrVerificationException(sb.toString(), validationErrors);
        }
    }

    private void validateFunction(Function function) {
        validateBlock(function.body(), newValueSet(), "@" + function.name());
    }

    private void validateBlock(Block block, Set<Value> visible, String scope) {
        Set<Value> defined = newValueSet();
        defined.addAll(visible);
        defined.addAll(block.arguments());

        for (Operation op : block.operations()) {
            for (Value operand : op.operands()) {
                if (!defined.contains(operand)) {
                    error("Undefined value %s used in %s (%s)", operand, op.name(), scope);
                }
            }
            validateOperation(op);
            for (Region region : op.regions()) {
                for (Block nested : region.blocks()) {
                    validateBlock(nested, defined, op.name());
                }
            }
            defined.addAll(op.results());
        }
    }

    private void validateOperation(Operation op) {
        switch (op.name()) {
            case LhloOps.REDUCE -> validateReduce(new LhloOps.ReduceOp(op));
            case LhloOps.REDUCE_WINDOW -> validateReduceWindow(new LhloOps.ReduceWindowOp(op));
            case LhloOps.COPY -> validateBufferOperands(op, 2);
            case LoopOps.PARALLEL -> validateParallel(op);
            case LoopOps.REDUCE -> validateLoopReduce(op);
            case LoopOps.IF -> validateIf(op);
            case StdOps.LOAD -> validateAccess(op, 0, op.numOperands() - 1);
            case StdOps.STORE -> validateAccess(op, 1, op.numOperands() - 2);
            case StdOps.DIM -> validateDim(op);
            case StdOps.CMPI -> validateCmpi(op);
            default -> {
                if (LhloOps.BINARY_ELEMENTWISE.contains(op.name())) {
                    validateBufferOperands(op, 3);
                }
            }
        }
    }

    // ==================== lhlo ====================

    private void validateReduce(LhloOps.ReduceOp reduce) {
        Operation op = reduce.op();
        int[] sizes = reduce.segmentSizes();
        if (sizes == null) {
            error("lhlo.reduce operands cannot be split into inputs, init values and outputs");
            return;
        }
        if (sizes[0] + sizes[1] + sizes[2] != op.numOperands()) {
            error("lhlo.reduce segment sizes %d+%d+%d don't add up to %d operands",
                    sizes[0], sizes[1], sizes[2], op.numOperands());
            return;
        }
        if (sizes[0] == 0 || sizes[0] != sizes[1] || sizes[0] != sizes[2]) {
            error("lhlo.reduce needs matching non-empty input/init/output groups, got %d/%d/%d",
                    sizes[0], sizes[1], sizes[2]);
            return;
        }
        validateReductionBody(op, reduce.op().region(0));

        for (Value input : reduce.inputs()) {
            if (!(input.type() instanceof MemRefType inputType)) {
                error("lhlo.reduce input must be a memref, got %s", input.type().toMlirString());
                continue;
            }
            Set<Long> seen = new HashSet<>();
            for (long dim : reduce.dimensions()) {
                if (dim < 0 || dim >= inputType.rank()) {
                    error("lhlo.reduce dimension %d out of range for operand rank %d", dim, inputType.rank());
                }
                if (!seen.add(dim)) {
                    error("lhlo.reduce dimension %d listed twice", dim);
                }
            }
            for (Value out : reduce.outputs()) {
                if (out.type() instanceof MemRefType outType) {
                    int expected = inputType.rank() - seen.size();
                    if (outType.rank() != expected) {
                        error("lhlo.reduce output rank %d doesn't match %d parallel dimensions",
                                outType.rank(), expected);
                    }
                } else {
                    error("lhlo.reduce output must be a memref, got %s", out.type().toMlirString());
                }
            }
        }
        for (Value init : reduce.initValues()) {
            if (!(init.type() instanceof MemRefType initType) || initType.rank() != 0) {
                error("lhlo.reduce init value must be a rank-0 memref, got %s", init.type().toMlirString());
            }
        }
    }

    private void validateReduceWindow(LhloOps.ReduceWindowOp window) {
        Operation op = window.op();
        if (op.numOperands() != 3) {
            error("lhlo.reduce_window expects 3 operands, got %d", op.numOperands());
            return;
        }
        validateReductionBody(op, op.region(0));
        if (!(window.operand().type() instanceof MemRefType operandType)) {
            error("lhlo.reduce_window operand must be a memref");
            return;
        }
        int rank = operandType.rank();
        if (!op.hasAttribute(LhloOps.WINDOW_DIMENSIONS_ATTR)) {
            error("lhlo.reduce_window is missing window_dimensions");
        } else if (window.windowDimensions().size() != rank) {
            error("lhlo.reduce_window window_dimensions has %d entries for operand rank %d",
                    window.windowDimensions().size(), rank);
        }
        for (long w : window.windowDimensions()) {
            if (w <= 0) {
                error("lhlo.reduce_window window dimension must be positive, got %d", w);
            }
        }
        window.windowStrides().ifPresent(strides -> {
            if (strides.size() != rank) {
                error("lhlo.reduce_window window_strides has %d entries for operand rank %d", strides.size(), rank);
            }
            for (long s : strides) {
                if (s <= 0) {
                    error("lhlo.reduce_window stride must be positive, got %d", s);
                }
            }
        });
        window.padding().ifPresent(padding -> {
            if (!padding.shape().equals(List.of(rank, 2))) {
                error("lhlo.reduce_window padding must have shape [%d, 2], got %s", rank, padding.shape());
            }
        });
        if (window.out().type() instanceof MemRefType outType) {
            if (outType.rank() != rank) {
                error("lhlo.reduce_window output rank %d doesn't match operand rank %d", outType.rank(), rank);
            }
        } else {
            error("lhlo.reduce_window output must be a memref");
        }
        if (!(window.initValue().type() instanceof MemRefType initType) || initType.rank() != 0) {
            error("lhlo.reduce_window init value must be a rank-0 memref");
        }
    }

    private void validateReductionBody(Operation op, Region body) {
        if (body.blocks().size() != 1) {
            error("%s body must have exactly one block, got %d", op.name(), body.blocks().size());
            return;
        }
        Block block = body.front();
        if (block.numArguments() != 3) {
            error("%s body must have exactly 3 arguments, got %d", op.name(), block.numArguments());
        }
        for (Value arg : block.arguments()) {
            if (!(arg.type() instanceof MemRefType argType) || argType.rank() != 0) {
                error("%s body argument must be a rank-0 memref, got %s", op.name(), arg.type().toMlirString());
            }
        }
    }

    private void validateBufferOperands(Operation op, int expected) {
        if (op.numOperands() != expected) {
            error("%s expects %d buffer operands, got %d", op.name(), expected, op.numOperands());
            return;
        }
        List<Long> shape = null;
        for (Value operand : op.operands()) {
            if (!(operand.type() instanceof MemRefType type)) {
                error("%s operand must be a memref, got %s", op.name(), operand.type().toMlirString());
                return;
            }
            if (shape != null && !shape.equals(type.shape())) {
                error("%s operand shapes differ: %s vs %s", op.name(), shape, type.shape());
            }
            shape = type.shape();
        }
    }

    // ==================== loop ====================

    private void validateParallel(Operation op) {
        DenseIntAttr sizes = op.attribute(LoopOps.SEGMENT_SIZES_ATTR, DenseIntAttr.class);
        if (sizes == null || sizes.size() != 4) {
            error("loop.parallel needs a 4-entry %s attribute", LoopOps.SEGMENT_SIZES_ATTR);
            return;
        }
        long n = sizes.get(0);
        if (sizes.get(1) != n || sizes.get(2) != n) {
            error("loop.parallel has %d lower bounds, %d upper bounds and %d steps",
                    n, sizes.get(1), sizes.get(2));
            return;
        }
        if (3 * n + sizes.get(3) != op.numOperands()) {
            error("loop.parallel segment sizes don't match %d operands", op.numOperands());
            return;
        }
        LoopOps.ParallelOp loop = new LoopOps.ParallelOp(op);
        for (Value bound : op.operands().subList(0, (int) (3 * n))) {
            if (!(bound.type() instanceof IndexType)) {
                error("loop.parallel bound must be index, got %s", bound.type().toMlirString());
            }
        }
        if (op.numResults() != loop.initValues().size()) {
            error("loop.parallel has %d results for %d init values", op.numResults(), loop.initValues().size());
        }
        if (op.region(0).blocks().size() != 1) {
            error("loop.parallel body must have exactly one block");
            return;
        }
        Block body = loop.body();
        if (body.numArguments() != n) {
            error("loop.parallel body has %d induction variables for %d loops", body.numArguments(), n);
        }
        Operation terminator = body.terminator();
        if (terminator == null || !terminator.isA(LoopOps.YIELD)) {
            error("loop.parallel body must end with loop.yield");
        }
        long reduces = body.operations().stream().filter(o -> o.isA(LoopOps.REDUCE)).count();
        if (reduces != loop.initValues().size()) {
            error("loop.parallel has %d loop.reduce ops for %d init values", reduces, loop.initValues().size());
        }
    }

    private void validateLoopReduce(Operation op) {
        Operation parent = op.parentOp();
        if (parent == null || !parent.isA(LoopOps.PARALLEL)) {
            error("loop.reduce must be nested directly in loop.parallel");
        }
        if (op.numOperands() != 1) {
            error("loop.reduce expects 1 operand, got %d", op.numOperands());
            return;
        }
        if (op.region(0).blocks().size() != 1) {
            error("loop.reduce region must have exactly one block");
            return;
        }
        Block block = op.region(0).front();
        Type elementType = op.operand(0).type();
        if (block.numArguments() != 2) {
            error("loop.reduce combiner must take 2 arguments, got %d", block.numArguments());
        }
        for (Type argType : block.argumentTypes()) {
            if (!argType.equals(elementType)) {
                error("loop.reduce combiner argument %s doesn't match operand %s",
                        argType.toMlirString(), elementType.toMlirString());
            }
        }
        Operation terminator = block.terminator();
        if (terminator == null || !terminator.isA(LoopOps.REDUCE_RETURN)) {
            error("loop.reduce combiner must end with loop.reduce.return");
        } else if (terminator.numOperands() != 1 || !terminator.operand(0).type().equals(elementType)) {
            error("loop.reduce.return must yield one %s value", elementType.toMlirString());
        }
    }

    private void validateIf(Operation op) {
        if (op.numOperands() != 1 || !ScalarType.I1.equals(op.operand(0).type())) {
            error("loop.if condition must be a single i1 value");
        }
        LoopOps.IfOp ifOp = new LoopOps.IfOp(op);
        if (op.numResults() > 0 && !ifOp.hasElse()) {
            error("loop.if with results needs an else block");
        }
        validateYield(op, op.region(0));
        if (ifOp.hasElse()) {
            validateYield(op, op.region(1));
        }
    }

    private void validateYield(Operation op, Region region) {
        if (region.isEmpty()) {
            return;
        }
        Operation terminator = region.front().terminator();
        if (op.numResults() == 0 && terminator == null) {
            return;
        }
        if (terminator == null || !terminator.isA(LoopOps.YIELD)) {
            error("%s block must end with loop.yield", op.name());
            return;
        }
        if (!terminator.operands().stream().map(Value::type).toList().equals(op.resultTypes())) {
            error("%s yields %d values for %d results", op.name(), terminator.numOperands(), op.numResults());
        }
    }

    // ==================== std ====================

    private void validateAccess(Operation op, int memrefIndex, int indexCount) {
        if (op.numOperands() <= memrefIndex || !(op.operand(memrefIndex).type() instanceof MemRefType type)) {
            error("%s needs a memref operand", op.name());
            return;
        }
        boolean scalarAddressing = type.rank() == 0 && indexCount == 1;
        if (indexCount != type.rank() && !scalarAddressing) {
            error("%s uses %d indices for rank-%d %s", op.name(), indexCount, type.rank(), type.toMlirString());
        }
        for (Value index : op.operands().subList(memrefIndex + 1, op.numOperands())) {
            if (!(index.type() instanceof IndexType)) {
                error("%s index must be of index type, got %s", op.name(), index.type().toMlirString());
            }
        }
    }

    private void validateDim(Operation op) {
        IntegerAttr index = op.attribute(StdOps.INDEX_ATTR, IntegerAttr.class);
        if (index == null || op.numOperands() != 1 || !(op.operand(0).type() instanceof MemRefType type)) {
            error("std.dim needs one memref operand and an index attribute");
            return;
        }
        if (index.value() < 0 || index.value() >= type.rank()) {
            error("std.dim index %d out of range for %s", index.value(), type.toMlirString());
        }
    }

    private void validateCmpi(Operation op) {
        StringAttr predicate = op.attribute(StdOps.PREDICATE_ATTR, StringAttr.class);
        if (predicate == null) {
            error("std.cmpi is missing its predicate");
            return;
        }
        try {
            CmpIPredicate.fromMnemonic(predicate.value());
        } catch (IllegalArgumentException e) {
            error("std.cmpi has unknown predicate '%s'", predicate.value());
        }
    }

    private static Set<Value> newValueSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private void error(String format, Object... args) {
        errors.add(String.format(format, args));
    }
}
