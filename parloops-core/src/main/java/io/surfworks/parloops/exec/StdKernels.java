package io.surfworks.parloops.exec;

import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

import io.surfworks.parloops.dialect.CmpIPredicate;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.Attributes.Attribute;
import io.surfworks.parloops.ir.Attributes.BoolAttr;
import io.surfworks.parloops.ir.Attributes.FloatAttr;
import io.surfworks.parloops.ir.Attributes.IntegerAttr;
import io.surfworks.parloops.ir.Attributes.StringAttr;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.IrTypes.Type;
import io.surfworks.parloops.ir.Operation;

/**
 * Kernels for the std dialect.
 */
final class StdKernels {

    private StdKernels() {}

    static List<Object> constant(Operation op, List<Object> operands) {
        Attribute value = op.attribute(StdOps.VALUE_ATTR);
        Type type = op.result().type();
        if (value instanceof FloatAttr f) {
            return List.of(f.value());
        }
        if (value instanceof BoolAttr b) {
            return List.of(b.value());
        }
        if (value instanceof IntegerAttr i) {
            if (type instanceof ScalarType scalar && scalar.isBoolean()) {
                return List.of(i.value() != 0);
            }
            if (type instanceof ScalarType scalar && scalar.isFloatingPoint()) {
                return List.of((double) i.value());
            }
            return List.of(i.value());
        }
        throw new InterpreterException(op, "unsupported constant " + value);
    }

    static List<Object> alloc(Operation op, List<Object> operands) {
        if (!(op.result().type() instanceof MemRefType type)) {
            throw new InterpreterException(op, "result is not a memref");
        }
        return List.of(Buffer.allocate(type));
    }

    static List<Object> dealloc(Operation op, List<Object> operands) {
        RuntimeValues.asBuffer(op, operands.get(0));
        return List.of();
    }

    static List<Object> load(Operation op, List<Object> operands) {
        Buffer buffer = RuntimeValues.asBuffer(op, operands.get(0));
        long[] indices = RuntimeValues.toIndices(op, operands.subList(1, operands.size()));
        double stored = loadChecked(op, buffer, indices);
        return List.of(RuntimeValues.fromStorage(op.result().type(), stored));
    }

    static List<Object> store(Operation op, List<Object> operands) {
        double value = RuntimeValues.toStorage(op, operands.get(0));
        Buffer buffer = RuntimeValues.asBuffer(op, operands.get(1));
        long[] indices = RuntimeValues.toIndices(op, operands.subList(2, operands.size()));
        try {
            buffer.store(indices, value);
        } catch (InterpreterException e) {
            throw new InterpreterException(op, e.getMessage());
        }
        return List.of();
    }

    static List<Object> dim(Operation op, List<Object> operands) {
        Buffer buffer = RuntimeValues.asBuffer(op, operands.get(0));
        int index = (int) op.attribute(StdOps.INDEX_ATTR, IntegerAttr.class).value();
        if (index < 0 || index >= buffer.rank()) {
            throw new InterpreterException(op, "dimension " + index + " out of range for " + buffer);
        }
        return List.of((long) buffer.dim(index));
    }

    static OpKernel integer(LongBinaryOperator function) {
        return (op, operands) -> List.of(function.applyAsLong(
                RuntimeValues.asLong(op, operands.get(0)), RuntimeValues.asLong(op, operands.get(1))));
    }

    static OpKernel floating(DoubleBinaryOperator function) {
        return (op, operands) -> List.of(function.applyAsDouble(
                RuntimeValues.asDouble(op, operands.get(0)), RuntimeValues.asDouble(op, operands.get(1))));
    }

    static List<Object> cmpi(Operation op, List<Object> operands) {
        CmpIPredicate predicate = CmpIPredicate.fromMnemonic(
                op.attribute(StdOps.PREDICATE_ATTR, StringAttr.class).value());
        long lhs = RuntimeValues.asLong(op, operands.get(0));
        long rhs = RuntimeValues.asLong(op, operands.get(1));
        return List.of(predicate.evaluate(lhs, rhs));
    }

    static List<Object> and(Operation op, List<Object> operands) {
        Object lhs = operands.get(0);
        if (lhs instanceof Boolean) {
            return List.of(RuntimeValues.asBoolean(op, lhs) && RuntimeValues.asBoolean(op, operands.get(1)));
        }
        return List.of(RuntimeValues.asLong(op, lhs) & RuntimeValues.asLong(op, operands.get(1)));
    }

    static List<Object> select(Operation op, List<Object> operands) {
        boolean condition = RuntimeValues.asBoolean(op, operands.get(0));
        return List.of(condition ? operands.get(1) : operands.get(2));
    }

    private static double loadChecked(Operation op, Buffer buffer, long[] indices) {
        try {
            return buffer.load(indices);
        } catch (InterpreterException e) {
            throw new InterpreterException(op, e.getMessage());
        }
    }
}
