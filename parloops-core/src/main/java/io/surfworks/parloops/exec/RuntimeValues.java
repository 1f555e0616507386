package io.surfworks.parloops.exec;

import java.util.List;

import io.surfworks.parloops.ir.IrTypes.IndexType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.IrTypes.Type;
import io.surfworks.parloops.ir.Operation;

/**
 * Conversions between runtime values and their storage form.
 */
final class RuntimeValues {

    private RuntimeValues() {}

    static Buffer asBuffer(Operation op, Object value) {
        if (value instanceof Buffer buffer) {
            return buffer;
        }
        throw new InterpreterException(op, "expected a buffer, got " + describe(value));
    }

    static long asLong(Operation op, Object value) {
        if (value instanceof Long l) {
            return l;
        }
        throw new InterpreterException(op, "expected an integer, got " + describe(value));
    }

    static double asDouble(Operation op, Object value) {
        if (value instanceof Double d) {
            return d;
        }
        throw new InterpreterException(op, "expected a float, got " + describe(value));
    }

    static boolean asBoolean(Operation op, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new InterpreterException(op, "expected an i1, got " + describe(value));
    }

    /**
     * Numeric storage form of a scalar runtime value.
     */
    static double toStorage(Operation op, Object value) {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        throw new InterpreterException(op, "expected a scalar, got " + describe(value));
    }

    /**
     * Runtime value of a stored element of the given type.
     */
    static Object fromStorage(Type type, double stored) {
        if (type instanceof IndexType) {
            return (long) stored;
        }
        ScalarType scalar = (ScalarType) type;
        if (scalar.isBoolean()) {
            return stored != 0;
        }
        if (scalar.isInteger()) {
            return (long) stored;
        }
        return stored;
    }

    static long[] toIndices(Operation op, List<Object> values) {
        long[] indices = new long[values.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = asLong(op, values.get(i));
        }
        return indices;
    }

    static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName() + " " + value;
    }
}
