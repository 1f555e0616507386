package io.surfworks.parloops.exec;

import java.util.Arrays;
import java.util.Objects;

import io.surfworks.parloops.ir.IrTypes;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;

/**
 * A concrete memory buffer for the interpreter.
 *
 * <p>Elements are stored row-major as doubles whatever the element type;
 * integer stores truncate and {@code i1} stores normalize to 0 or 1. A rank-0
 * buffer holds one element and may be addressed with no index or with the
 * single index 0.
 *
 * <p>{@link #load} and {@link #store} are bounds-checked and counted; the
 * plain {@link #get} / {@link #set} accessors are for test setup and inspection.
 */
public final class Buffer {

    private final ScalarType elementType;
    private final int[] shape;
    private final double[] data;
    private long loads;
    private long stores;

    private Buffer(ScalarType elementType, int[] shape, double[] data) {
        this.elementType = Objects.requireNonNull(elementType, "elementType cannot be null");
        this.shape = shape.clone();
        this.data = data;
    }

    public static Buffer zeros(ScalarType elementType, int... shape) {
        return new Buffer(elementType, shape, new double[elementCount(shape)]);
    }

    public static Buffer filled(ScalarType elementType, double value, int... shape) {
        Buffer buffer = zeros(elementType, shape);
        Arrays.fill(buffer.data, buffer.normalize(value));
        return buffer;
    }

    /**
     * Creates a buffer from row-major values.
     */
    public static Buffer of(ScalarType elementType, int[] shape, double... values) {
        if (values.length != elementCount(shape)) {
            throw new IllegalArgumentException(String.format(
                    "Shape %s holds %d elements, got %d values",
                    Arrays.toString(shape), elementCount(shape), values.length));
        }
        Buffer buffer = new Buffer(elementType, shape, new double[values.length]);
        for (int i = 0; i < values.length; i++) {
            buffer.data[i] = buffer.normalize(values[i]);
        }
        return buffer;
    }

    public static Buffer scalar(ScalarType elementType, double value) {
        return of(elementType, new int[0], value);
    }

    /**
     * Allocates a buffer for a statically shaped memref type.
     */
    public static Buffer allocate(MemRefType type) {
        if (!type.hasStaticShape()) {
            throw new InterpreterException("Cannot allocate dynamically shaped " + type.toMlirString());
        }
        int[] shape = new int[type.rank()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = Math.toIntExact(type.dim(i));
        }
        return zeros(type.elementType(), shape);
    }

    public ScalarType elementType() {
        return elementType;
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int dim(int i) {
        return shape[i];
    }

    public int size() {
        return data.length;
    }

    /**
     * Returns true if this buffer can be bound to a value of {@code type}:
     * same element type, same rank, and equal extents wherever the type is static.
     */
    public boolean conformsTo(MemRefType type) {
        if (!type.elementType().equals(elementType) || type.rank() != shape.length) {
            return false;
        }
        for (int i = 0; i < shape.length; i++) {
            if (type.dim(i) != IrTypes.DYNAMIC && type.dim(i) != shape[i]) {
                return false;
            }
        }
        return true;
    }

    public double load(long[] indices) {
        int offset = offset(indices);
        loads++;
        return data[offset];
    }

    public void store(long[] indices, double value) {
        int offset = offset(indices);
        stores++;
        data[offset] = normalize(value);
    }

    double loadFlat(int offset) {
        loads++;
        return data[offset];
    }

    void storeFlat(int offset, double value) {
        stores++;
        data[offset] = normalize(value);
    }

    public double get(int... indices) {
        return data[offset(toLongs(indices))];
    }

    public void set(double value, int... indices) {
        data[offset(toLongs(indices))] = normalize(value);
    }

    /**
     * Returns a copy of the row-major contents.
     */
    public double[] toArray() {
        return data.clone();
    }

    public long loadCount() {
        return loads;
    }

    public long storeCount() {
        return stores;
    }

    public void resetCounters() {
        loads = 0;
        stores = 0;
    }

    private int offset(long[] indices) {
        if (shape.length == 0) {
            if (indices.length == 0 || indices.length == 1 && indices[0] == 0) {
                return 0;
            }
            throw new InterpreterException(String.format(
                    "Index %s out of bounds for rank-0 buffer", Arrays.toString(indices)));
        }
        if (indices.length != shape.length) {
            throw new InterpreterException(String.format(
                    "Expected %d indices, got %d", shape.length, indices.length));
        }
        int offset = 0;
        for (int i = 0; i < shape.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new InterpreterException(String.format(
                        "Index %s out of bounds for shape %s", Arrays.toString(indices), Arrays.toString(shape)));
            }
            offset = offset * shape[i] + (int) indices[i];
        }
        return offset;
    }

    private double normalize(double value) {
        if (elementType.isBoolean()) {
            return value != 0 ? 1 : 0;
        }
        if (elementType.isInteger()) {
            return (double) (long) value;
        }
        return value;
    }

    private static long[] toLongs(int[] indices) {
        long[] result = new long[indices.length];
        for (int i = 0; i < indices.length; i++) {
            result[i] = indices[i];
        }
        return result;
    }

    private static int elementCount(int[] shape) {
        int count = 1;
        for (int d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
            count = Math.multiplyExact(count, d);
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("Buffer[%s, shape=%s, loads=%d, stores=%d]",
                elementType.toMlirString(), Arrays.toString(shape), loads, stores);
    }
}
