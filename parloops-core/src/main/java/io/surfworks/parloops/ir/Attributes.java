package io.surfworks.parloops.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Attribute classes attached to operations.
 */
public final class Attributes {

    private Attributes() {}

    /**
     * Base interface for operation attributes.
     */
    public sealed interface Attribute permits IntegerAttr, FloatAttr, BoolAttr, StringAttr, DenseIntAttr {
        String toMlirString();
    }

    public record IntegerAttr(long value) implements Attribute {
        @Override
        public String toMlirString() {
            return String.valueOf(value);
        }
    }

    public record FloatAttr(double value) implements Attribute {
        @Override
        public String toMlirString() {
            if (Double.isNaN(value)) {
                return "nan";
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? "inf" : "-inf";
            }
            return String.valueOf(value);
        }
    }

    public record BoolAttr(boolean value) implements Attribute {
        @Override
        public String toMlirString() {
            return String.valueOf(value);
        }
    }

    public record StringAttr(String value) implements Attribute {
        @Override
        public String toMlirString() {
            return "\"" + value + "\"";
        }
    }

    /**
     * Dense integer elements: dense&lt;[1, 2]&gt; or dense&lt;[[0, 1], [0, 1]]&gt;.
     *
     * Values are stored row-major; {@code shape} is either [n] or [rows, cols].
     */
    public record DenseIntAttr(List<Long> values, List<Integer> shape) implements Attribute {

        public DenseIntAttr {
            values = List.copyOf(values);
            shape = List.copyOf(shape);
            long count = 1;
            for (int d : shape) {
                count *= d;
            }
            if (count != values.size()) {
                throw new IllegalArgumentException(
                        "Dense attribute shape " + shape + " does not hold " + values.size() + " values");
            }
        }

        public static DenseIntAttr vector(List<Long> values) {
            return new DenseIntAttr(values, List.of(values.size()));
        }

        public static DenseIntAttr vector(long... values) {
            List<Long> list = new ArrayList<>(values.length);
            for (long v : values) {
                list.add(v);
            }
            return vector(list);
        }

        /**
         * Builds a [rows, 2] matrix from (low, high) pairs.
         */
        public static DenseIntAttr pairs(long[][] rows) {
            List<Long> list = new ArrayList<>(rows.length * 2);
            for (long[] row : rows) {
                if (row.length != 2) {
                    throw new IllegalArgumentException("Expected (low, high) pair, got " + row.length + " values");
                }
                list.add(row[0]);
                list.add(row[1]);
            }
            return new DenseIntAttr(list, List.of(rows.length, 2));
        }

        public int size() {
            return values.size();
        }

        public long get(int i) {
            return values.get(i);
        }

        public long get(int row, int col) {
            if (shape.size() != 2) {
                throw new IllegalStateException("Dense attribute is not two-dimensional: " + shape);
            }
            return values.get(row * shape.get(1) + col);
        }

        public int rows() {
            return shape.isEmpty() ? 0 : shape.get(0);
        }

        @Override
        public String toMlirString() {
            StringBuilder sb = new StringBuilder("dense<");
            if (shape.size() == 2) {
                sb.append("[");
                for (int r = 0; r < shape.get(0); r++) {
                    if (r > 0) sb.append(", ");
                    sb.append("[");
                    for (int c = 0; c < shape.get(1); c++) {
                        if (c > 0) sb.append(", ");
                        sb.append(get(r, c));
                    }
                    sb.append("]");
                }
                sb.append("]");
            } else {
                sb.append("[");
                for (int i = 0; i < values.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(values.get(i));
                }
                sb.append("]");
            }
            sb.append(">");
            return sb.toString();
        }
    }
}
