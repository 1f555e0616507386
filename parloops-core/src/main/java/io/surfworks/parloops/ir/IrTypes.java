package io.surfworks.parloops.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * Type classes for the buffer-level IR.
 *
 * The IR only needs three kinds of types: the loop index type, scalar
 * element types and ranked memory references whose extents may be
 * unknown until runtime.
 */
public final class IrTypes {

    /** Extent sentinel for a dimension that is only known at runtime. */
    public static final long DYNAMIC = -1;

    private IrTypes() {}

    /**
     * Base interface for all IR types.
     */
    public sealed interface Type permits IndexType, ScalarType, MemRefType {
        String toMlirString();
    }

    /**
     * Machine-sized integer used for loop bounds and buffer subscripts.
     */
    public record IndexType() implements Type {
        public static final IndexType INSTANCE = new IndexType();

        @Override
        public String toMlirString() {
            return "index";
        }
    }

    /**
     * Scalar element types: f32, f64, i1, i32, i64, etc.
     */
    public record ScalarType(String name) implements Type {
        public static final ScalarType F16 = new ScalarType("f16");
        public static final ScalarType F32 = new ScalarType("f32");
        public static final ScalarType F64 = new ScalarType("f64");
        public static final ScalarType I1 = new ScalarType("i1");
        public static final ScalarType I8 = new ScalarType("i8");
        public static final ScalarType I16 = new ScalarType("i16");
        public static final ScalarType I32 = new ScalarType("i32");
        public static final ScalarType I64 = new ScalarType("i64");

        public static ScalarType of(String name) {
            return switch (name) {
                case "f16" -> F16;
                case "f32" -> F32;
                case "f64" -> F64;
                case "i1" -> I1;
                case "i8" -> I8;
                case "i16" -> I16;
                case "i32" -> I32;
                case "i64" -> I64;
                default -> throw new IllegalArgumentException("Unknown scalar type: " + name);
            };
        }

        public static boolean isScalarName(String name) {
            return switch (name) {
                case "f16", "f32", "f64", "i1", "i8", "i16", "i32", "i64" -> true;
                default -> false;
            };
        }

        public boolean isFloatingPoint() {
            return name.startsWith("f");
        }

        public boolean isInteger() {
            return name.startsWith("i");
        }

        public boolean isBoolean() {
            return this.equals(I1);
        }

        @Override
        public String toMlirString() {
            return name;
        }
    }

    /**
     * Ranked memory reference: memref&lt;4x?xf32&gt;.
     *
     * A dimension equal to {@link IrTypes#DYNAMIC} is printed as {@code ?}
     * and has to be queried at runtime.
     */
    public record MemRefType(List<Long> shape, ScalarType elementType) implements Type {

        public MemRefType {
            shape = List.copyOf(shape);
            for (long d : shape) {
                if (d < 0 && d != DYNAMIC) {
                    throw new IllegalArgumentException("Invalid memref extent: " + d);
                }
            }
        }

        /**
         * Rank-0 buffer holding a single element.
         */
        public static MemRefType scalar(ScalarType elementType) {
            return new MemRefType(List.of(), elementType);
        }

        public static MemRefType of(ScalarType elementType, long... dims) {
            List<Long> shape = new ArrayList<>(dims.length);
            for (long d : dims) {
                shape.add(d);
            }
            return new MemRefType(shape, elementType);
        }

        public int rank() {
            return shape.size();
        }

        public long dim(int i) {
            return shape.get(i);
        }

        public boolean isDynamicDim(int i) {
            return shape.get(i) == DYNAMIC;
        }

        public boolean hasStaticShape() {
            return !shape.contains(DYNAMIC);
        }

        public long elementCount() {
            if (!hasStaticShape()) {
                throw new IllegalStateException("Element count of dynamic memref " + toMlirString());
            }
            long count = 1;
            for (long d : shape) {
                count *= d;
            }
            return count;
        }

        @Override
        public String toMlirString() {
            StringBuilder sb = new StringBuilder("memref<");
            for (long d : shape) {
                sb.append(d == DYNAMIC ? "?" : String.valueOf(d)).append("x");
            }
            sb.append(elementType.toMlirString()).append(">");
            return sb.toString();
        }
    }
}
