package io.surfworks.parloops.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.surfworks.parloops.ir.Attributes.BoolAttr;
import io.surfworks.parloops.ir.Attributes.FloatAttr;
import io.surfworks.parloops.ir.Attributes.IntegerAttr;
import io.surfworks.parloops.ir.Attributes.StringAttr;
import io.surfworks.parloops.ir.IrTypes.IndexType;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.IrTypes.ScalarType;
import io.surfworks.parloops.ir.IrTypes.Type;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Value;

/**
 * Standard scalar, index and memory operations.
 */
public final class StdOps {

    public static final String DIALECT = "std";

    public static final String CONSTANT = "std.constant";
    public static final String ALLOC = "std.alloc";
    public static final String DEALLOC = "std.dealloc";
    public static final String LOAD = "std.load";
    public static final String STORE = "std.store";
    public static final String DIM = "std.dim";
    public static final String ADDI = "std.addi";
    public static final String SUBI = "std.subi";
    public static final String MULI = "std.muli";
    public static final String CMPI = "std.cmpi";
    public static final String AND = "std.and";
    public static final String SELECT = "std.select";
    public static final String ADDF = "std.addf";
    public static final String SUBF = "std.subf";
    public static final String MULF = "std.mulf";
    public static final String MAXF = "std.maxf";
    public static final String MINF = "std.minf";
    public static final String RETURN = "std.return";

    public static final String VALUE_ATTR = "value";
    public static final String INDEX_ATTR = "index";
    public static final String PREDICATE_ATTR = "predicate";

    private StdOps() {}

    public static Value constantIndex(OpBuilder b, Location loc, long value) {
        return b.create(CONSTANT, loc, List.of(), List.of(IndexType.INSTANCE),
                Map.of(VALUE_ATTR, new IntegerAttr(value)), 0).result();
    }

    public static Value constantFloat(OpBuilder b, Location loc, double value, ScalarType type) {
        if (!type.isFloatingPoint()) {
            throw new IllegalArgumentException("Float constant of non-float type " + type.toMlirString());
        }
        return b.create(CONSTANT, loc, List.of(), List.of(type),
                Map.of(VALUE_ATTR, new FloatAttr(value)), 0).result();
    }

    public static Value constantInt(OpBuilder b, Location loc, long value, ScalarType type) {
        if (!type.isInteger()) {
            throw new IllegalArgumentException("Integer constant of non-integer type " + type.toMlirString());
        }
        return b.create(CONSTANT, loc, List.of(), List.of(type),
                Map.of(VALUE_ATTR, new IntegerAttr(value)), 0).result();
    }

    public static Value constantBool(OpBuilder b, Location loc, boolean value) {
        return b.create(CONSTANT, loc, List.of(), List.of(ScalarType.I1),
                Map.of(VALUE_ATTR, new BoolAttr(value)), 0).result();
    }

    /**
     * Allocates a statically shaped buffer. Deallocation is left to later passes.
     */
    public static Value alloc(OpBuilder b, Location loc, MemRefType type) {
        if (!type.hasStaticShape()) {
            throw new IllegalArgumentException("alloc requires a static shape, got " + type.toMlirString());
        }
        return b.create(ALLOC, loc, List.of(), List.of(type)).result();
    }

    public static void dealloc(OpBuilder b, Location loc, Value memref) {
        b.create(DEALLOC, loc, List.of(memref), List.of());
    }

    public static Value load(OpBuilder b, Location loc, Value memref, List<Value> indices) {
        List<Value> operands = new ArrayList<>(indices.size() + 1);
        operands.add(memref);
        operands.addAll(indices);
        return b.create(LOAD, loc, operands, List.of(elementType(memref))).result();
    }

    public static void store(OpBuilder b, Location loc, Value value, Value memref, List<Value> indices) {
        List<Value> operands = new ArrayList<>(indices.size() + 2);
        operands.add(value);
        operands.add(memref);
        operands.addAll(indices);
        b.create(STORE, loc, operands, List.of());
    }

    /**
     * Runtime query of the extent of {@code memref} at {@code index}.
     */
    public static Value dim(OpBuilder b, Location loc, Value memref, int index) {
        return b.create(DIM, loc, List.of(memref), List.of(IndexType.INSTANCE),
                Map.of(INDEX_ATTR, new IntegerAttr(index)), 0).result();
    }

    public static Value addi(OpBuilder b, Location loc, Value lhs, Value rhs) {
        return binary(b, loc, ADDI, lhs, rhs);
    }

    public static Value subi(OpBuilder b, Location loc, Value lhs, Value rhs) {
        return binary(b, loc, SUBI, lhs, rhs);
    }

    public static Value muli(OpBuilder b, Location loc, Value lhs, Value rhs) {
        return binary(b, loc, MULI, lhs, rhs);
    }

    public static Value cmpi(OpBuilder b, Location loc, CmpIPredicate predicate, Value lhs, Value rhs) {
        return b.create(CMPI, loc, List.of(lhs, rhs), List.of(ScalarType.I1),
                Map.of(PREDICATE_ATTR, new StringAttr(predicate.mnemonic())), 0).result();
    }

    public static Value and(OpBuilder b, Location loc, Value lhs, Value rhs) {
        return binary(b, loc, AND, lhs, rhs);
    }

    public static Value select(OpBuilder b, Location loc, Value condition, Value whenTrue, Value whenFalse) {
        return b.create(SELECT, loc, List.of(condition, whenTrue, whenFalse), List.of(whenTrue.type())).result();
    }

    public static Value addf(OpBuilder b, Location loc, Value lhs, Value rhs) {
        return binary(b, loc, ADDF, lhs, rhs);
    }

    public static Value mulf(OpBuilder b, Location loc, Value lhs, Value rhs) {
        return binary(b, loc, MULF, lhs, rhs);
    }

    public static Value maxf(OpBuilder b, Location loc, Value lhs, Value rhs) {
        return binary(b, loc, MAXF, lhs, rhs);
    }

    public static void ret(OpBuilder b, Location loc) {
        b.create(RETURN, loc, List.of(), List.of());
    }

    /**
     * Returns the element type of a memref-typed value.
     */
    public static ScalarType elementType(Value memref) {
        return memRefType(memref).elementType();
    }

    public static MemRefType memRefType(Value value) {
        if (!(value.type() instanceof MemRefType memRef)) {
            throw new IllegalArgumentException("Expected memref value, got " + value.type().toMlirString());
        }
        return memRef;
    }

    private static Value binary(OpBuilder b, Location loc, String name, Value lhs, Value rhs) {
        Type type = lhs.type();
        return b.create(name, loc, List.of(lhs, rhs), List.of(type)).result();
    }
}
