package io.surfworks.parloops.lowering;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.IrTypes;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.Location;
import io.surfworks.parloops.ir.OpBuilder;
import io.surfworks.parloops.ir.Value;

/**
 * Materializes buffer extents as index values.
 *
 * <p>A static extent becomes a {@code std.constant}; a dynamic one becomes a
 * {@code std.dim} query on the buffer.
 */
public final class DimensionResolver {

    private DimensionResolver() {}

    /**
     * Resolves the extent of {@code memref} at {@code dim} as declared by its type.
     */
    public static Value resolve(OpBuilder b, Location loc, Value memref, int dim) {
        MemRefType type = StdOps.memRefType(memref);
        return resolve(b, loc, memref, dim, type.dim(dim));
    }

    /**
     * Resolves a declared extent, querying {@code memref} only if the extent is dynamic.
     */
    public static Value resolve(OpBuilder b, Location loc, Value memref, int dim, long extent) {
        if (extent == IrTypes.DYNAMIC) {
            return StdOps.dim(b, loc, memref, dim);
        }
        return StdOps.constantIndex(b, loc, extent);
    }

    /**
     * Resolves every extent of {@code memref}, in dimension order.
     */
    public static List<Value> resolveAll(OpBuilder b, Location loc, Value memref) {
        int rank = StdOps.memRefType(memref).rank();
        List<Value> extents = new ArrayList<>(rank);
        for (int i = 0; i < rank; i++) {
            extents.add(resolve(b, loc, memref, i));
        }
        return extents;
    }
}
