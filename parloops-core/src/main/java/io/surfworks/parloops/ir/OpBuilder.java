package io.surfworks.parloops.ir;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.surfworks.parloops.ir.Attributes.Attribute;
import io.surfworks.parloops.ir.IrTypes.Type;

/**
 * Creates operations at an insertion point.
 *
 * <p>The insertion point is a block plus the operation new operations are
 * placed in front of (null means "append"). Anchoring on an operation
 * instead of an index keeps the point stable when other operations are
 * inserted earlier in the same block.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpBuilder b = OpBuilder.atStart(loop.body());
 * try (InsertionGuard guard = b.guard()) {
 *     b.setInsertionPointToStart(inner.body());
 *     StdOps.load(b, loc, buffer, indices);
 * }
 * // back at the start of loop.body()
 * }</pre>
 */
public class OpBuilder {

    private Block block;
    private Operation before;

    public OpBuilder() {}

    public static OpBuilder atStart(Block block) {
        OpBuilder b = new OpBuilder();
        b.setInsertionPointToStart(block);
        return b;
    }

    public static OpBuilder atEnd(Block block) {
        OpBuilder b = new OpBuilder();
        b.setInsertionPointToEnd(block);
        return b;
    }

    public void setInsertionPointToStart(Block block) {
        this.block = Objects.requireNonNull(block, "block cannot be null");
        this.before = block.isEmpty() ? null : block.operations().get(0);
    }

    /**
     * Appends after the last operation, including a terminator.
     */
    public void setInsertionPointToEnd(Block block) {
        this.block = Objects.requireNonNull(block, "block cannot be null");
        this.before = null;
    }

    /**
     * Inserts in front of {@code op}.
     */
    public void setInsertionPoint(Operation op) {
        Block parent = requireAttached(op);
        this.block = parent;
        this.before = op;
    }

    public void setInsertionPointAfter(Operation op) {
        Block parent = requireAttached(op);
        int index = parent.indexOf(op);
        this.block = parent;
        this.before = index + 1 < parent.size() ? parent.operations().get(index + 1) : null;
    }

    public Block insertionBlock() {
        return block;
    }

    /**
     * Saves the current insertion point; closing the guard restores it.
     */
    public InsertionGuard guard() {
        return new InsertionGuard(this, block, before);
    }

    void restoreInsertionPoint(Block savedBlock, Operation savedBefore) {
        this.block = savedBlock;
        this.before = savedBefore;
    }

    /**
     * Inserts a detached operation at the insertion point.
     */
    public Operation insert(Operation op) {
        if (block == null) {
            throw new IllegalStateException("OpBuilder has no insertion point");
        }
        int index = before == null ? block.size() : block.indexOf(before);
        if (index < 0) {
            throw new IllegalStateException("Insertion anchor " + before.name() + " left its block");
        }
        block.insert(index, op);
        notifyOperationInserted(op);
        return op;
    }

    public Operation create(
            String name,
            Location location,
            List<Value> operands,
            List<Type> resultTypes,
            Map<String, Attribute> attributes,
            int numRegions) {
        return insert(Operation.create(name, location, operands, resultTypes, attributes, numRegions));
    }

    public Operation create(String name, Location location, List<Value> operands, List<Type> resultTypes) {
        return create(name, location, operands, resultTypes, Map.of(), 0);
    }

    /**
     * Clones {@code op} through {@code mapping} and inserts the copy.
     */
    public Operation clone(Operation op, IrMapping mapping) {
        return insert(op.clone(mapping));
    }

    /**
     * Hook for subclasses that track created operations.
     */
    protected void notifyOperationInserted(Operation op) {
    }

    private static Block requireAttached(Operation op) {
        Block parent = op.parentBlock();
        if (parent == null) {
            throw new IllegalArgumentException("Operation " + op.name() + " is not attached to a block");
        }
        return parent;
    }
}
