package io.surfworks.parloops.ir;

import java.util.Objects;

import io.surfworks.parloops.ir.IrTypes.Type;

/**
 * An SSA value: either a block argument or an operation result.
 *
 * <p>Values compare by identity. The name hint is only used when printing
 * and never affects semantics.
 */
public final class Value {

    private final Type type;
    private final String nameHint;
    private final Operation definingOp;
    private final Block ownerBlock;
    private final int index;

    private Value(Type type, String nameHint, Operation definingOp, Block ownerBlock, int index) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.nameHint = nameHint;
        this.definingOp = definingOp;
        this.ownerBlock = ownerBlock;
        this.index = index;
    }

    static Value result(Operation op, int index, Type type) {
        return new Value(type, null, op, null, index);
    }

    static Value argument(Block block, int index, Type type, String nameHint) {
        return new Value(type, nameHint, null, block, index);
    }

    public Type type() {
        return type;
    }

    /**
     * Returns the name this value had in the source text, or null.
     */
    public String nameHint() {
        return nameHint;
    }

    public boolean isBlockArgument() {
        return ownerBlock != null;
    }

    /**
     * Returns the producing operation, or null for block arguments.
     */
    public Operation definingOp() {
        return definingOp;
    }

    /**
     * Returns the block declaring this argument, or null for op results.
     */
    public Block ownerBlock() {
        return ownerBlock;
    }

    /**
     * Position among the owner's results or the block's arguments.
     */
    public int index() {
        return index;
    }

    @Override
    public String toString() {
        String origin = isBlockArgument()
                ? "arg" + index
                : definingOp.name() + "#" + index;
        return "%" + (nameHint != null ? nameHint : origin) + " : " + type.toMlirString();
    }
}
