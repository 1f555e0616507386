package io.surfworks.parloops.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.surfworks.parloops.ir.IrTypes.Type;

/**
 * A straight-line list of operations with typed entry arguments.
 */
public final class Block {

    private final List<Value> arguments = new ArrayList<>();
    private final List<Operation> operations = new ArrayList<>();
    private Region parentRegion;

    public Block() {}

    public Value addArgument(Type type) {
        return addArgument(type, null);
    }

    public Value addArgument(Type type, String nameHint) {
        Value arg = Value.argument(this, arguments.size(), type, nameHint);
        arguments.add(arg);
        return arg;
    }

    public List<Value> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Value argument(int i) {
        return arguments.get(i);
    }

    public int numArguments() {
        return arguments.size();
    }

    public List<Type> argumentTypes() {
        return arguments.stream().map(Value::type).toList();
    }

    public List<Operation> operations() {
        return Collections.unmodifiableList(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Inserts a detached operation at {@code index}.
     */
    public void insert(int index, Operation op) {
        if (op.parentBlock() != null) {
            throw new IllegalStateException("Operation " + op.name() + " already belongs to a block");
        }
        operations.add(index, op);
        op.setParentBlock(this);
    }

    public void append(Operation op) {
        insert(operations.size(), op);
    }

    /**
     * Detaches {@code op} from this block.
     */
    public void remove(Operation op) {
        int index = indexOf(op);
        if (index < 0) {
            throw new IllegalArgumentException("Operation " + op.name() + " is not in this block");
        }
        operations.remove(index);
        op.setParentBlock(null);
    }

    public int indexOf(Operation op) {
        for (int i = 0; i < operations.size(); i++) {
            if (operations.get(i) == op) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the last operation if it is a terminator, otherwise null.
     */
    public Operation terminator() {
        if (operations.isEmpty()) {
            return null;
        }
        Operation last = operations.get(operations.size() - 1);
        return last.isTerminator() ? last : null;
    }

    /**
     * Returns every operation except a trailing terminator.
     */
    public List<Operation> withoutTerminator() {
        if (terminator() == null) {
            return List.copyOf(operations);
        }
        return List.copyOf(operations.subList(0, operations.size() - 1));
    }

    public Region parentRegion() {
        return parentRegion;
    }

    void setParentRegion(Region region) {
        this.parentRegion = region;
    }

    /**
     * Returns the operation owning this block's region, or null for a function body.
     */
    public Operation parentOp() {
        return parentRegion == null ? null : parentRegion.parentOp();
    }

    @Override
    public String toString() {
        return String.format("Block[args=%d, ops=%d]", arguments.size(), operations.size());
    }
}
