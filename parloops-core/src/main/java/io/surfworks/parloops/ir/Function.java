package io.surfworks.parloops.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

import io.surfworks.parloops.ir.IrTypes.Type;

/**
 * A function: a name plus a single-block body whose arguments are the
 * function parameters. Functions return nothing; results are written into
 * caller-provided buffers.
 */
public final class Function {

    private final String name;
    private final Location location;
    private final Region region;

    public Function(String name, List<Type> argumentTypes) {
        this(name, argumentTypes, Location.named("@" + name));
    }

    public Function(String name, List<Type> argumentTypes, Location location) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.location = location;
        this.region = Region.detached();
        Block entry = region.addBlock();
        for (Type type : argumentTypes) {
            entry.addArgument(type);
        }
    }

    /**
     * Creates a function whose body block is supplied by the caller (used by the parser).
     */
    public static Function withBody(String name, Block body, Location location) {
        Function function = new Function(name, location);
        function.region.addBlock(body);
        return function;
    }

    private Function(String name, Location location) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.location = location;
        this.region = Region.detached();
    }

    public String name() {
        return name;
    }

    public Location location() {
        return location;
    }

    public Block body() {
        return region.front();
    }

    public List<Value> arguments() {
        return body().arguments();
    }

    public Value argument(int i) {
        return body().argument(i);
    }

    /**
     * Visits every operation, including nested ones, in pre-order.
     */
    public void walk(Consumer<Operation> visitor) {
        for (Operation op : List.copyOf(body().operations())) {
            op.walk(visitor);
        }
    }

    /**
     * Returns a snapshot of every operation in pre-order.
     */
    public List<Operation> allOperations() {
        List<Operation> ops = new ArrayList<>();
        walk(ops::add);
        return ops;
    }

    /**
     * Rewrites every use of {@code from} inside this function to {@code to}.
     *
     * @return the number of operands rewritten
     */
    public int replaceAllUsesWith(Value from, Value to) {
        int[] count = {0};
        walk(op -> {
            for (int i = 0; i < op.numOperands(); i++) {
                if (op.operand(i) == from) {
                    op.setOperand(i, to);
                    count[0]++;
                }
            }
        });
        return count[0];
    }

    @Override
    public String toString() {
        return String.format("Function[@%s, args=%d, ops=%d]", name, arguments().size(), body().size());
    }
}
