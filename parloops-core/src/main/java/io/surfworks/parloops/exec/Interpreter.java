package io.surfworks.parloops.exec;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.ir.Block;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.IrTypes.MemRefType;
import io.surfworks.parloops.ir.Operation;
import io.surfworks.parloops.ir.Value;

/**
 * Reference interpreter for lowered functions.
 *
 * <p>Region-free operations go through the {@link KernelDispatcher}; the
 * structured loop ops are executed here. A {@code loop.parallel} runs its
 * iteration space sequentially in row-major order, and each
 * {@code loop.reduce} in its body folds its operand into the accumulator at
 * the same position through the combiner region. {@code lhlo.reduce} and
 * {@code lhlo.reduce_window} are rejected: lower them first.
 *
 * <p>Example usage:
 * <pre>{@code
 * Buffer input = Buffer.of(ScalarType.F32, new int[] {2, 3}, 1, 2, 3, 4, 5, 6);
 * Buffer init = Buffer.scalar(ScalarType.F32, 0);
 * Buffer out = Buffer.zeros(ScalarType.F32, 2);
 * new Interpreter().run(function, input, init, out);
 * }</pre>
 */
public final class Interpreter {

    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    private final KernelDispatcher dispatcher;
    private final Map<Value, Object> values = new IdentityHashMap<>();
    private long executedOps;

    public Interpreter() {
        this(new KernelDispatcher());
    }

    public Interpreter(KernelDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher cannot be null");
    }

    /**
     * Runs {@code function} with the given arguments. Buffers are updated in place.
     *
     * @throws InterpreterException on any runtime fault
     */
    public void run(Function function, Object... arguments) {
        List<Value> params = function.arguments();
        if (params.size() != arguments.length) {
            throw new IllegalArgumentException(String.format(
                    "@%s expects %d arguments, got %d", function.name(), params.size(), arguments.length));
        }
        values.clear();
        executedOps = 0;
        for (int i = 0; i < params.size(); i++) {
            Value param = params.get(i);
            Object argument = arguments[i];
            if (param.type() instanceof MemRefType type
                    && !(argument instanceof Buffer buffer && buffer.conformsTo(type))) {
                throw new IllegalArgumentException(String.format(
                        "Argument %d of @%s must be a buffer of type %s, got %s",
                        i, function.name(), type.toMlirString(), RuntimeValues.describe(argument)));
            }
            values.put(param, argument);
        }
        executeBlock(function.body(), null);
        LOG.fine(() -> String.format("@%s: executed %d operations", function.name(), executedOps));
    }

    /**
     * Number of operations executed by the last {@link #run}.
     */
    public long executedOps() {
        return executedOps;
    }

    /**
     * Executes a block and returns the operand values of its terminator.
     *
     * @param accumulators running accumulators of the innermost parallel loop, or null
     */
    private List<Object> executeBlock(Block block, Accumulators accumulators) {
        for (Operation op : block.operations()) {
            executedOps++;
            if (op.isTerminator()) {
                return lookup(op.operands());
            }
            switch (op.name()) {
                case LoopOps.PARALLEL -> bind(op, executeParallel(new LoopOps.ParallelOp(op)));
                case LoopOps.IF -> bind(op, executeIf(new LoopOps.IfOp(op)));
                case LoopOps.REDUCE -> executeReduce(new LoopOps.ReduceOp(op), accumulators);
                case LhloOps.REDUCE, LhloOps.REDUCE_WINDOW ->
                        throw new InterpreterException(op, "must be lowered to loops before execution");
                default -> bind(op, dispatcher.dispatch(op, lookup(op.operands())));
            }
        }
        return List.of();
    }

    private List<Object> executeParallel(LoopOps.ParallelOp loop) {
        Operation op = loop.op();
        long[] lower = RuntimeValues.toIndices(op, lookup(loop.lowerBounds()));
        long[] upper = RuntimeValues.toIndices(op, lookup(loop.upperBounds()));
        long[] steps = RuntimeValues.toIndices(op, lookup(loop.steps()));
        for (long step : steps) {
            if (step <= 0) {
                throw new InterpreterException(op, "step must be positive, got " + step);
            }
        }
        Accumulators accumulators = new Accumulators(lookup(loop.initValues()));
        List<Value> ivs = loop.inductionVars();
        int n = ivs.size();
        for (int i = 0; i < n; i++) {
            if (lower[i] >= upper[i]) {
                return accumulators.values();
            }
        }

        // Row-major odometer over the iteration space; a 0-d loop runs once.
        long[] current = lower.clone();
        while (true) {
            for (int i = 0; i < n; i++) {
                values.put(ivs.get(i), current[i]);
            }
            accumulators.resetCursor();
            executeBlock(loop.body(), accumulators);

            int d = n - 1;
            while (d >= 0) {
                current[d] += steps[d];
                if (current[d] < upper[d]) {
                    break;
                }
                current[d] = lower[d];
                d--;
            }
            if (d < 0) {
                return accumulators.values();
            }
        }
    }

    private void executeReduce(LoopOps.ReduceOp reduce, Accumulators accumulators) {
        Operation op = reduce.op();
        if (accumulators == null) {
            throw new InterpreterException(op, "loop.reduce outside of loop.parallel");
        }
        int slot = accumulators.next(op);
        Block combiner = reduce.body();
        values.put(combiner.argument(0), values.get(reduce.operand()));
        values.put(combiner.argument(1), accumulators.get(slot));
        List<Object> combined = executeBlock(combiner, null);
        if (combined.size() != 1) {
            throw new InterpreterException(op, "combiner must return one value, got " + combined.size());
        }
        accumulators.set(slot, combined.get(0));
    }

    private List<Object> executeIf(LoopOps.IfOp ifOp) {
        boolean condition = RuntimeValues.asBoolean(ifOp.op(), values.get(ifOp.condition()));
        if (condition) {
            return executeBlock(ifOp.thenBlock(), null);
        }
        if (ifOp.hasElse()) {
            return executeBlock(ifOp.elseBlock(), null);
        }
        return List.of();
    }

    private void bind(Operation op, List<Object> results) {
        if (results.size() != op.numResults()) {
            throw new InterpreterException(op, String.format(
                    "produced %d values for %d results", results.size(), op.numResults()));
        }
        for (int i = 0; i < results.size(); i++) {
            values.put(op.result(i), results.get(i));
        }
    }

    private List<Object> lookup(List<Value> operands) {
        List<Object> result = new ArrayList<>(operands.size());
        for (Value operand : operands) {
            if (!values.containsKey(operand)) {
                throw new InterpreterException("Value " + operand + " used before definition");
            }
            result.add(values.get(operand));
        }
        return result;
    }

    /**
     * Running accumulators of one parallel loop, consumed by its loop.reduce
     * ops in order of appearance on each iteration.
     */
    private static final class Accumulators {
        private final List<Object> slots;
        private int cursor;

        Accumulators(List<Object> initial) {
            this.slots = new ArrayList<>(initial);
        }

        void resetCursor() {
            cursor = 0;
        }

        int next(Operation op) {
            if (cursor >= slots.size()) {
                throw new InterpreterException(op, "more loop.reduce ops than init values");
            }
            return cursor++;
        }

        Object get(int slot) {
            return slots.get(slot);
        }

        void set(int slot, Object value) {
            slots.set(slot, value);
        }

        List<Object> values() {
            return List.copyOf(slots);
        }
    }
}
