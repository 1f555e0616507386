package io.surfworks.parloops.exec;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.Operation;

/**
 * Dispatches region-free operations to their kernels by operation name.
 */
public final class KernelDispatcher {

    private final Map<String, OpKernel> kernels = new ConcurrentHashMap<>();

    public KernelDispatcher() {
        registerDefaultKernels();
    }

    /**
     * Register a kernel for an operation name, replacing any previous one.
     */
    public void register(String opName, OpKernel kernel) {
        kernels.put(opName, kernel);
    }

    /**
     * Execute an operation.
     *
     * @throws InterpreterException if no kernel is registered
     */
    public List<Object> dispatch(Operation op, List<Object> operands) {
        OpKernel kernel = kernels.get(op.name());
        if (kernel == null) {
            throw new InterpreterException(op, "no kernel registered");
        }
        List<Object> results = kernel.execute(op, operands);
        if (results.size() != op.numResults()) {
            throw new InterpreterException(op, String.format(
                    "kernel produced %d values for %d results", results.size(), op.numResults()));
        }
        return results;
    }

    public boolean supports(String opName) {
        return kernels.containsKey(opName);
    }

    /**
     * Get list of supported operation names.
     */
    public List<String> supportedOps() {
        return kernels.keySet().stream().sorted().toList();
    }

    private void registerDefaultKernels() {
        // Scalars and memory
        register(StdOps.CONSTANT, StdKernels::constant);
        register(StdOps.ALLOC, StdKernels::alloc);
        register(StdOps.DEALLOC, StdKernels::dealloc);
        register(StdOps.LOAD, StdKernels::load);
        register(StdOps.STORE, StdKernels::store);
        register(StdOps.DIM, StdKernels::dim);

        // Index and integer arithmetic
        register(StdOps.ADDI, StdKernels.integer(Long::sum));
        register(StdOps.SUBI, StdKernels.integer((a, b) -> a - b));
        register(StdOps.MULI, StdKernels.integer((a, b) -> a * b));
        register(StdOps.CMPI, StdKernels::cmpi);
        register(StdOps.AND, StdKernels::and);
        register(StdOps.SELECT, StdKernels::select);

        // Floating point
        register(StdOps.ADDF, StdKernels.floating(Double::sum));
        register(StdOps.SUBF, StdKernels.floating((a, b) -> a - b));
        register(StdOps.MULF, StdKernels.floating((a, b) -> a * b));
        register(StdOps.MAXF, StdKernels.floating(Math::max));
        register(StdOps.MINF, StdKernels.floating(Math::min));

        // Buffer element-wise ops used in reduction bodies
        register(LhloOps.ADD, new BufferElementwiseKernel(Double::sum));
        register(LhloOps.SUBTRACT, new BufferElementwiseKernel((a, b) -> a - b));
        register(LhloOps.MULTIPLY, new BufferElementwiseKernel((a, b) -> a * b));
        register(LhloOps.MAXIMUM, new BufferElementwiseKernel(Math::max));
        register(LhloOps.MINIMUM, new BufferElementwiseKernel(Math::min));
        register(LhloOps.AND, new BufferElementwiseKernel((a, b) -> a != 0 && b != 0 ? 1 : 0));
        register(LhloOps.OR, new BufferElementwiseKernel((a, b) -> a != 0 || b != 0 ? 1 : 0));
        register(LhloOps.COPY, KernelDispatcher::copy);
    }

    private static List<Object> copy(Operation op, List<Object> operands) {
        Buffer source = RuntimeValues.asBuffer(op, operands.get(0));
        Buffer target = RuntimeValues.asBuffer(op, operands.get(1));
        if (source.size() != target.size()) {
            throw new InterpreterException(op, "size mismatch: " + source + " vs " + target);
        }
        for (int i = 0; i < source.size(); i++) {
            target.storeFlat(i, source.loadFlat(i));
        }
        return List.of();
    }
}
