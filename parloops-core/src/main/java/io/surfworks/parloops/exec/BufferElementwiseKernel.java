package io.surfworks.parloops.exec;

import java.util.Arrays;
import java.util.List;
import java.util.function.DoubleBinaryOperator;

import io.surfworks.parloops.ir.Operation;

/**
 * Kernel for binary element-wise lhlo ops: {@code op(lhs, rhs, out)} writes
 * {@code apply(lhs[i], rhs[i])} into {@code out[i]} for every element.
 *
 * <p>Inside lowered reduction bodies the buffers are rank 0 and {@code out}
 * usually aliases {@code rhs}; both are read before the write.
 */
public class BufferElementwiseKernel implements OpKernel {

    private final DoubleBinaryOperator function;

    public BufferElementwiseKernel(DoubleBinaryOperator function) {
        this.function = function;
    }

    @Override
    public List<Object> execute(Operation op, List<Object> operands) {
        if (operands.size() != 3) {
            throw new InterpreterException(op, "expects 3 buffer operands, got " + operands.size());
        }
        Buffer lhs = RuntimeValues.asBuffer(op, operands.get(0));
        Buffer rhs = RuntimeValues.asBuffer(op, operands.get(1));
        Buffer out = RuntimeValues.asBuffer(op, operands.get(2));
        if (!Arrays.equals(lhs.shape(), rhs.shape()) || !Arrays.equals(lhs.shape(), out.shape())) {
            throw new InterpreterException(op, String.format("shape mismatch: %s, %s, %s",
                    Arrays.toString(lhs.shape()), Arrays.toString(rhs.shape()), Arrays.toString(out.shape())));
        }
        for (int i = 0; i < lhs.size(); i++) {
            double a = lhs.loadFlat(i);
            double b = rhs.loadFlat(i);
            out.storeFlat(i, function.applyAsDouble(a, b));
        }
        return List.of();
    }
}
