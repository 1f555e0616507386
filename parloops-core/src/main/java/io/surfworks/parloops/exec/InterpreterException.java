package io.surfworks.parloops.exec;

import io.surfworks.parloops.ir.Operation;

/**
 * Exception thrown when executing IR fails: an out-of-bounds access, an
 * operation without a kernel, or a runtime value of the wrong kind.
 */
public class InterpreterException extends RuntimeException {

    public InterpreterException(String message) {
        super(message);
    }

    public InterpreterException(Operation op, String message) {
        super(op.location() + ": " + op.name() + ": " + message);
    }
}
