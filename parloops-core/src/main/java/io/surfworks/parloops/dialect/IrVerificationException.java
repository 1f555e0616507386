package io.surfworks.parloops.dialect;

import java.util.List;

/**
 * Exception thrown when IR fails structural verification.
 */
public class IrVerificationException extends RuntimeException {

    private final List<String> errors;

    public IrVerificationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
