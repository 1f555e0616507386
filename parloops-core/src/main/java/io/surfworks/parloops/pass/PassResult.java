package io.surfworks.parloops.pass;

/**
 * Outcome of running one pass on one function.
 *
 * @param passName the pass that ran
 * @param functionName the function it ran on
 * @param succeeded false if the pass could not complete its transformation
 * @param rewrites number of operations rewritten
 * @param message failure reason, or empty on success
 */
public record PassResult(String passName, String functionName, boolean succeeded, int rewrites, String message) {

    public static PassResult success(String passName, String functionName, int rewrites) {
        return new PassResult(passName, functionName, true, rewrites, "");
    }

    public static PassResult failure(String passName, String functionName, int rewrites, String message) {
        return new PassResult(passName, functionName, false, rewrites, message);
    }

    @Override
    public String toString() {
        if (succeeded) {
            return String.format("PassResult[%s on @%s: ok, rewrites=%d]", passName, functionName, rewrites);
        }
        return String.format("PassResult[%s on @%s: FAILED, rewrites=%d, %s]",
                passName, functionName, rewrites, message);
    }
}
