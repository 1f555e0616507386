package io.surfworks.parloops.pass;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.surfworks.parloops.dialect.IrVerifier;
import io.surfworks.parloops.diag.Severity;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.ir.Module;

/**
 * Runs a pipeline of function passes over every function of a module.
 *
 * <p>Passes run in the order they were added. A function whose pass fails is
 * skipped by the remaining passes; other functions are unaffected.
 *
 * <p>Example usage:
 * <pre>{@code
 * PassManager pm = new PassManager()
 *     .addPass(new LegalizeToParallelLoopsPass(options))
 *     .enableVerifier(true);
 * PipelineResult result = pm.run(module, new PassContext());
 * }</pre>
 */
public final class PassManager {

    private static final Logger LOG = Logger.getLogger(PassManager.class.getName());

    private final List<FunctionPass> passes = new ArrayList<>();
    private boolean verify;

    public PassManager() {}

    public PassManager addPass(FunctionPass pass) {
        passes.add(pass);
        return this;
    }

    /**
     * Verifies each function after every successful pass; a verification
     * failure turns that pass result into a failure.
     */
    public PassManager enableVerifier(boolean enabled) {
        this.verify = enabled;
        return this;
    }

    public List<FunctionPass> passes() {
        return List.copyOf(passes);
    }

    public PipelineResult run(Module module, PassContext context) {
        List<PassResult> results = new ArrayList<>();
        IrVerifier verifier = new IrVerifier();
        for (Function function : module.functions()) {
            for (FunctionPass pass : passes) {
                PassResult result = pass.run(function, context);
                if (result.succeeded() && verify) {
                    List<String> errors = verifier.validate(function);
                    if (!errors.isEmpty()) {
                        for (String error : errors) {
                            context.diagnostics().emit(Severity.ERROR, function.location(), error);
                        }
                        result = PassResult.failure(pass.name(), function.name(), result.rewrites(),
                                "verification failed: " + errors.get(0));
                    }
                }
                results.add(result);
                if (!result.succeeded()) {
                    LOG.warning(result.toString());
                    break;
                }
                LOG.fine(result::toString);
            }
        }
        return new PipelineResult(results);
    }

    @Override
    public String toString() {
        return String.format("PassManager[passes=%s, verify=%s]",
                passes.stream().map(FunctionPass::name).toList(), verify);
    }
}
