package io.surfworks.parloops.lowering;

import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import io.surfworks.parloops.config.LoweringOptions;
import io.surfworks.parloops.dialect.LhloOps;
import io.surfworks.parloops.dialect.LoopOps;
import io.surfworks.parloops.dialect.StdOps;
import io.surfworks.parloops.ir.Function;
import io.surfworks.parloops.pass.FunctionPass;
import io.surfworks.parloops.pass.PassContext;
import io.surfworks.parloops.pass.PassResult;
import io.surfworks.parloops.rewrite.ConversionResult;
import io.surfworks.parloops.rewrite.ConversionTarget;
import io.surfworks.parloops.rewrite.PartialConversion;
import io.surfworks.parloops.rewrite.RewritePatternSet;

/**
 * Replaces {@code lhlo.reduce} and {@code lhlo.reduce_window} with parallel loops.
 *
 * <p>Everything else in the loop, std and lhlo dialects stays legal, so the
 * element-wise lhlo ops cloned into combiners survive the pass. The pass
 * fails for a function if any reduction is left over.
 */
public final class LegalizeToParallelLoopsPass implements FunctionPass {

    public static final String NAME = "lhlo-legalize-to-parallel-loops";
    public static final String DESCRIPTION = "Legalize from LHLO dialect to parallel loops.";

    private static final Logger LOG = Logger.getLogger(LegalizeToParallelLoopsPass.class.getName());

    private final LoweringOptions options;

    public LegalizeToParallelLoopsPass() {
        this(LoweringOptions.defaults());
    }

    public LegalizeToParallelLoopsPass(LoweringOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    public LoweringOptions options() {
        return options;
    }

    /**
     * The patterns this pass applies.
     */
    public RewritePatternSet patterns() {
        return new RewritePatternSet()
                .add(new ReduceOpConverter())
                .add(new ReduceWindowOpConverter(options));
    }

    /**
     * Loop and std ops are legal, as is lhlo except its two reductions.
     */
    public static ConversionTarget target() {
        return new ConversionTarget()
                .addLegalDialect(LoopOps.DIALECT, StdOps.DIALECT, LhloOps.DIALECT)
                .addIllegalOp(LhloOps.REDUCE, LhloOps.REDUCE_WINDOW);
    }

    @Override
    public PassResult run(Function function, PassContext context) {
        ConversionResult result = PartialConversion.apply(function, target(), patterns(), context.diagnostics());
        if (result.succeeded()) {
            LOG.fine(() -> String.format("@%s: lowered %d reductions", function.name(), result.convertedCount()));
            return PassResult.success(NAME, function.name(), result.convertedCount());
        }
        String remaining = result.remainingIllegal().stream()
                .map(op -> op.name() + " at " + op.location())
                .collect(Collectors.joining(", "));
        return PassResult.failure(NAME, function.name(), result.convertedCount(),
                "failed to legalize " + remaining);
    }

    @Override
    public String toString() {
        return String.format("LegalizeToParallelLoopsPass[%s, %s]",
                options.attributePolicy(), options.dilationPolicy());
    }
}
