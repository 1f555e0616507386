package io.surfworks.parloops.lowering;

import io.surfworks.parloops.pass.PassRegistry;

/**
 * Registration of the lowering passes.
 */
public final class LoweringPasses {

    private LoweringPasses() {}

    public static void registerAll(PassRegistry registry) {
        registry.register(LegalizeToParallelLoopsPass.NAME, LegalizeToParallelLoopsPass.DESCRIPTION,
                LegalizeToParallelLoopsPass::new);
    }

    /**
     * Returns a registry holding every lowering pass.
     */
    public static PassRegistry defaultRegistry() {
        PassRegistry registry = new PassRegistry();
        registerAll(registry);
        return registry;
    }
}
