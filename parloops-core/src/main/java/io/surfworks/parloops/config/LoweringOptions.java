package io.surfworks.parloops.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options for lowering lhlo reductions to parallel loops.
 *
 * <p>Options are resolved in order of precedence:
 * <ol>
 *   <li>CLI flags (highest priority)</li>
 *   <li>Config file ({@code parloops.json} in the working directory, or {@code --config FILE})</li>
 *   <li>Defaults (lowest priority)</li>
 * </ol>
 *
 * @param attributePolicy handling of a missing stride or padding on a windowed reduction
 * @param dilationPolicy handling of dilation attributes on a windowed reduction
 * @param verifyAfterLowering run the structural verifier on every function after the pass
 */
public record LoweringOptions(
        AttributePolicy attributePolicy,
        DilationPolicy dilationPolicy,
        boolean verifyAfterLowering
) {

    /** Config file name looked up in the working directory */
    public static final String CONFIG_FILE = "parloops.json";

    public LoweringOptions {
        Objects.requireNonNull(attributePolicy, "attributePolicy cannot be null");
        Objects.requireNonNull(dilationPolicy, "dilationPolicy cannot be null");
    }

    /**
     * Returns the default options: lenient attributes, dilation ignored with a remark, verification on.
     */
    public static LoweringOptions defaults() {
        return new LoweringOptions(AttributePolicy.LENIENT, DilationPolicy.IGNORE_WITH_REMARK, true);
    }

    /**
     * Returns the config file path in the working directory.
     */
    public static Path configFile() {
        return Path.of(CONFIG_FILE);
    }

    public LoweringOptions withAttributePolicy(AttributePolicy policy) {
        return new LoweringOptions(policy, dilationPolicy, verifyAfterLowering);
    }

    public LoweringOptions withDilationPolicy(DilationPolicy policy) {
        return new LoweringOptions(attributePolicy, policy, verifyAfterLowering);
    }

    public LoweringOptions withVerifyAfterLowering(boolean verify) {
        return new LoweringOptions(attributePolicy, dilationPolicy, verify);
    }

    public boolean strictAttributes() {
        return attributePolicy == AttributePolicy.STRICT;
    }

    public boolean rejectDilation() {
        return dilationPolicy == DilationPolicy.REJECT;
    }
}
