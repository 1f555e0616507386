package io.surfworks.parloops.rewrite;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import io.surfworks.parloops.ir.Operation;

/**
 * Describes which operations may remain after a conversion.
 *
 * <p>Operation-level entries take precedence over dialect-level entries, and
 * an illegal entry wins over a legal one at the same level.
 */
public final class ConversionTarget {

    private final Set<String> legalDialects = new LinkedHashSet<>();
    private final Set<String> illegalDialects = new LinkedHashSet<>();
    private final Set<String> legalOps = new LinkedHashSet<>();
    private final Set<String> illegalOps = new LinkedHashSet<>();

    public ConversionTarget() {}

    public ConversionTarget addLegalDialect(String... dialects) {
        legalDialects.addAll(Arrays.asList(dialects));
        return this;
    }

    public ConversionTarget addIllegalDialect(String... dialects) {
        illegalDialects.addAll(Arrays.asList(dialects));
        return this;
    }

    public ConversionTarget addLegalOp(String... opNames) {
        legalOps.addAll(Arrays.asList(opNames));
        return this;
    }

    public ConversionTarget addIllegalOp(String... opNames) {
        illegalOps.addAll(Arrays.asList(opNames));
        return this;
    }

    public Legality legality(Operation op) {
        return legality(op.name(), op.dialect());
    }

    public Legality legality(String opName, String dialect) {
        if (illegalOps.contains(opName)) {
            return Legality.ILLEGAL;
        }
        if (legalOps.contains(opName)) {
            return Legality.LEGAL;
        }
        if (illegalDialects.contains(dialect)) {
            return Legality.ILLEGAL;
        }
        if (legalDialects.contains(dialect)) {
            return Legality.LEGAL;
        }
        return Legality.UNKNOWN;
    }

    public boolean isIllegal(Operation op) {
        return legality(op) == Legality.ILLEGAL;
    }

    @Override
    public String toString() {
        return String.format("ConversionTarget[legalDialects=%s, legalOps=%s, illegalOps=%s]",
                legalDialects, legalOps, illegalOps);
    }
}
