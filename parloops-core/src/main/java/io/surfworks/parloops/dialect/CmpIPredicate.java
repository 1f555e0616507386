package io.surfworks.parloops.dialect;

/**
 * Integer comparison predicates for {@code std.cmpi}.
 *
 * The unsigned variants reinterpret both operands as unsigned 64-bit values,
 * so a negative index compares greater than any non-negative extent.
 */
public enum CmpIPredicate {
    EQ("eq"),
    NE("ne"),
    SLT("slt"),
    SLE("sle"),
    SGT("sgt"),
    SGE("sge"),
    ULT("ult"),
    ULE("ule"),
    UGT("ugt"),
    UGE("uge");

    private final String mnemonic;

    CmpIPredicate(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public static CmpIPredicate fromMnemonic(String mnemonic) {
        for (CmpIPredicate p : values()) {
            if (p.mnemonic.equals(mnemonic)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown cmpi predicate: " + mnemonic);
    }

    public boolean evaluate(long lhs, long rhs) {
        return switch (this) {
            case EQ -> lhs == rhs;
            case NE -> lhs != rhs;
            case SLT -> lhs < rhs;
            case SLE -> lhs <= rhs;
            case SGT -> lhs > rhs;
            case SGE -> lhs >= rhs;
            case ULT -> Long.compareUnsigned(lhs, rhs) < 0;
            case ULE -> Long.compareUnsigned(lhs, rhs) <= 0;
            case UGT -> Long.compareUnsigned(lhs, rhs) > 0;
            case UGE -> Long.compareUnsigned(lhs, rhs) >= 0;
        };
    }
}
