package io.surfworks.parloops.dialect;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class CmpIPredicateTest {

    @ParameterizedTest
    @CsvSource({
        "eq,   3,  3, true",
        "ne,   3,  3, false",
        "slt, -1,  2, true",
        "sge, -1,  2, false",
        "ult, -1,  2, false",
        "ult,  1,  2, true",
        "ule,  2,  2, true",
        "ugt, -1,  2, true",
        "uge,  0,  1, false",
        "sgt,  5, -5, true",
        "sle,  5,  5, true"
    })
    void evaluates(String mnemonic, long lhs, long rhs, boolean expected) {
        assertEquals(expected, CmpIPredicate.fromMnemonic(mnemonic).evaluate(lhs, rhs));
    }

    @ParameterizedTest
    @EnumSource(CmpIPredicate.class)
    void mnemonicRoundTrips(CmpIPredicate predicate) {
        assertSame(predicate, CmpIPredicate.fromMnemonic(predicate.mnemonic()));
    }

    @Test
    void unknownMnemonic() {
        assertThrows(IllegalArgumentException.class, () -> CmpIPredicate.fromMnemonic("lt"));
    }
}
