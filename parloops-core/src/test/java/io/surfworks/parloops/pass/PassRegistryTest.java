package io.surfworks.parloops.pass;

import io.surfworks.parloops.config.AttributePolicy;
import io.surfworks.parloops.config.LoweringOptions;
import io.surfworks.parloops.lowering.LegalizeToParallelLoopsPass;
import io.surfworks.parloops.lowering.LoweringPasses;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PassRegistry")
class PassRegistryTest {

    private PassRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PassRegistry();
    }

    private static FunctionPass noop(String name) {
        return new FunctionPass() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String description() {
                return "Does nothing.";
            }

            @Override
            public PassResult run(io.surfworks.parloops.ir.Function function, PassContext context) {
                return PassResult.success(name, function.name(), 0);
            }
        };
    }

    @Nested
    @DisplayName("register()")
    class RegisterTests {

        @Test
        @DisplayName("registers and reports passes")
        void registersPass() {
            registry.register("noop", "Does nothing.", options -> noop("noop"));

            assertTrue(registry.isRegistered("noop"));
            assertFalse(registry.isRegistered("other"));
        }

        @Test
        @DisplayName("rejects duplicate names")
        void rejectsDuplicate() {
            registry.register("noop", "Does nothing.", options -> noop("noop"));
            assertThrows(IllegalStateException.class,
                    () -> registry.register("noop", "Again.", options -> noop("noop")));
        }

        @Test
        @DisplayName("rejects blank names")
        void rejectsBlankName() {
            assertThrows(IllegalArgumentException.class,
                    () -> registry.register(" ", "Blank.", options -> noop(" ")));
        }
    }

    @Nested
    @DisplayName("create()")
    class CreateTests {

        @Test
        @DisplayName("passes options to the factory")
        void passesOptions() {
            LoweringPasses.registerAll(registry);
            LoweringOptions strict = LoweringOptions.defaults().withAttributePolicy(AttributePolicy.STRICT);

            FunctionPass pass = registry.create(LegalizeToParallelLoopsPass.NAME, strict);

            LegalizeToParallelLoopsPass lowering = assertInstanceOf(LegalizeToParallelLoopsPass.class, pass);
            assertSame(strict, lowering.options());
        }

        @Test
        @DisplayName("creates a fresh instance per call")
        void freshInstances() {
            LoweringPasses.registerAll(registry);
            LoweringOptions options = LoweringOptions.defaults();
            assertNotSame(registry.create(LegalizeToParallelLoopsPass.NAME, options),
                    registry.create(LegalizeToParallelLoopsPass.NAME, options));
        }

        @Test
        @DisplayName("lists available passes for unknown names")
        void unknownName() {
            registry.register("noop", "Does nothing.", options -> noop("noop"));
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> registry.create("missing", LoweringOptions.defaults()));
            assertTrue(e.getMessage().contains("noop"));
        }
    }

    @Test
    @DisplayName("registrations are sorted by name")
    void sortedRegistrations() {
        registry.register("zeta", "Z.", options -> noop("zeta"));
        registry.register("alpha", "A.", options -> noop("alpha"));

        assertEquals(List.of("alpha", "zeta"), registry.available());
        assertEquals("A.", registry.registrations().get(0).description());
    }

    @Test
    @DisplayName("default registry holds the lowering pass")
    void defaultRegistry() {
        PassRegistry defaults = LoweringPasses.defaultRegistry();
        assertEquals(List.of(LegalizeToParallelLoopsPass.NAME), defaults.available());
        assertEquals(LegalizeToParallelLoopsPass.DESCRIPTION, defaults.registrations().get(0).description());
    }
}
