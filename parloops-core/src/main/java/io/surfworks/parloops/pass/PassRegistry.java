package io.surfworks.parloops.pass;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import io.surfworks.parloops.config.LoweringOptions;

/**
 * Registry of passes by command-line name.
 *
 * <p>Thread-safe. Passes are created on demand via factory functions, so
 * each lookup yields an instance configured with the caller's options.
 */
public final class PassRegistry {

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * A registered pass.
     *
     * @param name command-line name
     * @param description one-line description
     * @param factory creates configured instances
     */
    public record Registration(String name, String description, PassFactory factory) {
        public Registration {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(description, "description cannot be null");
            Objects.requireNonNull(factory, "factory cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name cannot be blank");
            }
        }
    }

    public PassRegistry() {}

    /**
     * Registers a pass factory.
     *
     * @throws IllegalStateException if the name is already taken
     */
    public PassRegistry register(String name, String description, PassFactory factory) {
        Registration registration = new Registration(name, description, factory);
        if (registrations.putIfAbsent(name, registration) != null) {
            throw new IllegalStateException("Pass '" + name + "' is already registered");
        }
        return this;
    }

    public boolean isRegistered(String name) {
        return registrations.containsKey(name);
    }

    /**
     * Creates a new instance of a registered pass.
     *
     * @throws IllegalArgumentException if the pass is not registered
     */
    public FunctionPass create(String name, LoweringOptions options) {
        Registration registration = registrations.get(name);
        if (registration == null) {
            throw new IllegalArgumentException(
                    "Pass '" + name + "' not registered. Available: " + available());
        }
        return registration.factory().create(options);
    }

    /**
     * Returns registrations sorted by name.
     */
    public List<Registration> registrations() {
        return registrations.values().stream()
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .toList();
    }

    public List<String> available() {
        return registrations().stream().map(Registration::name).toList();
    }
}
