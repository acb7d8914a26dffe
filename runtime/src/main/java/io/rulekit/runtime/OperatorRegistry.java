package io.rulekit.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable mapping from operator name to {@link LogicOperator}.
 *
 * <p>
 * Populated once through a {@link Builder}, typically at startup, and shared by reference
 * afterwards. Extending a registry means building a new one with {@link #toBuilder()}; an
 * existing instance never changes, so evaluations in flight are unaffected.
 *
 * <p>
 * Thread-safe: all fields are final and the map is unmodifiable.
 */
public final class OperatorRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(OperatorRegistry.class);

    private final Map<String, LogicOperator> operators;

    private OperatorRegistry(Map<String, LogicOperator> operators) {
        this.operators = Collections.unmodifiableMap(new LinkedHashMap<>(operators));
    }

    /** Creates a registry with no operators. */
    public static OperatorRegistry empty() {
        return new OperatorRegistry(Map.of());
    }

    /** Returns a fresh builder. */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-populated with this registry's operators. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.operators.putAll(operators);
        return builder;
    }

    /**
     * Looks up an operator by name (case-sensitive).
     *
     * @return the operator, or empty if none is registered under that name
     */
    public Optional<LogicOperator> find(String name) {
        return Optional.ofNullable(operators.get(name));
    }

    public boolean contains(String name) {
        return operators.containsKey(name);
    }

    /** Registered names in registration order. */
    public Set<String> names() {
        return operators.keySet();
    }

    public int size() {
        return operators.size();
    }

    /** Builder for an {@link OperatorRegistry}. Not thread-safe. */
    public static final class Builder {

        private final Map<String, LogicOperator> operators = new LinkedHashMap<>();

        Builder() {}

        /**
         * Registers an operator. A second registration under the same name replaces the first
         * (last-write-wins).
         *
         * @throws IllegalArgumentException if the name is null or empty
         * @throws NullPointerException     if the operator is null
         */
        public Builder register(String name, LogicOperator operator) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("operator name must not be null or empty");
            }
            if (operator == null) {
                throw new NullPointerException("operator must not be null");
            }
            if (operators.put(name, operator) != null) {
                LOG.debug("Operator replaced: name={}", name);
            }
            return this;
        }

        public OperatorRegistry build() {
            return new OperatorRegistry(operators);
        }
    }
}
