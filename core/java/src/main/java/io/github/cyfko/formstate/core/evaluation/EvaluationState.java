package io.github.cyfko.formstate.core.evaluation;

import io.github.cyfko.formstate.core.model.ResponseIndex;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything an evaluation pass computed, keyed by response node id.
 * <p>
 * A state is immutable. A pass starts from the previous state's {@link #toBuilder() builder},
 * replaces what it re-evaluates, drops what belongs to removed nodes and freezes the result.
 * Keying by node id keeps results attached to the right repeated instance when instances before
 * it are removed.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class EvaluationState implements StateView {

    private static final EvaluationState EMPTY = new Builder().build();

    private final Map<Long, Boolean> enabled;
    private final Map<SlotKey, Boolean> slotEnabled;
    private final Map<Long, Map<String, List<Object>>> variables;
    private final Map<Long, List<Object>> baseOptions;
    private final Map<Long, Map<Integer, Boolean>> toggles;
    private final Map<Long, List<Object>> calculated;
    private final Map<TargetKey, ExpressionError> errors;
    private final Set<TargetKey> evaluated;

    private EvaluationState(Builder builder) {
        this.enabled = Map.copyOf(builder.enabled);
        this.slotEnabled = Map.copyOf(builder.slotEnabled);
        Map<Long, Map<String, List<Object>>> vars = new HashMap<>();
        builder.variables.forEach((id, byName) -> vars.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
        this.variables = Collections.unmodifiableMap(vars);
        this.baseOptions = Map.copyOf(builder.baseOptions);
        Map<Long, Map<Integer, Boolean>> toggleCopy = new HashMap<>();
        builder.toggles.forEach((id, values) -> toggleCopy.put(id, Map.copyOf(values)));
        this.toggles = Collections.unmodifiableMap(toggleCopy);
        this.calculated = Map.copyOf(builder.calculated);
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.errors));
        this.evaluated = Set.copyOf(builder.evaluated);
    }

    /**
     * @return the state before the first pass
     */
    public static EvaluationState empty() {
        return EMPTY;
    }

    @Override
    public Optional<Boolean> ownEnabled(long nodeId) {
        return Optional.ofNullable(enabled.get(nodeId));
    }

    @Override
    public Optional<Boolean> slotEnabled(SlotKey slot) {
        return Optional.ofNullable(slotEnabled.get(slot));
    }

    @Override
    public Map<String, List<Object>> variablesAt(long nodeId) {
        return variables.getOrDefault(nodeId, Map.of());
    }

    @Override
    public Optional<List<Object>> baseOptions(long nodeId) {
        return Optional.ofNullable(baseOptions.get(nodeId));
    }

    @Override
    public Map<Integer, Boolean> toggles(long nodeId) {
        return toggles.getOrDefault(nodeId, Map.of());
    }

    public Optional<List<Object>> calculated(long nodeId) {
        return Optional.ofNullable(calculated.get(nodeId));
    }

    public Collection<ExpressionError> errors() {
        return errors.values();
    }

    boolean wasEvaluated(TargetKey key) {
        return evaluated.contains(key);
    }

    public int evaluatedCount() {
        return evaluated.size();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.enabled.putAll(enabled);
        builder.slotEnabled.putAll(slotEnabled);
        variables.forEach((id, byName) -> builder.variables.put(id, new LinkedHashMap<>(byName)));
        builder.baseOptions.putAll(baseOptions);
        toggles.forEach((id, values) -> builder.toggles.put(id, new HashMap<>(values)));
        builder.calculated.putAll(calculated);
        builder.errors.putAll(errors);
        builder.evaluated.addAll(evaluated);
        return builder;
    }

    /**
     * Mutable copy used while a pass runs. Reads see the pass's own writes.
     */
    public static final class Builder implements StateView {
        private final Map<Long, Boolean> enabled = new HashMap<>();
        private final Map<SlotKey, Boolean> slotEnabled = new HashMap<>();
        private final Map<Long, Map<String, List<Object>>> variables = new HashMap<>();
        private final Map<Long, List<Object>> baseOptions = new HashMap<>();
        private final Map<Long, Map<Integer, Boolean>> toggles = new HashMap<>();
        private final Map<Long, List<Object>> calculated = new HashMap<>();
        private final Map<TargetKey, ExpressionError> errors = new LinkedHashMap<>();
        private final Set<TargetKey> evaluated = new HashSet<>();

        private Builder() {
        }

        @Override
        public Optional<Boolean> ownEnabled(long nodeId) {
            return Optional.ofNullable(enabled.get(nodeId));
        }

        @Override
        public Optional<Boolean> slotEnabled(SlotKey slot) {
            return Optional.ofNullable(slotEnabled.get(slot));
        }

        @Override
        public Map<String, List<Object>> variablesAt(long nodeId) {
            return variables.getOrDefault(nodeId, Map.of());
        }

        @Override
        public Optional<List<Object>> baseOptions(long nodeId) {
            return Optional.ofNullable(baseOptions.get(nodeId));
        }

        @Override
        public Map<Integer, Boolean> toggles(long nodeId) {
            return toggles.getOrDefault(nodeId, Map.of());
        }

        /** @return true if the value changed */
        boolean putEnabled(long nodeId, boolean value) {
            Boolean previous = enabled.put(nodeId, value);
            return previous == null ? !value : previous != value;
        }

        /** @return true if the value changed */
        boolean putSlotEnabled(SlotKey slot, boolean value) {
            Boolean previous = slotEnabled.put(slot, value);
            return previous == null ? !value : previous != value;
        }

        /** @return true if the value changed */
        boolean putVariable(long nodeId, String name, List<Object> values) {
            Map<String, List<Object>> byName = variables.computeIfAbsent(nodeId, k -> new LinkedHashMap<>());
            if (values == null) {
                return byName.remove(name) != null;
            }
            return !values.equals(byName.put(name, List.copyOf(values)));
        }

        /** @return true if the value changed */
        boolean putBaseOptions(long nodeId, List<Object> options) {
            if (options == null) {
                return baseOptions.remove(nodeId) != null;
            }
            return !options.equals(baseOptions.put(nodeId, List.copyOf(options)));
        }

        /** @return true if the value changed */
        boolean putToggle(long nodeId, int toggleIndex, boolean value) {
            Boolean previous = toggles.computeIfAbsent(nodeId, k -> new HashMap<>()).put(toggleIndex, value);
            return previous == null || previous != value;
        }

        void putCalculated(long nodeId, List<Object> values) {
            calculated.put(nodeId, List.copyOf(values));
        }

        void recordError(TargetKey key, ExpressionError error) {
            errors.put(key, error);
        }

        ExpressionError recordedError(TargetKey key) {
            return errors.get(key);
        }

        void clearError(TargetKey key) {
            errors.remove(key);
        }

        void markEvaluated(TargetKey key) {
            evaluated.add(key);
        }

        boolean wasEvaluated(TargetKey key) {
            return evaluated.contains(key);
        }

        /**
         * Drops every entry of nodes that are no longer part of the tree.
         */
        void prune(ResponseIndex index) {
            enabled.keySet().removeIf(id -> !index.contains(id));
            slotEnabled.keySet().removeIf(slot -> !index.contains(slot.parentNodeId()));
            variables.keySet().removeIf(id -> !index.contains(id));
            baseOptions.keySet().removeIf(id -> !index.contains(id));
            toggles.keySet().removeIf(id -> !index.contains(id));
            calculated.keySet().removeIf(id -> !index.contains(id));
            errors.keySet().removeIf(key -> !index.contains(key.targetNodeId()));
            evaluated.removeIf(key -> !index.contains(key.targetNodeId()));
        }

        public EvaluationState build() {
            return new EvaluationState(this);
        }
    }
}
