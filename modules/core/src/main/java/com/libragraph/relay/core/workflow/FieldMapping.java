package com.libragraph.relay.core.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from {@link WorkflowField} to the node input it is written to.
 * Unbound fields are simply not injected.
 */
public final class FieldMapping {

    private final Map<WorkflowField, NodeBinding> bindings;

    private FieldMapping(EnumMap<WorkflowField, NodeBinding> bindings) {
        this.bindings = Collections.unmodifiableMap(new EnumMap<>(bindings));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<NodeBinding> binding(WorkflowField field) {
        return Optional.ofNullable(bindings.get(field));
    }

    public Map<WorkflowField, NodeBinding> bindings() {
        return bindings;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FieldMapping other && other.bindings.equals(bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "FieldMapping" + bindings;
    }

    public static final class Builder {

        private final EnumMap<WorkflowField, NodeBinding> bindings = new EnumMap<>(WorkflowField.class);

        private Builder() {
        }

        /** Binds {@code field} to its default input name on {@code nodeId}. */
        public Builder bind(WorkflowField field, String nodeId) {
            return bind(field, nodeId, field.defaultInputName());
        }

        public Builder bind(WorkflowField field, String nodeId, String inputName) {
            bindings.put(field, new NodeBinding(nodeId, inputName));
            return this;
        }

        public FieldMapping build() {
            return new FieldMapping(bindings);
        }
    }
}
