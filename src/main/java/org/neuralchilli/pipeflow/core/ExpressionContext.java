package org.neuralchilli.pipeflow.core;

import org.neuralchilli.pipeflow.domain.Param;
import org.neuralchilli.pipeflow.domain.ParamValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Values visible to {@code $(...)} references, keyed by the reference text without the
 * surrounding {@code $( )}: {@code params.revision}, {@code context.pipelineRun.name},
 * {@code tasks.build.results.digest}, {@code resources.source.path}.
 */
public record ExpressionContext(Map<String, ParamValue> values) {

    public static final String PARAMS = "params.";
    public static final String CONTEXT = "context.";
    public static final String TASKS = "tasks.";
    public static final String RESOURCES = "resources.";

    public ExpressionContext {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public static ExpressionContext empty() {
        return new ExpressionContext(Map.of());
    }

    public ParamValue lookup(String reference) {
        return values.get(reference);
    }

    public boolean contains(String reference) {
        return values.containsKey(reference);
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    /**
     * Builder seeded with this context's values.
     */
    public Builder extend() {
        return new Builder(values);
    }

    public static class Builder {
        private final Map<String, ParamValue> values;

        private Builder(Map<String, ParamValue> initial) {
            this.values = new HashMap<>(initial);
        }

        public Builder param(String name, ParamValue value) {
            values.put(PARAMS + name, value);
            return this;
        }

        public Builder params(List<Param> params) {
            params.forEach(p -> param(p.name(), p.value()));
            return this;
        }

        public Builder context(String key, String value) {
            if (value != null) {
                values.put(CONTEXT + key, ParamValue.ofString(value));
            }
            return this;
        }

        public Builder taskResult(String pipelineTask, String result, String value) {
            values.put(ResultReference.of(pipelineTask, result).expression(), ParamValue.ofString(value));
            return this;
        }

        public Builder resource(String resource, String attribute, String value) {
            values.put(RESOURCES + resource + "." + attribute, ParamValue.ofString(value));
            return this;
        }

        public ExpressionContext build() {
            return new ExpressionContext(values);
        }
    }
}
