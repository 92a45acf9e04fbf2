package org.neuralchilli.stepgraph.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What compute reports for one step.
 * An output absent from the maps was not emitted. Dynamic outputs map each raw mapping key
 * to its value, in emission order.
 */
public final class ComputeResult {

    private final boolean success;
    private final Map<String, Object> outputs;
    private final Map<String, Map<String, Object>> dynamicOutputs;
    private final String error;

    private ComputeResult(boolean success, Map<String, Object> outputs,
                          Map<String, Map<String, Object>> dynamicOutputs, String error) {
        this.success = success;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        Map<String, Map<String, Object>> dynamic = new LinkedHashMap<>();
        dynamicOutputs.forEach((name, instances) ->
                dynamic.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(instances))));
        this.dynamicOutputs = Collections.unmodifiableMap(dynamic);
        this.error = error;
    }

    public static ComputeResult success(Map<String, Object> outputs) {
        return new ComputeResult(true, outputs, Map.of(), null);
    }

    public static ComputeResult success(Map<String, Object> outputs, Map<String, Map<String, Object>> dynamicOutputs) {
        return new ComputeResult(true, outputs, dynamicOutputs, null);
    }

    public static ComputeResult empty() {
        return new ComputeResult(true, Map.of(), Map.of(), null);
    }

    public static ComputeResult failure(String error) {
        return new ComputeResult(false, Map.of(), Map.of(), error);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSuccess() {
        return success;
    }

    public Map<String, Object> outputs() {
        return outputs;
    }

    public Map<String, Map<String, Object>> dynamicOutputs() {
        return dynamicOutputs;
    }

    public String error() {
        return error;
    }

    public static class Builder {
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> dynamicOutputs = new LinkedHashMap<>();

        public Builder output(String name, Object value) {
            outputs.put(name, value);
            return this;
        }

        /**
         * Emit one keyed instance of a dynamic output.
         */
        public Builder dynamicOutput(String name, String mappingKey, Object value) {
            dynamicOutputs.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(mappingKey, value);
            return this;
        }

        /**
         * Declare a dynamic output as emitted with no instances.
         */
        public Builder emptyDynamicOutput(String name) {
            dynamicOutputs.computeIfAbsent(name, k -> new LinkedHashMap<>());
            return this;
        }

        public ComputeResult build() {
            return new ComputeResult(true, outputs, dynamicOutputs, null);
        }
    }
}
