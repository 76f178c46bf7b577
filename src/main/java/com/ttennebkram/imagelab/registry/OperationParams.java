package com.ttennebkram.imagelab.registry;

import com.ttennebkram.imagelab.errors.InvalidParameterException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameter values after resolution against an {@link OperationSpec}.
 * Every declared parameter is present, clamped and typed.
 */
public final class OperationParams {

    private static final OperationParams EMPTY = new OperationParams(Collections.emptyMap());

    private final Map<String, Object> values;

    private OperationParams(Map<String, Object> values) {
        this.values = values;
    }

    public static OperationParams empty() {
        return EMPTY;
    }

    /**
     * Resolve raw values for an operation. Missing values take the declared default.
     *
     * @throws InvalidParameterException for unknown names or uninterpretable values
     */
    public static OperationParams resolve(OperationSpec spec, Map<String, ?> raw) {
        Map<String, ?> input = raw == null ? Collections.emptyMap() : raw;
        for (String key : input.keySet()) {
            if (spec.getParameter(key) == null) {
                throw new InvalidParameterException("Operation '" + spec.getName() + "' has no parameter '" + key + "'");
            }
        }
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (ParameterSpec p : spec.getParameters()) {
            resolved.put(p.getName(), p.resolve(input.get(p.getName())));
        }
        return new OperationParams(Collections.unmodifiableMap(resolved));
    }

    /**
     * Defaults for every parameter of an operation.
     */
    public static OperationParams defaults(OperationSpec spec) {
        return resolve(spec, Collections.emptyMap());
    }

    public int getInt(String name) {
        return ((Number) require(name)).intValue();
    }

    public double getDouble(String name) {
        return ((Number) require(name)).doubleValue();
    }

    public String getString(String name) {
        return require(name).toString();
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new InvalidParameterException("Missing parameter '" + name + "'");
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof OperationParams && values.equals(((OperationParams) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
