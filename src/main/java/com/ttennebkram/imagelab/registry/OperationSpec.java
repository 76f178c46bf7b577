package com.ttennebkram.imagelab.registry;

import com.ttennebkram.imagelab.model.PixelFormat;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Static description of a catalog entry: identity, parameter contract and accepted input.
 */
public final class OperationSpec {

    private final Category category;
    private final String name;
    private final String displayName;
    private final String description;
    private final List<ParameterSpec> parameters;
    private final Map<String, ParameterSpec> parametersByName;
    private final Set<PixelFormat> inputFormats;
    private final boolean dualInput;
    private final int order;

    public OperationSpec(Category category, String name, String displayName, String description,
                         List<ParameterSpec> parameters, Set<PixelFormat> inputFormats,
                         boolean dualInput, int order) {
        if (category == null || name == null || name.isBlank()) {
            throw new IllegalArgumentException("Category and name are required");
        }
        this.category = category;
        this.name = name;
        this.displayName = displayName == null || displayName.isEmpty() ? name : displayName;
        this.description = description == null ? "" : description;
        this.parameters = List.copyOf(parameters);
        this.inputFormats = inputFormats.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(PixelFormat.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(inputFormats));
        this.dualInput = dualInput;
        this.order = order;

        Map<String, ParameterSpec> byName = new LinkedHashMap<>();
        for (ParameterSpec p : this.parameters) {
            if (byName.put(p.getName(), p) != null) {
                throw new IllegalArgumentException("Duplicate parameter " + p.getName() + " in " + name);
            }
        }
        this.parametersByName = Collections.unmodifiableMap(byName);
    }

    public Category getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public List<ParameterSpec> getParameters() {
        return parameters;
    }

    /**
     * @return the parameter declaration, or null if the operation has no such parameter
     */
    public ParameterSpec getParameter(String parameterName) {
        return parametersByName.get(parameterName);
    }

    /**
     * Accepted input formats; empty means any format.
     */
    public Set<PixelFormat> getInputFormats() {
        return inputFormats;
    }

    public boolean acceptsAnyFormat() {
        return inputFormats.isEmpty();
    }

    public boolean accepts(PixelFormat format) {
        return inputFormats.isEmpty() || inputFormats.contains(format);
    }

    /**
     * Channel counts the operation works on without coercion.
     */
    public Set<Integer> getApplicableChannelCounts() {
        Set<Integer> counts = new TreeSet<>();
        Set<PixelFormat> formats = inputFormats.isEmpty() ? EnumSet.allOf(PixelFormat.class) : inputFormats;
        for (PixelFormat format : formats) {
            counts.add(format.getChannels());
        }
        return Collections.unmodifiableSet(counts);
    }

    public boolean isDualInput() {
        return dualInput;
    }

    public int getOrder() {
        return order;
    }

    /**
     * "CATEGORY/name" key, unique within a catalog.
     */
    public String getKey() {
        return category.name() + "/" + name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof OperationSpec)) {
            return false;
        }
        OperationSpec other = (OperationSpec) obj;
        return category == other.category && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * category.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return category.getDisplayName() + " / " + name;
    }
}
