package com.ttennebkram.imagelab.registry;

import com.ttennebkram.imagelab.errors.InvalidParameterException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Declaration of one operation parameter: its type, bounds and default.
 *
 * {@link #resolve(Object)} is the single place where raw values coming from the UI,
 * a saved recipe or a test are turned into the value an operation sees.
 */
public final class ParameterSpec {

    private final String name;
    private final String label;
    private final ParameterType type;
    private final double min;
    private final double max;
    private final Object defaultValue;
    private final List<String> choices;

    private ParameterSpec(String name, String label, ParameterType type, double min, double max,
                          Object defaultValue, List<String> choices) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Parameter name is required");
        }
        if (min > max) {
            throw new IllegalArgumentException("Parameter " + name + " has min > max");
        }
        this.name = name;
        this.label = label == null ? name : label;
        this.type = type;
        this.min = min;
        this.max = max;
        this.defaultValue = defaultValue;
        this.choices = choices;
    }

    public static ParameterSpec integer(String name, String label, int min, int max, int defaultValue) {
        return new ParameterSpec(name, label, ParameterType.INTEGER, min, max, defaultValue, Collections.emptyList());
    }

    public static ParameterSpec decimal(String name, String label, double min, double max, double defaultValue) {
        return new ParameterSpec(name, label, ParameterType.DECIMAL, min, max, defaultValue, Collections.emptyList());
    }

    /**
     * Kernel size parameter. An even max is lowered to the odd value below it.
     */
    public static ParameterSpec kernelSize(String name, String label, int max, int defaultValue) {
        int oddMax = Math.max(1, max % 2 == 0 ? max - 1 : max);
        int oddDefault = toOdd(Math.min(Math.max(defaultValue, 1), oddMax), oddMax);
        return new ParameterSpec(name, label, ParameterType.KERNEL_SIZE, 1, oddMax, oddDefault, Collections.emptyList());
    }

    public static ParameterSpec kernelSize(String name, int max, int defaultValue) {
        return kernelSize(name, "Kernel Size", max, defaultValue);
    }

    public static ParameterSpec choice(String name, String label, String defaultChoice, String... choices) {
        List<String> options = Collections.unmodifiableList(Arrays.asList(choices.clone()));
        if (!options.contains(defaultChoice)) {
            throw new IllegalArgumentException("Default " + defaultChoice + " is not one of " + options);
        }
        return new ParameterSpec(name, label, ParameterType.CHOICE, 0, options.size() - 1, defaultChoice, options);
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }

    public ParameterType getType() {
        return type;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public List<String> getChoices() {
        return choices;
    }

    /**
     * Resolve a raw value to the value handed to the operation.
     * <ul>
     *   <li>null yields the default</li>
     *   <li>numbers and numeric strings are clamped to [min, max]; integers round half-up</li>
     *   <li>kernel sizes are clamped and an even size becomes the next odd size</li>
     *   <li>choices accept a label (any case) or an index; a number equal to a numeric label means that label</li>
     * </ul>
     *
     * @return an Integer, Double or String depending on the type
     * @throws InvalidParameterException if the value cannot be interpreted
     */
    public Object resolve(Object raw) {
        if (raw == null) {
            return defaultValue;
        }
        switch (type) {
            case CHOICE:
                return resolveChoice(raw);
            case DECIMAL:
                return clamp(toNumber(raw));
            case INTEGER:
                return (int) Math.round(clamp(toNumber(raw)));
            case KERNEL_SIZE:
            default:
                int k = (int) Math.round(clamp(toNumber(raw)));
                return toOdd(k, (int) max);
        }
    }

    private static int toOdd(int k, int max) {
        if (k < 1) {
            k = 1;
        }
        if (k % 2 == 0) {
            k = k + 1 <= max ? k + 1 : k - 1;
        }
        return k;
    }

    private double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    private double toNumber(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                value = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new InvalidParameterException("Parameter '" + name + "' expects a number but got '" + raw + "'", e);
            }
        } else {
            throw new InvalidParameterException("Parameter '" + name + "' expects a number but got "
                    + raw.getClass().getSimpleName());
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidParameterException("Parameter '" + name + "' must be finite but got " + value);
        }
        return value;
    }

    private String resolveChoice(Object raw) {
        if (raw instanceof Number) {
            double index = ((Number) raw).doubleValue();
            if (index == Math.rint(index)) {
                // Numeric labels such as aperture sizes match by value before index
                String label = String.valueOf((long) index);
                if (choices.contains(label)) {
                    return label;
                }
            }
            if (index == Math.rint(index) && index >= 0 && index < choices.size()) {
                return choices.get((int) index);
            }
            throw new InvalidParameterException("Parameter '" + name + "' has no option " + raw);
        }
        String text = raw.toString().trim();
        for (String choice : choices) {
            if (choice.equalsIgnoreCase(text)) {
                return choice;
            }
        }
        throw new InvalidParameterException("Parameter '" + name + "' must be one of " + choices + " but got '" + raw + "'");
    }

    @Override
    public String toString() {
        if (type == ParameterType.CHOICE) {
            return name + " " + choices + " = " + defaultValue;
        }
        return name + " [" + min + ", " + max + "] = " + defaultValue;
    }
}
