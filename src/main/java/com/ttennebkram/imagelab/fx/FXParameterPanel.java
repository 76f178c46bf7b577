package com.ttennebkram.imagelab.fx;

import com.ttennebkram.imagelab.registry.OperationSpec;
import com.ttennebkram.imagelab.registry.ParameterSpec;
import javafx.geometry.Insets;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Label;
import javafx.scene.control.Slider;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Parameter controls generated from an operation's {@link ParameterSpec}s:
 * sliders for numbers, an odd-only slider for kernel sizes and a combo box for choices.
 * Every change reports the full set of current values.
 */
public class FXParameterPanel extends VBox {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private Consumer<Map<String, Object>> onChange;

    public FXParameterPanel() {
        super(8);
        setPadding(new Insets(10));
        setPrefWidth(320);
    }

    public void setOnChange(Consumer<Map<String, Object>> onChange) {
        this.onChange = onChange;
    }

    public Map<String, Object> getValues() {
        return new LinkedHashMap<>(values);
    }

    /**
     * Rebuild the controls for an operation, starting from its defaults.
     */
    public void showOperation(OperationSpec spec) {
        getChildren().clear();
        values.clear();
        if (spec == null) {
            return;
        }
        Label description = new Label(spec.getDescription());
        description.setWrapText(true);
        description.setStyle("-fx-font-size: 11px; -fx-text-fill: #555555;");
        getChildren().add(description);

        for (ParameterSpec p : spec.getParameters()) {
            values.put(p.getName(), p.getDefaultValue());
            switch (p.getType()) {
                case CHOICE:
                    addComboBox(p);
                    break;
                case KERNEL_SIZE:
                    addOddKernelSlider(p);
                    break;
                case INTEGER:
                    addSlider(p, "%.0f", true);
                    break;
                case DECIMAL:
                default:
                    addSlider(p, "%.2f", false);
                    break;
            }
        }
        if (spec.getParameters().isEmpty()) {
            getChildren().add(new Label("No parameters"));
        }
    }

    private void addSlider(ParameterSpec p, String formatString, boolean integer) {
        double current = ((Number) p.getDefaultValue()).doubleValue();
        Slider slider = new Slider(p.getMin(), p.getMax(), current);
        slider.setPrefWidth(200);
        slider.setShowTickMarks(true);
        slider.setShowTickLabels(true);

        // Configure sensible tick spacing based on range
        double range = p.getMax() - p.getMin();
        if (range <= 10) {
            slider.setMajorTickUnit(Math.max(range / 4, 0.1));
        } else if (range <= 100) {
            slider.setMajorTickUnit(25);
        } else {
            slider.setMajorTickUnit(range / 4);
        }
        slider.setMinorTickCount(0);

        Label valueLabel = new Label(String.format(formatString, current));
        valueLabel.setMinWidth(50);

        slider.valueProperty().addListener((obs, oldVal, newVal) -> {
            valueLabel.setText(String.format(formatString, newVal.doubleValue()));
            Object value = integer ? (Object) (int) Math.round(newVal.doubleValue()) : (Object) newVal.doubleValue();
            update(p.getName(), value);
        });
        addRow(p.getLabel(), slider, valueLabel);
    }

    private void addOddKernelSlider(ParameterSpec p) {
        int max = (int) p.getMax();
        int current = (Integer) p.getDefaultValue();
        Slider slider = new Slider(1, max, current);
        slider.setPrefWidth(200);
        slider.setShowTickMarks(true);
        slider.setShowTickLabels(true);
        slider.setMajorTickUnit(Math.max(2, max / 5));
        slider.setMinorTickCount(0);
        slider.setBlockIncrement(2);  // Arrow keys move by 2

        Label valueLabel = new Label(String.valueOf(current));
        valueLabel.setMinWidth(50);

        // Snap to odd values
        slider.valueProperty().addListener((obs, oldVal, newVal) -> {
            int val = (int) Math.round(newVal.doubleValue());
            if (val % 2 == 0) {
                val = val < oldVal.intValue() ? val - 1 : val + 1;
                val = Math.max(1, Math.min(max, val));
                slider.setValue(val);
                return;
            }
            valueLabel.setText(String.valueOf(val));
            update(p.getName(), val);
        });
        addRow(p.getLabel(), slider, valueLabel);
    }

    private void addComboBox(ParameterSpec p) {
        ComboBox<String> combo = new ComboBox<>();
        combo.getItems().addAll(p.getChoices());
        combo.setValue((String) p.getDefaultValue());
        combo.valueProperty().addListener((obs, oldVal, newVal) -> update(p.getName(), newVal));
        addRow(p.getLabel(), combo);
    }

    private void addRow(String label, javafx.scene.Node... controls) {
        VBox row = new VBox(2);
        row.getChildren().add(new Label(label + ":"));
        HBox line = new HBox(10);
        line.getChildren().addAll(controls);
        row.getChildren().add(line);
        getChildren().add(row);
    }

    private void update(String name, Object value) {
        if (value == null || value.equals(values.get(name))) {
            return;
        }
        values.put(name, value);
        if (onChange != null) {
            onChange.accept(getValues());
        }
    }
}
