package com.ttennebkram.imagelab.registry;

import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.model.PixelFormat;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParameterSpecTest {

    @Test
    public void testKernelSizeEvenValuesBecomeNextOdd() {
        ParameterSpec k = ParameterSpec.kernelSize("kernelSize", 31, 3);
        assertEquals(3, k.resolve(2));
        assertEquals(5, k.resolve(4));
        assertEquals(7, k.resolve(6));
        assertEquals(5, k.resolve(5));
        assertEquals(5, k.resolve(4.4));
        assertEquals(7, k.resolve("7"));
    }

    @Test
    public void testKernelSizeBounds() {
        ParameterSpec k = ParameterSpec.kernelSize("kernelSize", 31, 3);
        assertEquals(1, k.resolve(0));
        assertEquals(1, k.resolve(-9));
        assertEquals(31, k.resolve(100));
        assertEquals(31, k.resolve(30));

        // An even maximum is lowered so the clamp never lands on an even size
        ParameterSpec even = ParameterSpec.kernelSize("kernelSize", 8, 4);
        assertEquals(7.0, even.getMax());
        assertEquals(5, even.getDefaultValue());
        assertEquals(7, even.resolve(8));
    }

    @Test
    public void testIntegerClampsAndRounds() {
        ParameterSpec p = ParameterSpec.integer("iterations", "Iterations", 1, 10, 1);
        assertEquals(10, p.resolve(12));
        assertEquals(1, p.resolve(-3));
        assertEquals(3, p.resolve(2.5));
        assertEquals(4, p.resolve(" 4 "));
        assertEquals(1, p.resolve(null));
    }

    @Test
    public void testDecimalClamps() {
        ParameterSpec p = ParameterSpec.decimal("scale", "Scale", 0.1, 5.0, 1.0);
        assertEquals(5.0, p.resolve(9));
        assertEquals(0.1, p.resolve(0));
        assertEquals(2.5, p.resolve(2.5));
        assertEquals(1.0, p.resolve(null));
    }

    @Test
    public void testNonNumericValuesAreRejected() {
        ParameterSpec p = ParameterSpec.decimal("sigma", "Sigma", 0, 10, 0);
        assertThrows(InvalidParameterException.class, () -> p.resolve("abc"));
        assertThrows(InvalidParameterException.class, () -> p.resolve(Double.NaN));
        assertThrows(InvalidParameterException.class, () -> p.resolve(Double.POSITIVE_INFINITY));
        assertThrows(InvalidParameterException.class, () -> p.resolve(List.of(1)));
    }

    @Test
    public void testChoiceAcceptsLabelOrIndex() {
        ParameterSpec p = ParameterSpec.choice("borderMode", "Border Mode", "Constant (black)",
                "Constant (black)", "Replicate", "Reflect", "Wrap");
        assertEquals("Reflect", p.resolve("reflect"));
        assertEquals("Replicate", p.resolve(1));
        assertEquals("Constant (black)", p.resolve(null));
        assertThrows(InvalidParameterException.class, () -> p.resolve(4));
        assertThrows(InvalidParameterException.class, () -> p.resolve(1.5));
        assertThrows(InvalidParameterException.class, () -> p.resolve("Mirror"));
    }

    @Test
    public void testNumericChoiceLabelsMatchByValue() {
        ParameterSpec p = ParameterSpec.choice("apertureSize", "Aperture Size", "3", "3", "5", "7");
        assertEquals("5", p.resolve(5));
        assertEquals("7", p.resolve(7.0));
        assertEquals("5", p.resolve(1));
        assertEquals("3", p.resolve(" 3 "));
    }

    @Test
    public void testChoiceDefaultMustBeAnOption() {
        assertThrows(IllegalArgumentException.class, () -> ParameterSpec.choice("x", "X", "c", "a", "b"));
    }

    @Test
    public void testOperationParamsResolution() {
        OperationSpec spec = new OperationSpec(Category.FILTER, "Test", "", "", List.of(
                ParameterSpec.kernelSize("kernelSize", 31, 3),
                ParameterSpec.decimal("sigma", "Sigma", 0, 10, 0)),
                Collections.<PixelFormat>emptySet(), false, 1);

        OperationParams defaults = OperationParams.defaults(spec);
        assertEquals(3, defaults.getInt("kernelSize"));
        assertEquals(0.0, defaults.getDouble("sigma"));

        OperationParams resolved = OperationParams.resolve(spec, Map.of("kernelSize", 4, "sigma", 20));
        assertEquals(5, resolved.getInt("kernelSize"));
        assertEquals(10.0, resolved.getDouble("sigma"));
        assertTrue(resolved.has("sigma"));
        assertFalse(resolved.has("amount"));

        assertThrows(InvalidParameterException.class,
                () -> OperationParams.resolve(spec, Map.of("radius", 3)));
        assertEquals(resolved, OperationParams.resolve(spec, Map.of("kernelSize", "5", "sigma", 10.0)));
    }
}
