package com.ttennebkram.imagelab.registry;

import com.ttennebkram.imagelab.errors.DuplicateOperationException;
import com.ttennebkram.imagelab.errors.UnknownOperationException;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.processors.ImageOperation;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OperationCatalogTest {

    private static OperationCatalog catalog;

    private static final ImageOperation IDENTITY = (input, params) -> input.clone();

    @BeforeAll
    public static void setUp() {
        catalog = OperationCatalog.createDefault();
    }

    private static OperationSpec spec(Category category, String name, int order) {
        return new OperationSpec(category, name, "", "", Collections.emptyList(),
                Collections.<PixelFormat>emptySet(), false, order);
    }

    private static List<String> names(Category category) {
        return catalog.listByCategory(category).stream().map(OperationSpec::getName).collect(Collectors.toList());
    }

    @Test
    public void testDefaultCatalogHasEveryOperation() {
        assertEquals(List.of("RGB to BGR", "BGR to RGB", "RGB to HSV", "HSV to RGB", "RGB to YCbCr",
                "YCbCr to RGB", "RGB to Grayscale", "Grayscale to RGB",
                "RGB to Grayscale (Manual)", "RGB to HSV (Manual)", "Sepia"), names(Category.COLOR));
        assertEquals(List.of("Rotate", "Scale", "Translate", "Affine", "Perspective", "Flip"), names(Category.GEOMETRIC));
        assertEquals(List.of("Mean", "Gaussian", "Median", "Emboss"), names(Category.FILTER));
        assertEquals(List.of("Dilate", "Erode", "Open", "Close"), names(Category.MORPHOLOGY));
        assertEquals(List.of("Histogram Equalization", "Contrast Stretch", "Sharpen", "Brightness", "Gamma", "CLAHE"),
                names(Category.ENHANCEMENT));
        assertEquals(List.of("Sobel", "Laplacian", "Canny", "Prewitt"), names(Category.EDGE));
        assertEquals(List.of("AND", "OR", "XOR", "NOT"), names(Category.BITWISE));
        assertEquals(List.of("JPEG", "PNG", "BMP"), names(Category.COMPRESSION));
        assertEquals(List.of(Category.values()), catalog.categories());
    }

    @Test
    public void testEverySpecResolvesToOneOperation() {
        for (Category category : catalog.categories()) {
            for (OperationSpec spec : catalog.listByCategory(category)) {
                assertNotNull(catalog.operationFor(spec), spec.getKey());
                assertNotNull(OperationParams.defaults(spec));
            }
        }
    }

    @Test
    public void testLookup() {
        OperationSpec gaussian = catalog.lookup(Category.FILTER, "Gaussian");
        assertEquals("Gaussian Blur", gaussian.getDisplayName());
        assertSame(gaussian, catalog.lookup(Category.FILTER, "gaussian blur"));
        assertSame(gaussian, catalog.lookup("Filter", "GAUSSIAN"));
        assertSame(gaussian, catalog.lookup("Filtering", "Gaussian"));
        assertTrue(catalog.lookup(Category.BITWISE, "AND").isDualInput());
        assertFalse(catalog.lookup(Category.BITWISE, "NOT").isDualInput());
        assertEquals(Set.of(1), catalog.lookup(Category.EDGE, "Canny").getApplicableChannelCounts());
    }

    @Test
    public void testUnknownOperation() {
        UnknownOperationException e = assertThrows(UnknownOperationException.class,
                () -> catalog.lookup("Filter", "NonexistentOp"));
        assertTrue(e.getMessage().contains("NonexistentOp"));
        assertThrows(UnknownOperationException.class, () -> catalog.lookup("Sculpting", "Gaussian"));
        assertThrows(UnknownOperationException.class, () -> catalog.lookup(Category.EDGE, "Gaussian"));
    }

    @Test
    public void testDuplicateRegistration() {
        OperationCatalog local = new OperationCatalog();
        local.register(spec(Category.FILTER, "Box", 10), IDENTITY);
        assertThrows(DuplicateOperationException.class,
                () -> local.register(spec(Category.FILTER, "Box", 20), IDENTITY));
        // Same name in another category is a different operation
        local.register(spec(Category.MORPHOLOGY, "Box", 10), IDENTITY);
        assertEquals(2, local.size());
    }

    @Test
    public void testListingIsInDeclarationOrder() {
        OperationCatalog local = new OperationCatalog();
        local.register(spec(Category.FILTER, "Late", 30), IDENTITY);
        local.register(spec(Category.FILTER, "First", 10), IDENTITY);
        local.register(spec(Category.FILTER, "SecondA", 20), IDENTITY);
        local.register(spec(Category.FILTER, "SecondB", 20), IDENTITY);

        List<String> listed = local.listByCategory(Category.FILTER).stream()
                .map(OperationSpec::getName).collect(Collectors.toList());
        assertEquals(List.of("First", "SecondA", "SecondB", "Late"), listed);
        assertTrue(local.listByCategory(Category.EDGE).isEmpty());
    }

    @Test
    public void testCategoryNames() {
        assertEquals(Category.EDGE, Category.fromName("Edge Detection"));
        assertEquals(Category.EDGE, Category.fromName("edges"));
        assertEquals(Category.GEOMETRIC, Category.fromName("geometric"));
        assertEquals(Category.COLOR, Category.fromName("Color"));
        assertThrows(UnknownOperationException.class, () -> Category.fromName("xyz"));
        assertThrows(UnknownOperationException.class, () -> Category.fromName(null));
    }
}
