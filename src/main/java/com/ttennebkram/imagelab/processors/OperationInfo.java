package com.ttennebkram.imagelab.processors;

import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.registry.Category;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for ImageOperation classes to declare their catalog metadata.
 * Used for auto-registration at runtime - no compile-time registration needed.
 * The OperationCatalog uses this annotation to auto-discover operations.
 *
 * Example usage:
 * <pre>
 * {@literal @}OperationInfo(
 *     name = "Gaussian",
 *     displayName = "Gaussian Blur",
 *     category = Category.FILTER,
 *     order = 20,
 *     description = "Gaussian blur\nImgproc.GaussianBlur(src, dst, ksize, sigmaX)"
 * )
 * public class GaussianBlurOperation extends OperationBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface OperationInfo {

    /**
     * Operation name, unique within its category (e.g., "Gaussian", "Canny").
     * Also the name used in saved recipes.
     */
    String name();

    /**
     * Display name shown in menus. If empty, defaults to name.
     */
    String displayName() default "";

    /**
     * Category for grouping in menus.
     */
    Category category();

    /**
     * Position within the category menu; lower comes first.
     */
    int order() default 100;

    /**
     * Description/method signature shown in tooltips.
     */
    String description() default "";

    /**
     * Input formats the operation works on directly. Empty means any format.
     * Other inputs are coerced to RGB8 or GRAY8 by the dispatcher when possible.
     */
    PixelFormat[] inputFormats() default {};

    /**
     * Whether this operation combines the image with a second operand.
     * Dual-input operations extend DualInputOperation.
     */
    boolean dualInput() default false;
}
