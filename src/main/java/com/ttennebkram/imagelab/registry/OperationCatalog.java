package com.ttennebkram.imagelab.registry;

import com.ttennebkram.imagelab.errors.DuplicateOperationException;
import com.ttennebkram.imagelab.errors.UnknownOperationException;
import com.ttennebkram.imagelab.model.PixelFormat;
import com.ttennebkram.imagelab.processors.DualInputOperation;
import com.ttennebkram.imagelab.processors.ImageOperation;
import com.ttennebkram.imagelab.processors.OperationInfo;
import com.ttennebkram.imagelab.processors.OperationScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of operations, grouped by category.
 *
 * Usage:
 *   OperationCatalog catalog = OperationCatalog.createDefault();
 *   OperationSpec gaussian = catalog.lookup(Category.FILTER, "Gaussian");
 *   ImageOperation op = catalog.operationFor(gaussian);
 *
 * Each spec resolves to exactly one operation. Menus list operations in declaration
 * order: the {@code order} of the annotation, then registration order.
 */
public class OperationCatalog {

    private static final Logger logger = LoggerFactory.getLogger(OperationCatalog.class);

    private static final Comparator<OperationSpec> DECLARATION_ORDER = Comparator.comparingInt(OperationSpec::getOrder);

    private final Map<String, ImageOperation> operations = new HashMap<>();
    private final Map<Category, List<OperationSpec>> byCategory = new EnumMap<>(Category.class);

    /**
     * Create a catalog holding every annotated operation found on the classpath.
     */
    public static OperationCatalog createDefault() {
        List<ImageOperation> found = new ArrayList<>();
        for (Class<? extends ImageOperation> operationClass : OperationScanner.findOperationClasses()) {
            try {
                found.add(operationClass.getDeclaredConstructor().newInstance());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to create operation " + operationClass.getName(), e);
            }
        }
        List<OperationSpec> specs = new ArrayList<>();
        Map<OperationSpec, ImageOperation> lookup = new HashMap<>();
        for (ImageOperation op : found) {
            OperationSpec spec = specFor(op);
            specs.add(spec);
            lookup.put(spec, op);
        }
        // Directory listing order is not stable, so sort before registering
        specs.sort(Comparator.comparing(OperationSpec::getCategory)
                .thenComparingInt(OperationSpec::getOrder)
                .thenComparing(OperationSpec::getName));

        OperationCatalog catalog = new OperationCatalog();
        for (OperationSpec spec : specs) {
            catalog.register(spec, lookup.get(spec));
        }
        logger.info("Operation catalog ready with {} operations", catalog.size());
        return catalog;
    }

    /**
     * Build the spec of an operation from its {@link OperationInfo} annotation.
     */
    public static OperationSpec specFor(ImageOperation operation) {
        OperationInfo info = operation.getClass().getAnnotation(OperationInfo.class);
        if (info == null) {
            throw new IllegalArgumentException(operation.getClass().getName() + " has no @OperationInfo");
        }
        Set<PixelFormat> formats = info.inputFormats().length == 0
                ? EnumSet.noneOf(PixelFormat.class)
                : EnumSet.copyOf(Arrays.asList(info.inputFormats()));
        boolean dual = info.dualInput() || operation instanceof DualInputOperation;
        return new OperationSpec(info.category(), info.name(), info.displayName(), info.description(),
                operation.getParameters(), formats, dual, info.order());
    }

    /**
     * Register an annotated operation.
     *
     * @throws DuplicateOperationException if its (category, name) is taken
     */
    public OperationSpec register(ImageOperation operation) {
        OperationSpec spec = specFor(operation);
        register(spec, operation);
        return spec;
    }

    /**
     * Register an operation under an explicit spec.
     *
     * @throws DuplicateOperationException if (category, name) is taken
     */
    public void register(OperationSpec spec, ImageOperation operation) {
        if (spec == null || operation == null) {
            throw new IllegalArgumentException("Spec and operation are required");
        }
        if (operations.containsKey(spec.getKey())) {
            throw new DuplicateOperationException(spec.getCategory().name(), spec.getName());
        }
        operations.put(spec.getKey(), operation);
        List<OperationSpec> list = byCategory.computeIfAbsent(spec.getCategory(), c -> new ArrayList<>());
        list.add(spec);
        list.sort(DECLARATION_ORDER);
        logger.debug("Registered {}", spec);
    }

    /**
     * Find an operation by category and name (or display name), ignoring case.
     *
     * @throws UnknownOperationException if absent
     */
    public OperationSpec lookup(Category category, String name) {
        List<OperationSpec> list = byCategory.get(category);
        if (list != null && name != null) {
            for (OperationSpec spec : list) {
                if (spec.getName().equals(name)) {
                    return spec;
                }
            }
            for (OperationSpec spec : list) {
                if (spec.getName().equalsIgnoreCase(name) || spec.getDisplayName().equalsIgnoreCase(name)) {
                    return spec;
                }
            }
        }
        throw new UnknownOperationException(category == null ? "null" : category.getDisplayName(), name);
    }

    /**
     * Find an operation by category name and operation name.
     *
     * @throws UnknownOperationException if the category or the operation is unknown
     */
    public OperationSpec lookup(String category, String name) {
        return lookup(Category.fromName(category), name);
    }

    /**
     * Operations of a category in declaration order. Empty if the category has none.
     */
    public List<OperationSpec> listByCategory(Category category) {
        List<OperationSpec> list = byCategory.get(category);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * Categories that have at least one operation, in menu order.
     */
    public List<Category> categories() {
        return new ArrayList<>(byCategory.keySet());
    }

    /**
     * The operation registered for a spec.
     *
     * @throws UnknownOperationException if the spec is not from this catalog
     */
    public ImageOperation operationFor(OperationSpec spec) {
        ImageOperation operation = operations.get(spec.getKey());
        if (operation == null) {
            throw new UnknownOperationException(spec.getCategory().getDisplayName(), spec.getName());
        }
        return operation;
    }

    public int size() {
        return operations.size();
    }
}
