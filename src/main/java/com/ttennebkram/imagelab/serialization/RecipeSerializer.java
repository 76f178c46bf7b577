package com.ttennebkram.imagelab.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.ttennebkram.imagelab.processing.AppliedOperation;
import com.ttennebkram.imagelab.processing.ChainMode;
import com.ttennebkram.imagelab.registry.OperationCatalog;
import com.ttennebkram.imagelab.registry.OperationParams;
import com.ttennebkram.imagelab.registry.OperationSpec;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saves and loads processing recipes (the applied chain of operations) as JSON.
 *
 * <pre>
 * {
 *   "version": 1,
 *   "chainMode": "APPLY_TO_PROCESSED",
 *   "steps": [
 *     {"category": "FILTER", "operation": "Gaussian", "params": {"kernelSize": 5, "sigma": 0.0}}
 *   ]
 * }
 * </pre>
 */
public class RecipeSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    private static final int VERSION = 1;

    /**
     * A loaded recipe.
     */
    public static class Recipe {
        public final List<AppliedOperation> steps;
        public final ChainMode chainMode;

        public Recipe(List<AppliedOperation> steps, ChainMode chainMode) {
            this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
            this.chainMode = chainMode;
        }
    }

    public static String toJson(List<AppliedOperation> steps, ChainMode chainMode) {
        JsonObject root = new JsonObject();
        root.addProperty("version", VERSION);
        root.addProperty("chainMode", chainMode.name());

        JsonArray stepsArray = new JsonArray();
        for (AppliedOperation step : steps) {
            JsonObject stepJson = new JsonObject();
            stepJson.addProperty("category", step.getSpec().getCategory().name());
            stepJson.addProperty("operation", step.getSpec().getName());

            JsonObject params = new JsonObject();
            for (Map.Entry<String, Object> entry : step.getParams().asMap().entrySet()) {
                Object value = entry.getValue();
                if (value instanceof Number) {
                    params.addProperty(entry.getKey(), (Number) value);
                } else {
                    params.addProperty(entry.getKey(), String.valueOf(value));
                }
            }
            stepJson.add("params", params);
            stepsArray.add(stepJson);
        }
        root.add("steps", stepsArray);
        return GSON.toJson(root);
    }

    public static void save(Path path, List<AppliedOperation> steps, ChainMode chainMode) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(toJson(steps, chainMode));
        }
    }

    /**
     * Parse a recipe, resolving each step through the catalog and re-validating its parameters.
     *
     * @throws IOException if the document is not a recipe
     * @throws com.ttennebkram.imagelab.errors.UnknownOperationException for operations the catalog lacks
     * @throws com.ttennebkram.imagelab.errors.InvalidParameterException for unusable parameters
     */
    public static Recipe fromJson(String json, OperationCatalog catalog) throws IOException {
        return read(new StringReader(json), catalog);
    }

    public static Recipe load(Path path, OperationCatalog catalog) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, catalog);
        }
    }

    private static Recipe read(Reader reader, OperationCatalog catalog) throws IOException {
        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new IOException("Invalid recipe: not a JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid recipe: " + e.getMessage(), e);
        }
        if (!root.has("steps") || !root.get("steps").isJsonArray()) {
            throw new IOException("Invalid recipe: missing 'steps' array");
        }

        ChainMode chainMode = ChainMode.APPLY_TO_PROCESSED;
        if (root.has("chainMode")) {
            try {
                chainMode = ChainMode.valueOf(stringField(root, "chainMode"));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid recipe: unknown chain mode " + root.get("chainMode"), e);
            }
        }

        List<AppliedOperation> steps = new ArrayList<>();
        for (JsonElement element : root.getAsJsonArray("steps")) {
            if (!element.isJsonObject()) {
                throw new IOException("Invalid recipe: step is not an object");
            }
            JsonObject stepJson = element.getAsJsonObject();
            if (!stepJson.has("category") || !stepJson.has("operation")) {
                throw new IOException("Invalid recipe: step missing 'category' or 'operation'");
            }
            OperationSpec spec = catalog.lookup(stringField(stepJson, "category"), stringField(stepJson, "operation"));

            Map<String, Object> raw = new LinkedHashMap<>();
            if (stepJson.has("params") && stepJson.get("params").isJsonObject()) {
                for (Map.Entry<String, JsonElement> entry : stepJson.getAsJsonObject("params").entrySet()) {
                    raw.put(entry.getKey(), toValue(entry.getValue()));
                }
            }
            steps.add(new AppliedOperation(spec, OperationParams.resolve(spec, raw)));
        }
        return new Recipe(steps, chainMode);
    }

    private static String stringField(JsonObject object, String name) throws IOException {
        JsonElement value = object.get(name);
        if (value == null || !value.isJsonPrimitive()) {
            throw new IOException("Invalid recipe: '" + name + "' must be a string, got " + value);
        }
        return value.getAsString();
    }

    private static Object toValue(JsonElement element) throws IOException {
        if (!element.isJsonPrimitive()) {
            throw new IOException("Invalid recipe: parameter value " + element + " is not a scalar");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return primitive.getAsDouble();
        }
        return primitive.getAsString();
    }
}
