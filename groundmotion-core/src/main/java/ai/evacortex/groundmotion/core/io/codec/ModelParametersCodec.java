/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.io.codec;

import ai.evacortex.groundmotion.core.domain.FrequencyTimeGrid;
import ai.evacortex.groundmotion.core.exceptions.InvalidGridException;
import ai.evacortex.groundmotion.core.exceptions.ParameterFileException;
import ai.evacortex.groundmotion.core.exceptions.ShapeFunctionException;
import ai.evacortex.groundmotion.core.function.ShapeFunction;
import ai.evacortex.groundmotion.core.model.EvolutionaryModel;
import ai.evacortex.groundmotion.core.model.FilterParameters;
import ai.evacortex.groundmotion.core.model.FilterQuantity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the parameter file of an {@link EvolutionaryModel}.
 *
 * <p>Layout:</p>
 * <pre>
 * { "parameters": {
 *     "description": "...", "npts": 512, "dt": 0.01, "t": [...],
 *     "mdl": {"func": "beta_single", "vars": ["p1", "c1", "Et", "tn"], "data": [...]},
 *     "wu": {...}, "zu": {...}, "wl": {...}, "zl": {...} } }
 * </pre>
 *
 * <p>Loading rebuilds the grid from {@code npts} and {@code dt} and re-evaluates each named shape
 * function on it. Any missing or malformed entry fails the whole load.</p>
 */
public final class ModelParametersCodec {

    private static final Logger log = LoggerFactory.getLogger(ModelParametersCodec.class);

    public static final String ROOT = "parameters";
    public static final String DEFAULT_DESCRIPTION = "Stochastic ground-motion model parameters";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ModelParametersCodec() {}

    public static void save(EvolutionaryModel model, Path path) {
        save(model, path, DEFAULT_DESCRIPTION);
    }

    /**
     * Writes every quantity of {@code model} to {@code path}, replacing an existing file.
     *
     * @throws ParameterFileException if a quantity is unassigned or the file cannot be written
     */
    public static void save(EvolutionaryModel model, Path path, String description) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(path, "path must not be null");
        ObjectNode root = toTree(model, description == null ? DEFAULT_DESCRIPTION : description);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, root);
            }
        } catch (IOException e) {
            throw new ParameterFileException("failed to write " + path, e);
        }
        log.info("Saved model parameters to {}", path);
    }

    /**
     * Rebuilds a model from {@code path}.
     *
     * @throws ParameterFileException on I/O failure or any missing, unknown or invalid entry
     */
    public static EvolutionaryModel load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        JsonNode document;
        try (InputStream in = Files.newInputStream(path)) {
            document = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ParameterFileException("failed to read " + path, e);
        }
        EvolutionaryModel model = fromTree(document);
        log.info("Loaded model parameters from {} (npts={}, dt={})", path, model.grid().npts(), model.grid().dt());
        return model;
    }

    static ObjectNode toTree(EvolutionaryModel model, String description) {
        Map<FilterQuantity, FilterParameters> assigned = new EnumMap<>(FilterQuantity.class);
        for (FilterQuantity q : FilterQuantity.values()) {
            FilterParameters p = model.parameters(q);
            if (p == null) {
                throw new ParameterFileException("quantity '" + q.key() + "' has no assigned parameters");
            }
            assigned.put(q, p);
        }

        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode params = root.putObject(ROOT);
        params.put("description", description);
        params.put("npts", model.grid().npts());
        params.put("dt", model.grid().dt());
        ArrayNode t = params.putArray("t");
        for (double v : model.grid().t()) t.add(v);

        assigned.forEach((q, p) -> {
            ObjectNode group = params.putObject(q.key());
            group.put("func", p.function().functionName());
            ArrayNode vars = group.putArray("vars");
            p.names().forEach(vars::add);
            ArrayNode data = group.putArray("data");
            for (double v : p.params()) data.add(v);
        });
        return root;
    }

    static EvolutionaryModel fromTree(JsonNode document) {
        JsonNode params = required(document, ROOT, "");
        if (!params.isObject()) throw new ParameterFileException("'" + ROOT + "' must be an object");

        JsonNode nptsNode = required(params, "npts", ROOT);
        if (!nptsNode.canConvertToInt() || !nptsNode.isIntegralNumber()) {
            throw new ParameterFileException("'npts' must be an integer");
        }
        JsonNode dtNode = required(params, "dt", ROOT);
        if (!dtNode.isNumber()) throw new ParameterFileException("'dt' must be a number");
        required(params, "description", ROOT);
        double[] t = numbers(required(params, "t", ROOT), "t");

        Map<FilterQuantity, ShapeFunction> functions = new EnumMap<>(FilterQuantity.class);
        Map<FilterQuantity, double[]> data = new EnumMap<>(FilterQuantity.class);
        for (FilterQuantity q : FilterQuantity.values()) {
            JsonNode group = required(params, q.key(), ROOT);
            JsonNode func = required(group, "func", q.key());
            if (!func.isTextual()) throw new ParameterFileException("'" + q.key() + ".func' must be a string");
            required(group, "vars", q.key());
            try {
                functions.put(q, ShapeFunction.fromName(func.asText()));
            } catch (ShapeFunctionException e) {
                throw new ParameterFileException("unknown function for '" + q.key() + "'", e);
            }
            data.put(q, numbers(required(group, "data", q.key()), q.key() + ".data"));
        }

        try {
            FrequencyTimeGrid grid = new FrequencyTimeGrid(nptsNode.intValue(), dtNode.doubleValue());
            if (t.length != grid.npts()) {
                throw new ParameterFileException("'t' has " + t.length + " samples, expected " + grid.npts());
            }
            EvolutionaryModel model = new EvolutionaryModel(grid,
                    functions.get(FilterQuantity.MDL), functions.get(FilterQuantity.WU),
                    functions.get(FilterQuantity.ZU), functions.get(FilterQuantity.WL),
                    functions.get(FilterQuantity.ZL));
            for (FilterQuantity q : FilterQuantity.values()) {
                model.set(q, data.get(q));
            }
            return model;
        } catch (InvalidGridException | ShapeFunctionException e) {
            throw new ParameterFileException("invalid model definition: " + e.getMessage(), e);
        }
    }

    private static JsonNode required(JsonNode parent, String field, String where) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            String location = where.isEmpty() ? field : where + "." + field;
            throw new ParameterFileException("missing '" + location + "'");
        }
        return node;
    }

    private static double[] numbers(JsonNode node, String name) {
        if (!node.isArray()) throw new ParameterFileException("'" + name + "' must be an array");
        double[] out = new double[node.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode v = node.get(i);
            if (!v.isNumber()) {
                throw new ParameterFileException("'" + name + "[" + i + "]' is not a number");
            }
            out[i] = v.doubleValue();
        }
        return out;
    }
}
