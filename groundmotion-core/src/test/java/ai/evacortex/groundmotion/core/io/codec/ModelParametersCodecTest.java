/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.io.codec;

import ai.evacortex.groundmotion.core.GroundMotionTestUtils;
import ai.evacortex.groundmotion.core.domain.FrequencyTimeGrid;
import ai.evacortex.groundmotion.core.exceptions.ParameterFileException;
import ai.evacortex.groundmotion.core.exceptions.ShapeFunctionException;
import ai.evacortex.groundmotion.core.function.ShapeFunction;
import ai.evacortex.groundmotion.core.model.EvolutionaryModel;
import ai.evacortex.groundmotion.core.model.FilterQuantity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ModelParametersCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void roundTripReproducesAllSeries(@TempDir Path dir) {
        EvolutionaryModel model = GroundMotionTestUtils.typicalModel();
        Path file = dir.resolve("nested").resolve("params.json");

        ModelParametersCodec.save(model, file, "unit test model");
        EvolutionaryModel loaded = ModelParametersCodec.load(file);

        assertEquals(model.grid().npts(), loaded.grid().npts());
        assertEquals(model.grid().dt(), loaded.grid().dt());
        for (FilterQuantity q : FilterQuantity.values()) {
            assertSame(model.function(q), loaded.function(q));
            assertArrayEquals(model.parameters(q).params(), loaded.parameters(q).params());
            assertArrayEquals(model.get(q), loaded.get(q), 1e-12);
        }
    }

    @Test
    void documentLayout(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("params.json");
        ModelParametersCodec.save(GroundMotionTestUtils.typicalModel(), file);

        JsonNode params = MAPPER.readTree(file.toFile()).get("parameters");
        assertEquals(ModelParametersCodec.DEFAULT_DESCRIPTION, params.get("description").asText());
        assertEquals(GroundMotionTestUtils.NPTS, params.get("npts").asInt());
        assertEquals(GroundMotionTestUtils.NPTS, params.get("t").size());
        assertEquals("beta_single", params.get("mdl").get("func").asText());
        assertEquals("p1", params.get("mdl").get("vars").get(0).asText());
        assertEquals(4, params.get("mdl").get("data").size());
        assertEquals("linear", params.get("zl").get("func").asText());
    }

    @Test
    void unassignedQuantityCannotBeSaved(@TempDir Path dir) {
        EvolutionaryModel model = new EvolutionaryModel(new FrequencyTimeGrid(64, 0.01));
        model.setMdl(0.3, 5.0, 1.0, 0.63);
        Path file = dir.resolve("params.json");
        assertThrows(ParameterFileException.class, () -> ModelParametersCodec.save(model, file));
        assertFalse(Files.exists(file));
    }

    @Test
    void missingFieldFailsTheWholeLoad(@TempDir Path dir) throws IOException {
        for (String field : new String[]{"npts", "dt", "t", "description", "wl"}) {
            ObjectNode root = ModelParametersCodec.toTree(GroundMotionTestUtils.typicalModel(), "x");
            ((ObjectNode) root.get("parameters")).remove(field);
            Path file = dir.resolve(field + ".json");
            MAPPER.writeValue(file.toFile(), root);
            assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(file), field);
        }
    }

    @Test
    void missingAttributeIsRejected(@TempDir Path dir) throws IOException {
        ObjectNode root = ModelParametersCodec.toTree(GroundMotionTestUtils.typicalModel(), "x");
        ((ObjectNode) root.get("parameters").get("zu")).remove("data");
        Path file = dir.resolve("params.json");
        MAPPER.writeValue(file.toFile(), root);
        assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(file));
    }

    @Test
    void unknownFunctionIsRejected(@TempDir Path dir) throws IOException {
        ObjectNode root = ModelParametersCodec.toTree(GroundMotionTestUtils.typicalModel(), "x");
        ((ObjectNode) root.get("parameters").get("wu")).put("func", "sigmoid");
        Path file = dir.resolve("params.json");
        MAPPER.writeValue(file.toFile(), root);
        ParameterFileException e = assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(file));
        assertInstanceOf(ShapeFunctionException.class, e.getCause());
    }

    @Test
    void invalidValuesAreRejected(@TempDir Path dir) throws IOException {
        ObjectNode root = ModelParametersCodec.toTree(GroundMotionTestUtils.typicalModel(), "x");
        ObjectNode params = (ObjectNode) root.get("parameters");
        params.put("dt", -0.01);
        Path negativeDt = dir.resolve("dt.json");
        MAPPER.writeValue(negativeDt.toFile(), root);
        assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(negativeDt));

        root = ModelParametersCodec.toTree(GroundMotionTestUtils.typicalModel(), "x");
        ((ObjectNode) root.get("parameters")).put("npts", "many");
        Path textNpts = dir.resolve("npts.json");
        MAPPER.writeValue(textNpts.toFile(), root);
        assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(textNpts));

        root = ModelParametersCodec.toTree(GroundMotionTestUtils.typicalModel(), "x");
        ((ObjectNode) root.get("parameters").get("mdl")).putArray("data").add(0.3).add(5.0);
        Path shortData = dir.resolve("data.json");
        MAPPER.writeValue(shortData.toFile(), root);
        assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(shortData));
    }

    @Test
    void unreadableFilesAreWrapped(@TempDir Path dir) throws IOException {
        Path missing = dir.resolve("absent.json");
        ParameterFileException e = assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(missing));
        assertInstanceOf(IOException.class, e.getCause());

        Path garbage = dir.resolve("garbage.json");
        Files.writeString(garbage, "{ not json");
        assertThrows(ParameterFileException.class, () -> ModelParametersCodec.load(garbage));
    }

    @Test
    void customFunctionsSurvive(@TempDir Path dir) {
        FrequencyTimeGrid grid = new FrequencyTimeGrid(300, 0.02);
        EvolutionaryModel model = new EvolutionaryModel(grid, ShapeFunction.HOUSNER, ShapeFunction.EXPONENTIAL,
                ShapeFunction.CONSTANT, ShapeFunction.BILINEAR, ShapeFunction.CONSTANT);
        model.setMdl(1.0, 0.5, 1.0, 1.0, 3.0);
        model.setWu(8.0, 2.0);
        model.setZu(0.4);
        model.setWl(0.5, 1.0, 0.2, 2.0);
        model.setZl(0.7);
        Path file = dir.resolve("custom.json");

        ModelParametersCodec.save(model, file);
        EvolutionaryModel loaded = ModelParametersCodec.load(file);

        assertSame(ShapeFunction.BILINEAR, loaded.function(FilterQuantity.WL));
        assertArrayEquals(model.wl(), loaded.wl(), 1e-12);
        assertArrayEquals(model.mdl(), loaded.mdl(), 1e-12);
    }
}
