/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.io.csv;

import ai.evacortex.groundmotion.core.MotionEnsemble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes simulation columns as comma-separated text: the independent variable first, then one
 * column per dependent variable and realization, named {@code <dependent>_<index>} with a 1-based
 * index. The header row carries no comment prefix.
 */
public final class SimulationCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(SimulationCsvWriter.class);

    private SimulationCsvWriter() {}

    /** Writes {@code t} followed by the ac, vel and disp realizations of {@code ensemble}. */
    public static void write(Path path, MotionEnsemble ensemble) {
        Objects.requireNonNull(ensemble, "ensemble must not be null");
        Map<String, double[][]> columns = new LinkedHashMap<>();
        columns.put("ac", ensemble.ac());
        columns.put("vel", ensemble.vel());
        columns.put("disp", ensemble.disp());
        write(path, "t", ensemble.t(), columns);
    }

    /**
     * @param dependents realizations per dependent variable, in column order; every row must match
     *                   the length of {@code x}
     */
    public static void write(Path path, String xName, double[] x, Map<String, double[][]> dependents) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(xName, "xName must not be null");
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(dependents, "dependents must not be null");
        dependents.forEach((name, rows) -> {
            for (int r = 0; r < rows.length; r++) {
                if (rows[r].length != x.length) {
                    throw new IllegalArgumentException("Column " + name + "_" + (r + 1) + " has "
                            + rows[r].length + " rows, expected " + x.length);
                }
            }
        });

        StringBuilder header = new StringBuilder(xName);
        dependents.forEach((name, rows) -> {
            for (int r = 0; r < rows.length; r++) {
                header.append(',').append(name).append('_').append(r + 1);
            }
        });

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                out.write(header.toString());
                out.newLine();
                StringBuilder line = new StringBuilder();
                for (int i = 0; i < x.length; i++) {
                    line.setLength(0);
                    line.append(x[i]);
                    for (double[][] rows : dependents.values()) {
                        for (double[] row : rows) {
                            line.append(',').append(row[i]);
                        }
                    }
                    out.write(line.toString());
                    out.newLine();
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write simulation CSV " + path, e);
        }
        log.info("Wrote {} rows to {}", x.length, path);
    }
}
