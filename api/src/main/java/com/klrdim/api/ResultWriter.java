package com.klrdim.api;

import com.klrdim.common.LaurentPolynomial;
import com.klrdim.common.Permutation;
import com.klrdim.formula.core.DimensionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

/**
 * Appends result tables to a CSV file.
 *
 * Every row starts with a "Section" column so several logical tables share
 * one file, and the header is written once per file.
 */
public class ResultWriter {
    private static final Logger logger = LoggerFactory.getLogger(ResultWriter.class);

    public static final String[] DIMENSION_COLUMNS = {"Value", "Witnesses"};

    private final Path outputPath;

    /** True once the header has been written (or found in an existing file). */
    private boolean wroteHeader;

    /** Header of the first table written, to detect schema drift. */
    private String[] lastHeader;

    public ResultWriter(Path outputPath) {
        Objects.requireNonNull(outputPath, "Output path cannot be null");
        this.outputPath = outputPath.toAbsolutePath().normalize();

        boolean exists;
        try {
            exists = Files.exists(this.outputPath) && Files.size(this.outputPath) > 0;
        } catch (IOException e) {
            logger.debug("Could not inspect {}: {}", this.outputPath, e.toString());
            exists = false;
        }
        this.wroteHeader = exists;
    }

    /**
     * Write one logical table.
     *
     * @param title   section name; the "Section" column
     * @param columns column headers, without "Section"
     * @param rows    data rows, padded or truncated to the column count
     */
    public void writeTable(String title, String[] columns, List<String[]> rows) throws IOException {
        Objects.requireNonNull(title, "Title cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        Objects.requireNonNull(rows, "Rows cannot be null");

        Path parent = outputPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try (BufferedWriter writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8, CREATE, APPEND)) {
            if (!wroteHeader) {
                lastHeader = columns.clone();
                writer.write("Section," + String.join(",", escape(columns)) + "\n");
                wroteHeader = true;
            } else if (lastHeader != null && !columnsCompatible(lastHeader, columns)) {
                logger.warn("ResultWriter: header schema changed between writes. "
                                + "Existing header: {}, new header: {}",
                        String.join("|", lastHeader),
                        String.join("|", columns));
            }

            for (String[] row : rows) {
                String[] normalized = normalizeRow(row, columns.length);
                writer.write(escape(title));
                writer.write(",");
                writer.write(String.join(",", escape(normalized)));
                writer.write("\n");
            }

            logger.info("Results written to {}", outputPath);
        } catch (IOException e) {
            logger.error("Failed to write results to {}", outputPath, e);
            throw new IOException("Failed to write results to " + outputPath, e);
        }
    }

    /**
     * One "group" row per grouping entry (value, witnesses in cycle notation)
     * and one "total" row (total, number of witnesses enumerated).
     */
    public void writeDimension(DimensionResult result) throws IOException {
        Objects.requireNonNull(result, "result");
        List<String[]> groups = new ArrayList<>();
        for (Map.Entry<LaurentPolynomial, List<Permutation>> e : result.getGrouping().entrySet()) {
            groups.add(new String[]{
                    e.getKey().toString(),
                    e.getValue().stream().map(Permutation::toCycleString).collect(Collectors.joining(" "))
            });
        }
        if (!groups.isEmpty()) writeTable("group", DIMENSION_COLUMNS, groups);

        List<String[]> total = new ArrayList<>();
        total.add(new String[]{result.getTotal().toString(), Integer.toString(result.getWitnessCount())});
        writeTable("total", DIMENSION_COLUMNS, total);
    }

    /* -------------------- helpers -------------------- */

    private static String[] escape(String[] cells) {
        String[] out = new String[cells.length];
        for (int i = 0; i < cells.length; i++) {
            out[i] = escape(cells[i]);
        }
        return out;
    }

    private static String escape(String s) {
        if (s == null) return "";
        boolean needs = s.indexOf(',') >= 0
                || s.indexOf('"') >= 0
                || s.indexOf('\n') >= 0
                || s.indexOf('\r') >= 0;
        return needs ? "\"" + s.replace("\"", "\"\"") + "\"" : s;
    }

    private static String[] normalizeRow(String[] row, int expectedLen) {
        String[] out = new String[expectedLen];
        int copyLen = row == null ? 0 : Math.min(row.length, expectedLen);
        if (copyLen > 0) System.arraycopy(row, 0, out, 0, copyLen);
        for (int i = copyLen; i < expectedLen; i++) out[i] = "";
        return out;
    }

    private static boolean columnsCompatible(String[] previous, String[] current) {
        if (previous.length != current.length) return false;
        for (int i = 0; i < previous.length; i++) {
            if (!Objects.equals(previous[i], current[i])) return false;
        }
        return true;
    }
}
