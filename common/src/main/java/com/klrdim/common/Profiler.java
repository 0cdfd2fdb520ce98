package com.klrdim.common;

import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Profiler
 *
 * Stores one row per dimension evaluation and exports them as CSV.
 * Phase timers live in MicrometerProfiler; the rows carry the per-call
 * durations it measured.
 */
public final class Profiler {

    private final List<EvaluationRow> evaluationRows = new ArrayList<>();

    /* -----------------------------------------------------
     * PER-EVALUATION API
     * ----------------------------------------------------- */

    public synchronized void recordEvaluationRow(
            String label,
            String cartanType,
            int length,
            int witnesses,
            int nonzeroWitnesses,
            int groups,
            String total,
            double enumerateMs,
            double evaluateMs
    ) {
        evaluationRows.add(new EvaluationRow(
                label,
                cartanType,
                length,
                witnesses,
                nonzeroWitnesses,
                groups,
                total,
                enumerateMs,
                evaluateMs
        ));
    }

    /** Copy of stored rows. */
    synchronized List<EvaluationRow> getEvaluationRows() {
        return new ArrayList<>(evaluationRows);
    }

    public synchronized void exportEvaluationCsv(String fp) throws IOException {
        try (FileWriter fw = new FileWriter(fp)) {
            fw.write("label,type,n,witnesses,nonzero,groups,total,enumerateMs,evaluateMs\n");
            for (EvaluationRow r : evaluationRows) {
                fw.write(String.format(Locale.ROOT,
                        "%s,%s,%d,%d,%d,%d,%s,%.6f,%.6f%n",
                        quote(r.label),
                        r.cartanType,
                        r.length,
                        r.witnesses,
                        r.nonzeroWitnesses,
                        r.groups,
                        quote(r.total),
                        r.enumerateMs,
                        r.evaluateMs));
            }
        }
    }

    private static String quote(String s) {
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0) return s;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    /* -----------------------------------------------------
     * EVALUATION ROW DTO
     * ----------------------------------------------------- */
    public static final class EvaluationRow {
        public final String label;
        public final String cartanType;

        public final int length;
        public final int witnesses;
        public final int nonzeroWitnesses;
        public final int groups;

        public final String total;

        public final double enumerateMs;
        public final double evaluateMs;

        private EvaluationRow(
                String label,
                String cartanType,
                int length,
                int witnesses,
                int nonzeroWitnesses,
                int groups,
                String total,
                double enumerateMs,
                double evaluateMs
        ) {
            this.label = label;
            this.cartanType = cartanType;
            this.length = length;
            this.witnesses = witnesses;
            this.nonzeroWitnesses = nonzeroWitnesses;
            this.groups = groups;
            this.total = total;
            this.enumerateMs = enumerateMs;
            this.evaluateMs = evaluateMs;
        }
    }
}
