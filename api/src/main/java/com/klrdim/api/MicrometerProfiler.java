package com.klrdim.api;

import com.klrdim.common.Profiler;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Times evaluation phases with {@code klrdim.phase.duration} timers tagged by
 * phase, and mirrors each {@link Profiler} evaluation row into the
 * {@code klrdim.witness.count} / {@code klrdim.group.count} summaries.
 */
public final class MicrometerProfiler {

    private static final Logger log =
            LoggerFactory.getLogger(MicrometerProfiler.class);

    public static final String PHASE_ENUMERATE = "enumerate";
    public static final String PHASE_EVALUATE = "evaluate";

    private final Profiler base;
    private final MeterRegistry registry;

    private final Map<String, Timer> timers = new HashMap<>();
    private final Map<String, Long> startTimes = new HashMap<>();

    private final DistributionSummary witnessSummary;
    private final DistributionSummary groupSummary;

    public MicrometerProfiler(MeterRegistry reg, Profiler baseProfiler) {
        this.registry = Objects.requireNonNull(reg, "registry");
        this.base = Objects.requireNonNull(baseProfiler, "baseProfiler");

        this.witnessSummary =
                DistributionSummary.builder("klrdim.witness.count")
                        .description("Witnesses enumerated per evaluation")
                        .register(registry);
        this.groupSummary =
                DistributionSummary.builder("klrdim.group.count")
                        .description("Nonzero contribution groups per evaluation")
                        .register(registry);
    }

    /* --------------------------------------------------------
     * TIMING WRAPPER
     * -------------------------------------------------------- */

    public synchronized void start(String phase) {
        timers.computeIfAbsent(
                phase,
                k -> Timer.builder("klrdim.phase.duration")
                        .tag("phase", k)
                        .register(registry)
        );

        startTimes.put(phase, System.nanoTime());
    }

    /** @return elapsed nanoseconds, or 0 if {@code phase} was not started */
    public synchronized long stop(String phase) {
        Long st = startTimes.remove(phase);
        Timer t = timers.get(phase);
        if (t == null || st == null) return 0L;
        long dt = Math.max(0L, System.nanoTime() - st);
        t.record(dt, TimeUnit.NANOSECONDS);
        return dt;
    }

    /* --------------------------------------------------------
     * EVALUATION ROW WRAPPER
     * -------------------------------------------------------- */

    public synchronized void recordEvaluation(
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
        base.recordEvaluationRow(
                label,
                cartanType,
                length,
                witnesses,
                nonzeroWitnesses,
                groups,
                total,
                enumerateMs,
                evaluateMs
        );

        witnessSummary.record(witnesses);
        groupSummary.record(groups);
    }

    /* --------------------------------------------------------
     * EXPORTS
     * -------------------------------------------------------- */

    public void exportMetersCSV(String path) {
        StringBuilder sb =
                new StringBuilder("name,phase,count,totalMs,meanMs,maxMs\n");

        for (Meter m : registry.getMeters()) {
            if (m instanceof Timer t) {
                long count = t.count();
                double total = t.totalTime(TimeUnit.MILLISECONDS);
                double mean = (count == 0 ? 0.0 : total / count);
                double max = t.max(TimeUnit.MILLISECONDS);

                sb.append(t.getId().getName()).append(',')
                        .append(t.getId().getTag("phase")).append(',')
                        .append(count).append(',')
                        .append(String.format(Locale.ROOT, "%.3f", total)).append(',')
                        .append(String.format(Locale.ROOT, "%.3f", mean)).append(',')
                        .append(String.format(Locale.ROOT, "%.3f", max)).append('\n');
            }
        }

        try {
            Path p = Paths.get(path).toAbsolutePath();
            Files.createDirectories(p.getParent());
            Files.writeString(p, sb.toString());
        } catch (IOException e) {
            log.warn("Failed to export Micrometer CSV to {}: {}", path, e.toString());
        }
    }

    public Profiler getBase() {
        return base;
    }

    MeterRegistry getRegistry() {
        return registry;
    }
}
