package com.klrdim.api;

import com.klrdim.common.Profiler;
import com.klrdim.config.KlrConfig;
import com.klrdim.formula.service.DimensionService;
import com.klrdim.formula.service.DimensionServiceImpl;
import com.klrdim.quiver.QuiverDataProvider;
import com.klrdim.quiver.StandardQuiverProvider;
import com.klrdim.witness.service.WitnessService;
import com.klrdim.witness.service.WitnessServiceImpl;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

/** Wires the services for one {@link KlrConfig}. */
public final class AppBootstrap {

    public static final class Components {
        public final KlrConfig config;
        public final QuiverDataProvider quivers;
        public final WitnessService witnessService;
        public final DimensionService dimensionService;
        /** null when profiling is disabled */
        public final MicrometerProfiler profiler;

        Components(KlrConfig cfg,
                   QuiverDataProvider quivers,
                   WitnessService ws,
                   DimensionService ds,
                   MicrometerProfiler profiler) {
            this.config = cfg;
            this.quivers = quivers;
            this.witnessService = ws;
            this.dimensionService = ds;
            this.profiler = profiler;
        }
    }

    public static Components init(KlrConfig cfg) {
        return init(cfg, new StandardQuiverProvider(), new SimpleMeterRegistry());
    }

    public static Components init(KlrConfig cfg, QuiverDataProvider quivers, MeterRegistry registry) {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(quivers, "quivers");
        Objects.requireNonNull(registry, "registry");

        WitnessService ws = new WitnessServiceImpl(cfg);
        DimensionService ds = new DimensionServiceImpl(quivers, ws, cfg);
        MicrometerProfiler profiler = cfg.isProfilerEnabled()
                ? new MicrometerProfiler(registry, new Profiler())
                : null;

        return new Components(cfg, quivers, ws, ds, profiler);
    }

    private AppBootstrap() {}
}
