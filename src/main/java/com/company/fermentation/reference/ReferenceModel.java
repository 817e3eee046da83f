package com.company.fermentation.reference;

import com.company.fermentation.analysis.IsolationForestModel;
import com.company.fermentation.analysis.NoveltyDetector;
import com.company.fermentation.domain.ParameterStatistics;
import com.company.fermentation.domain.Series;
import com.company.fermentation.domain.enums.Parameter;
import com.company.fermentation.exception.ReferenceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The reference ("golden") trajectory together with what is derived from it: per-parameter
 * statistics and the novelty detector trained on it. Installed once at startup and read
 * concurrently afterwards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceModel {

    private final NoveltyDetector noveltyDetector;

    private volatile Snapshot snapshot;

    public void install(Series series) {
        IsolationForestModel detector = noveltyDetector.fit(series.vectors());

        Map<Parameter, ParameterStatistics> statistics = new EnumMap<>(Parameter.class);
        for (Parameter parameter : Parameter.values()) {
            SummaryStatistics summary = new SummaryStatistics();
            for (double value : series.values(parameter)) {
                summary.addValue(value);
            }
            statistics.put(parameter, ParameterStatistics.builder()
                    .mean(summary.getMean())
                    .std(summary.getStandardDeviation())
                    .min(summary.getMin())
                    .max(summary.getMax())
                    .build());
        }

        this.snapshot = new Snapshot(series, Collections.unmodifiableMap(statistics), detector);
        log.info("Reference installed: {} samples, detector threshold {}", series.size(), detector.getThreshold());
    }

    public boolean isAvailable() {
        return snapshot != null;
    }

    public Optional<Series> getSeries() {
        Snapshot current = snapshot;
        return current == null ? Optional.empty() : Optional.of(current.series);
    }

    public Series requireSeries() {
        return require().series;
    }

    public IsolationForestModel requireDetector() {
        return require().detector;
    }

    /**
     * The installed series and the detector trained on it, read together.
     */
    public Snapshot requireSnapshot() {
        return require();
    }

    public Map<Parameter, ParameterStatistics> getStatistics() {
        Snapshot current = snapshot;
        return current == null ? Map.of() : current.statistics;
    }

    private Snapshot require() {
        Snapshot current = snapshot;
        if (current == null) {
            throw new ReferenceUnavailableException("Reference trajectory is not loaded");
        }
        return current;
    }

    public static final class Snapshot {
        private final Series series;
        private final Map<Parameter, ParameterStatistics> statistics;
        private final IsolationForestModel detector;

        private Snapshot(Series series, Map<Parameter, ParameterStatistics> statistics,
                         IsolationForestModel detector) {
            this.series = series;
            this.statistics = statistics;
            this.detector = detector;
        }

        public Series getSeries() {
            return series;
        }

        public IsolationForestModel getDetector() {
            return detector;
        }
    }
}
