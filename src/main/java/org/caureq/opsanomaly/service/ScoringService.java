package org.caureq.opsanomaly.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.config.AppProps;
import org.caureq.opsanomaly.domain.DateRange;
import org.caureq.opsanomaly.domain.Sample;
import org.caureq.opsanomaly.ml.DataQualityException;
import org.caureq.opsanomaly.ml.FeaturePreprocessor;
import org.caureq.opsanomaly.ml.IsolationForest;
import org.caureq.opsanomaly.ml.ModelBundle;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/** Fails open: anything that prevents scoring labels the samples normal or returns no data. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringService {
    private final SampleStore store;
    private final AppProps props;

    /** {@code score} is null when the sample was not scored. */
    public record ScoredSample(LocalDateTime timestamp, Double cpuPercent, Double memoryPercent, Double diskPercent,
                               Double score, int anomaly) {
        public boolean anomalous() { return anomaly == IsolationForest.ANOMALY; }
    }

    public record ScoringSummary(LocalDateTime first, LocalDateTime last, int totalPoints, int anomalyPoints,
                                 double anomalyPercent) {}

    /** An unreadable store gives no data rather than an error. */
    public List<ScoredSample> scoreBatch(Optional<DateRange> range, Optional<ModelBundle> bundle) {
        List<Sample> samples;
        try {
            samples = store.query(range);
        } catch (StoreUnavailableException e) {
            log.warn("cannot load samples for scoring, returning no data: {}", e.getMessage());
            return List.of();
        }
        return score(samples, bundle);
    }

    public List<ScoredSample> score(List<Sample> samples, Optional<ModelBundle> bundle) {
        if (samples.isEmpty()) return List.of();
        if (bundle.isEmpty()) {
            log.warn("no model bundle loaded, {} samples labelled normal", samples.size());
            return unscored(samples);
        }
        var b = bundle.get();
        double[][] matrix;
        try {
            matrix = FeaturePreprocessor.transform(samples, b.scaler(), props.model().imputation());
        } catch (DataQualityException e) {
            log.warn("batch of {} samples is not scoreable ({}), labelled normal", samples.size(), e.getMessage());
            return unscored(samples);
        }
        var forest = b.detector();
        double[] scores = forest.score(matrix);
        return IntStream.range(0, samples.size())
                .mapToObj(i -> scored(samples.get(i), scores[i], forest.label(scores[i])))
                .toList();
    }

    public ScoringSummary summarize(List<ScoredSample> points) {
        if (points.isEmpty()) return new ScoringSummary(null, null, 0, 0, 0.0);
        int anomalies = (int) points.stream().filter(ScoredSample::anomalous).count();
        var first = points.stream().map(ScoredSample::timestamp).min(LocalDateTime::compareTo).orElse(null);
        var last = points.stream().map(ScoredSample::timestamp).max(LocalDateTime::compareTo).orElse(null);
        return new ScoringSummary(first, last, points.size(), anomalies, anomalies * 100.0 / points.size());
    }

    private static List<ScoredSample> unscored(List<Sample> samples) {
        return samples.stream().map(s -> scored(s, null, IsolationForest.NORMAL)).toList();
    }

    private static ScoredSample scored(Sample s, Double score, int label) {
        return new ScoredSample(s.getTimestamp(), s.getCpuPercent(), s.getMemoryPercent(), s.getDiskPercent(), score, label);
    }
}
