package org.caureq.opsanomaly.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.config.AppProps;
import org.caureq.opsanomaly.ml.DetectorOptions;
import org.caureq.opsanomaly.ml.FeaturePreprocessor;
import org.caureq.opsanomaly.ml.IsolationForest;
import org.caureq.opsanomaly.ml.ModelBundle;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingService {
    private final SampleStore store;
    private final ModelArtifactStore artifacts;
    private final ModelRegistry registry;
    private final AppProps props;
    private final Clock clock;

    public record TrainingReport(int rows, int trees, int subSampleSize, double contamination, double threshold,
                                 int anomaliesInTrainingSet, Instant trainedAt, Path artifactPath) {}

    /**
     * @throws StoreUnavailableException                               if there is no sample to train on
     * @throws org.caureq.opsanomaly.ml.DataQualityException         if a metric was never collected
     * @throws org.caureq.opsanomaly.ml.InsufficientDataException    if the matrix is empty
     * @throws ArtifactException                                       if the bundle cannot be written
     */
    public TrainingReport train() {
        log.info("[Train] loading samples");
        var samples = store.queryAll();
        if (samples.isEmpty()) {
            throw new StoreUnavailableException("no samples collected yet, nothing to train on");
        }
        log.info("[Train] {} samples from {} to {}", samples.size(),
                samples.get(0).getTimestamp(), samples.get(samples.size() - 1).getTimestamp());

        var prepared = FeaturePreprocessor.fitTransform(samples);
        log.info("[Train] scaler mean={} std={}", Arrays.toString(prepared.scaler().mean()),
                Arrays.toString(prepared.scaler().std()));

        var options = detectorOptions();
        var forest = IsolationForest.fit(prepared.matrix(), options);
        int anomalies = (int) Arrays.stream(forest.predict(prepared.matrix()))
                .filter(l -> l == IsolationForest.ANOMALY).count();
        log.info("[Train] {} trees, contamination={}, threshold={}, {} training points flagged",
                forest.trees().size(), forest.contamination(), forest.threshold(), anomalies);

        var trainedAt = Instant.now(clock);
        var bundle = ModelBundle.of(prepared.scaler(), forest, samples.size(), trainedAt);
        var path = artifacts.save(bundle);
        registry.publish(bundle);

        return new TrainingReport(samples.size(), forest.trees().size(), forest.subSampleSize(),
                forest.contamination(), forest.threshold(), anomalies, trainedAt, path);
    }

    DetectorOptions detectorOptions() {
        var m = props.model();
        return DetectorOptions.builder()
                .contamination(m.contamination())
                .numberOfTrees(m.nEstimators())
                .maxSamples(m.maxSamples())
                .randomSeed(m.randomSeed())
                .parallelExecutionEnabled(m.parallel())
                .build();
    }
}
