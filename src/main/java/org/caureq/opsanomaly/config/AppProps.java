package org.caureq.opsanomaly.config;

import org.caureq.opsanomaly.ml.ImputationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "app")
public record AppProps(String apiKey, SamplerProps sampler, ModelProps model) {

    public AppProps {
        if (sampler == null) sampler = new SamplerProps(true, 10000L, "/");
        if (model == null) model = new ModelProps(null, null, null, null, null, false, null, false);
    }

    /** Periodic collector settings */
    public record SamplerProps(Boolean enabled, long intervalMs, String diskPath) {
        public SamplerProps {
            if (enabled == null) enabled = true;
            if (intervalMs <= 0) intervalMs = 10000L;
            if (diskPath == null || diskPath.isBlank()) diskPath = "/";
        }
    }

    /** Training parameters and artifact location; nulls fall back to the defaults below */
    public record ModelProps(Path artifactPath, Double contamination, Integer nEstimators, Integer maxSamples,
                             Long randomSeed, boolean parallel, ImputationPolicy imputation,
                             boolean trainOnStartup) {
        public ModelProps {
            if (artifactPath == null) artifactPath = Path.of("data", "model-bundle.json");
            if (contamination == null) contamination = 0.05;
            if (nEstimators == null) nEstimators = 100;
            if (maxSamples == null) maxSamples = 256;
            if (randomSeed == null) randomSeed = 42L;
            if (imputation == null) imputation = ImputationPolicy.TRAINING;
        }
    }
}
