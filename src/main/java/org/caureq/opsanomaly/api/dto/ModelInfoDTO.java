package org.caureq.opsanomaly.api.dto;

import org.caureq.opsanomaly.ml.ImputationPolicy;
import org.caureq.opsanomaly.ml.ModelBundle;

import java.time.Instant;
import java.util.List;

public record ModelInfoDTO(
        boolean loaded,
        Instant trainedAt,
        Integer trainingRows,
        List<String> featureOrder,
        Integer trees,
        Integer subSampleSize,
        Double contamination,
        Double threshold,
        ImputationPolicy imputation,
        String artifactPath
) {
    public static ModelInfoDTO notLoaded(ImputationPolicy imputation, String artifactPath) {
        return new ModelInfoDTO(false, null, null, null, null, null, null, null, imputation, artifactPath);
    }

    public static ModelInfoDTO of(ModelBundle b, ImputationPolicy imputation, String artifactPath) {
        var d = b.detector();
        return new ModelInfoDTO(true, b.trainedAt(), b.trainingRows(), b.featureOrder(), d.trees().size(),
                d.subSampleSize(), d.contamination(), d.threshold(), imputation, artifactPath);
    }
}
