package org.caureq.opsanomaly.ml;

import java.time.Instant;
import java.util.List;

public record ModelBundle(int formatVersion, List<String> featureOrder, Instant trainedAt, int trainingRows,
                          StandardScaler scaler, IsolationForest detector) {

    public static final int FORMAT_VERSION = 1;

    public static ModelBundle of(StandardScaler scaler, IsolationForest detector, int trainingRows, Instant trainedAt) {
        return new ModelBundle(FORMAT_VERSION, Feature.COLUMN_ORDER, trainedAt, trainingRows, scaler, detector);
    }

    public boolean matchesCurrentSchema() {
        return formatVersion == FORMAT_VERSION && Feature.COLUMN_ORDER.equals(featureOrder);
    }
}
