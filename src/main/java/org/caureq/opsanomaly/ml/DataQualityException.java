package org.caureq.opsanomaly.ml;

/** A feature has no readable value in the whole batch, so no fill-in value exists. */
public class DataQualityException extends RuntimeException {
    private final Feature feature;

    public DataQualityException(Feature feature, int rows) {
        super("no value for " + feature.column() + " in a batch of " + rows + " samples");
        this.feature = feature;
    }

    public Feature feature() { return feature; }
}
