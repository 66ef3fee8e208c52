package org.caureq.opsanomaly.ml;

/** Where the fill-in value for an absent metric comes from when scoring. */
public enum ImputationPolicy {
    /** Means frozen in the scaler when the model was trained. */
    TRAINING,
    /** Means of the batch being scored, recomputed on every call. */
    BATCH
}
