package org.caureq.opsanomaly.api.error;

public enum ErrorCode {
    BAD_REQUEST, WRITE_FAILED, STORE_UNAVAILABLE, DATA_QUALITY, INSUFFICIENT_DATA,
    ARTIFACT_WRITE_FAILED, INTERNAL_ERROR
}
