package org.caureq.opsanomaly.service;

public class SampleWriteException extends RuntimeException {
    public SampleWriteException(String message) {
        super(message);
    }

    public SampleWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
