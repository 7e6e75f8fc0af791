package com.parkingrules.engine.ingest;

/**
 * A whole ingestion run was abandoned. Nothing from the run is published; the previous
 * snapshot keeps serving.
 */
public class IngestionFailedException extends RuntimeException {

    public IngestionFailedException(String message) {
        super(message);
    }

    public IngestionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
