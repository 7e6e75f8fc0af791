package com.parkingrules.engine.ingest;

/**
 * Supplies the raw datasets of one run.
 */
public interface DatasetSource {

    /**
     * @throws IngestionFailedException when the datasets cannot be read
     */
    IngestionBatch load();

    /**
     * Human-readable location of the datasets, for logs.
     */
    String describe();
}
