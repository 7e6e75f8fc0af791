package com.parkingrules.engine.normalize;

/**
 * A raw record that cannot be normalized: unparseable WKT, day or time text, a missing
 * required field or an unknown regulation kind. Aborts that one record only.
 */
public class InvalidRecordException extends RuntimeException {

    public InvalidRecordException(String message) {
        super(message);
    }

    public InvalidRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
