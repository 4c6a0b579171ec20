package com.yescount.planner.domain.port.out;

/**
 * Transport-level failure while fetching a source (timeout, connection error, non-2xx response).
 */
public class SourceFetchException extends RuntimeException {

    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
