package com.facility.snapshot.exception;

/**
 * Malformed query parameters, e.g. an unparsable timestamp.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
