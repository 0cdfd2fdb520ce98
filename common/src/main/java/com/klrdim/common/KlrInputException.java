package com.klrdim.common;

/**
 * Rejected input to a dimension evaluation. Raised during precondition
 * validation, before any witness is enumerated.
 */
public abstract class KlrInputException extends IllegalArgumentException {

    protected KlrInputException(String message) {
        super(message);
    }

    protected KlrInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
