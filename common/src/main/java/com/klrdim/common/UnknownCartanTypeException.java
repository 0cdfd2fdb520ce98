package com.klrdim.common;

/** The Cartan-type descriptor does not name a supported family and rank. */
public class UnknownCartanTypeException extends KlrInputException {

    public UnknownCartanTypeException(String message) {
        super(message);
    }

    public UnknownCartanTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
