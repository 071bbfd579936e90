package com.mass.simulator.protocol;

/**
 * Raised when an inbound frame or the envelope inside it cannot be decoded.
 */
public class FramingException extends Exception {

    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
