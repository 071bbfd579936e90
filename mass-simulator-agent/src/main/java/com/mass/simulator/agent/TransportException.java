package com.mass.simulator.agent;

/**
 * The broker could not be reached or did not accept a publish in time.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
