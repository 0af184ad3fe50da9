package com.libragraph.relay.core.worker;

/**
 * The worker could not complete a call to the broker. Counted as a loop-level
 * error, never reported as a job failure.
 */
public class BrokerUnavailableException extends RuntimeException {

    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
