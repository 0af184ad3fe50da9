package com.libragraph.relay.core.backend;

/**
 * A submission could not be delivered: connection failure, non-2xx status,
 * or a response without an execution id.
 */
public class BackendUnavailableException extends BackendException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "BackendUnavailable";
    }
}
