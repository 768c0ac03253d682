package com.jobrelay.exception;

/**
 * The coordination store could not be reached. Transient: callers back off and try again, and no job state is
 * changed because of it.
 */
public class StoreUnavailableException extends JobRelayException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
