package com.jobrelay.exception;

/**
 * Base type of all exceptions raised by the job lifecycle engine.
 */
public class JobRelayException extends RuntimeException {

    public JobRelayException(String message) {
        super(message);
    }

    public JobRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
