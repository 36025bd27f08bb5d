package com.conveyor.orchestrator.platform;

/**
 * Thrown when the artifact registry or the deployment platform returns an
 * unexpected error or cannot be reached.
 *
 * A clean rejection ({@link Receipt#rejected}) is not an exception.
 */
public class PlatformException extends RuntimeException {

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
