package org.learningjava.uniagent.application.port;

/** Engine call failed terminally for this round (after the adapter's own retries). */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
