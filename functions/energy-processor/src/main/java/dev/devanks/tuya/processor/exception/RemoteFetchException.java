package dev.devanks.tuya.processor.exception;

/**
 * A device log request failed or returned a payload of unexpected shape.
 */
public class RemoteFetchException extends EnergyProcessingException {
    public RemoteFetchException(String message) {
        super(message);
    }

    public RemoteFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
