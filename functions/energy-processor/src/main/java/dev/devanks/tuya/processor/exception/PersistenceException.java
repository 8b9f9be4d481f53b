package dev.devanks.tuya.processor.exception;

/**
 * A read or write against the daily consumption store failed.
 */
public class PersistenceException extends EnergyProcessingException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
