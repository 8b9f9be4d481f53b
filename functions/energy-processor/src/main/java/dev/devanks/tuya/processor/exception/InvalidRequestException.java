package dev.devanks.tuya.processor.exception;

/**
 * Caller supplied missing or invalid arguments, such as a malformed date range.
 */
public class InvalidRequestException extends EnergyProcessingException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
