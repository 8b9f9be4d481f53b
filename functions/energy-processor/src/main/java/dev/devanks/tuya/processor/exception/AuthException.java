package dev.devanks.tuya.processor.exception;

/**
 * The Tuya token endpoint refused to issue an access token.
 */
public class AuthException extends EnergyProcessingException {
    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
