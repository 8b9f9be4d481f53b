package dev.devanks.tuya.processor.exception;

/**
 * Base type of every failure raised by the energy processing pipeline.
 */
public class EnergyProcessingException extends RuntimeException {
    public EnergyProcessingException(String message) {
        super(message);
    }

    public EnergyProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
