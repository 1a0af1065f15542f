package me.golemcore.rvsafety.domain.model;

/**
 * Thrown when a PIN or its parameters do not meet the configured format
 * policy. The message never contains the PIN.
 */
public class PinValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PinValidationException(String message) {
        super(message);
    }
}
