package me.golemcore.rvsafety.domain.model;

/**
 * Raised by PIN store adapters when persistence is unavailable or returns data
 * that cannot be read. PIN validation maps it to an infrastructure-error
 * denial.
 */
public class PinStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PinStoreException(String message) {
        super(message);
    }

    public PinStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
