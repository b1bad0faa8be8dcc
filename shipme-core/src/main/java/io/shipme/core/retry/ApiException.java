package io.shipme.core.retry;

/**
 * A remote API answered with a non-success HTTP status.
 */
public class ApiException extends RuntimeException {
    private final int status;

    public ApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }

    public boolean clientError() {
        return status >= 400 && status < 500;
    }
}
