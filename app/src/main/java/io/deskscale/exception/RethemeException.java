package io.deskscale.exception;

public class RethemeException extends Exception {
    private final int factor;

    public RethemeException(int factor, String message) {
        super("Re-theme to factor " + factor + " failed: " + message);
        this.factor = factor;
    }

    public RethemeException(int factor, String message, Throwable cause) {
        super("Re-theme to factor " + factor + " failed: " + message, cause);
        this.factor = factor;
    }

    public int getFactor() {
        return factor;
    }
}
