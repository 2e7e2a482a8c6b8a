package io.deskscale.exception;

/** Rejected scale input. Nothing has been written when this is thrown. */
public class ScaleValidationException extends Exception {
    public ScaleValidationException(String message) {
        super(message);
    }
}
