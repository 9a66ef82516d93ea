package it.aw.normativerag.exception;

/**
 * Radice delle eccezioni del sistema di retrieval normativo.
 */
public class NormativeException extends RuntimeException {

    public NormativeException(String message) {
        super(message);
    }

    public NormativeException(String message, Throwable cause) {
        super(message, cause);
    }
}
