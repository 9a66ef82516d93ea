package it.aw.normativerag.exception;

/**
 * Formato del file sorgente non supportato.
 */
public class FormatException extends NormativeException {

    public FormatException(String message) {
        super(message);
    }
}
