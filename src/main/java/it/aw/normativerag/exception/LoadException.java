package it.aw.normativerag.exception;

/**
 * Errore di I/O o di parsing durante la lettura di un documento sorgente.
 */
public class LoadException extends NormativeException {

    private final String source;

    public LoadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
