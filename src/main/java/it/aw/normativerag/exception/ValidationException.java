package it.aw.normativerag.exception;

/**
 * Input non valido: livello normativo sconosciuto, filtro malformato, parametri fuori range.
 */
public class ValidationException extends NormativeException {

    public ValidationException(String message) {
        super(message);
    }
}
