package it.aw.normativerag.exception;

/**
 * Il re-ranking non è disponibile o è fallito. Non fatale: il retriever ripiega
 * sull'ordine pre-rerank.
 */
public class RerankUnavailableException extends NormativeException {

    public RerankUnavailableException(String message) {
        super(message);
    }

    public RerankUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
