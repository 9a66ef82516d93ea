package it.aw.normativerag.exception;

import java.util.List;

/**
 * Errore dell'embedding store, del registro o del modello di embedding.
 * <p>
 * Riporta l'operazione e la collection coinvolte. Per gli upsert a batch indica
 * anche il batch fallito e gli id già committati dai batch precedenti.
 */
public class BackendException extends NormativeException {

    private final String operation;
    private final String collection;
    private final Integer batchIndex;
    private final List<String> committedIds;

    public BackendException(String operation, String collection, String message, Throwable cause) {
        this(operation, collection, null, List.of(), message, cause);
    }

    public BackendException(String operation, String collection, Integer batchIndex,
                            List<String> committedIds, String message, Throwable cause) {
        super("[" + operation + "@" + collection
                + (batchIndex != null ? " batch " + batchIndex : "") + "] " + message, cause);
        this.operation = operation;
        this.collection = collection;
        this.batchIndex = batchIndex;
        this.committedIds = List.copyOf(committedIds);
    }

    public String getOperation() {
        return operation;
    }

    public String getCollection() {
        return collection;
    }

    /** Indice 0-based del batch fallito, null se l'errore non riguarda un upsert. */
    public Integer getBatchIndex() {
        return batchIndex;
    }

    /** Id inseriti dai batch completati prima dell'errore. */
    public List<String> getCommittedIds() {
        return committedIds;
    }
}
