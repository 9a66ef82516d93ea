package it.aw.normativerag.retrieval;

/**
 * Compiti per cui il sistema ricorre a un modello generativo.
 * Ogni compito ha la propria catena di provider in {@link CompletionRouter}.
 */
public enum TaskType {
    /** Estrazione dei passaggi rilevanti per la query (compressione del contesto). */
    CONTEXT_COMPRESSION
}
