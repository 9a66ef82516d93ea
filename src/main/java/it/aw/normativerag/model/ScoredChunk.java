package it.aw.normativerag.model;

/**
 * Chunk con il punteggio di similarità restituito dall'embedding store.
 */
public record ScoredChunk(Chunk chunk, double score) {}
