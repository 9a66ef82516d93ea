package it.aw.normativerag.model;

/**
 * Statistiche di una collection normativa.
 */
public record StoreStats(
        String collectionName,
        int totalChunks,
        String embeddingModel
) {}
