package it.aw.normativerag.retrieval;

import it.aw.normativerag.model.Chunk;

import java.util.List;

/**
 * Filtro di rilevanza esterno applicato ai candidati del retriever.
 * Va considerato inaffidabile: il chiamante deve sempre avere un fallback.
 */
public interface ContextCompressor {

    /**
     * @return i chunk rilevanti per la query, eventualmente con testo ridotto
     * @throws it.aw.normativerag.exception.RerankUnavailableException se il filtro non è utilizzabile
     */
    List<Chunk> compress(String query, List<Chunk> chunks);
}
