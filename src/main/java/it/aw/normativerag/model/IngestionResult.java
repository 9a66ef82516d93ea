package it.aw.normativerag.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Esito dell'ingestione di un singolo documento normativo.
 * In caso di errore {@code chunkIds} è vuota ed {@code error} contiene il messaggio.
 */
public record IngestionResult(
        String        source,
        String        level,          // livello dichiarato del documento
        String        collection,     // collection di destinazione
        LocalDateTime ingestedAt,
        int           chunkCount,
        int           supersededChunks,
        List<String>  chunkIds,
        String        error
) {
    public static IngestionResult failed(String source, String level, String collection, String error) {
        return new IngestionResult(source, level, collection, LocalDateTime.now(), 0, 0, List.of(), error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
