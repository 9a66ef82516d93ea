package it.aw.normativerag.model;

import java.util.List;

/**
 * Riepilogo di un'ingestione multi-documento: un {@link IngestionResult} per file,
 * nell'ordine di elaborazione.
 */
public record IngestionReport(List<IngestionResult> results) {

    public IngestionReport {
        results = List.copyOf(results);
    }

    public int succeeded() {
        return (int) results.stream().filter(IngestionResult::succeeded).count();
    }

    public int failed() {
        return results.size() - succeeded();
    }

    public int totalChunks() {
        return results.stream().mapToInt(IngestionResult::chunkCount).sum();
    }
}
