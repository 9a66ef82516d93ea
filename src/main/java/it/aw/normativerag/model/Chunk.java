package it.aw.normativerag.model;

import dev.langchain4j.data.segment.TextSegment;

/**
 * Unità recuperabile: testo normativo con i relativi metadati giurisdizionali.
 * Immutabile; le varianti prodotte in fase di ricerca sono nuove istanze.
 */
public record Chunk(String text, ChunkMetadata metadata) {

    public Chunk {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Il testo di un chunk non può essere vuoto");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Metadati del chunk mancanti");
        }
    }

    public TextSegment toSegment() {
        return TextSegment.from(text, metadata.toMetadata());
    }

    public static Chunk fromSegment(TextSegment segment) {
        return new Chunk(segment.text(), ChunkMetadata.fromMetadata(segment.metadata()));
    }

    public Chunk withMetadata(ChunkMetadata metadata) {
        return new Chunk(text, metadata);
    }

    public Chunk withText(String text) {
        return new Chunk(text, metadata);
    }
}
