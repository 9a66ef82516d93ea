package it.aw.normativerag.model;

/**
 * Parametri di chunking dei testi normativi.
 * <p>
 * {@code chunkSize} è la dimensione nominale (in caratteri) di un chunk prodotto
 * dallo splitter a finestra; un articolo resta intero finché non supera
 * {@code chunkSize * overflowFactor}.
 */
public record ChunkingParams(int chunkSize, int overlap, double overflowFactor) {

    public static final int    DEFAULT_CHUNK_SIZE      = 1000;
    public static final int    DEFAULT_OVERLAP         = 200;
    public static final double DEFAULT_OVERFLOW_FACTOR = 1.5;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize < 50) {
            throw new IllegalArgumentException("chunkSize deve essere >= 50 (ricevuto: " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") deve essere < chunkSize (" + chunkSize + ")");
        }
        if (overflowFactor < 1.0) {
            throw new IllegalArgumentException(
                    "overflowFactor deve essere >= 1.0 (ricevuto: " + overflowFactor + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP, DEFAULT_OVERFLOW_FACTOR);
    }

    /** Lunghezza oltre la quale un articolo viene suddiviso in parti. */
    public int maxArticleLength() {
        return (int) (chunkSize * overflowFactor);
    }

    /** Stessi parametri senza sovrapposizione, per suddividere un singolo articolo. */
    public ChunkingParams withoutOverlap() {
        return new ChunkingParams(chunkSize, 0, overflowFactor);
    }
}
