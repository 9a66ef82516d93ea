package it.aw.normativerag.model;

import java.nio.file.Path;

/**
 * Richiesta di ingestione di un file normativo con il suo contesto geografico.
 */
public record IngestionRequest(
        Path           file,
        NormativeLevel level,
        String         region,
        String         province,
        String         municipality
) {
    public static IngestionRequest national(Path file) {
        return new IngestionRequest(file, NormativeLevel.NAZIONALE, null, null, null);
    }
}
