package it.aw.normativerag.model;

import it.aw.normativerag.exception.ValidationException;

/**
 * Documento normativo grezzo, così come caricato dalla sorgente.
 * I campi geografici sono quelli forniti dal chiamante (null se assenti).
 */
public record RegulatoryDocument(
        String         text,
        String         source,        // nome del file di origine
        NormativeLevel level,
        String         region,
        String         province,
        String         municipality
) {
    public RegulatoryDocument {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Documento vuoto: " + source);
        }
        if (level == null) {
            throw new ValidationException("Livello normativo mancante per il documento " + source);
        }
    }
}
