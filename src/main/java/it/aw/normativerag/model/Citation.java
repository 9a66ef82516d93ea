package it.aw.normativerag.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Citazione strutturata derivata dai metadati di un chunk.
 * <p>
 * {@code law}, {@code article} e {@code scope} sono null se l'informazione non è
 * presente nei metadati. {@code preview} contiene i primi 200 caratteri del testo.
 */
public record Citation(
        String level,     // normative_level del chunk
        String law,       // "LR 38/1999"
        String article,   // "12"
        String scope,     // comune, provincia o regione di riferimento
        String preview
) {

    /** Rappresentazione testuale compatta, es. "regionale - LR 38/1999 - Art. 12 - Lazio". */
    public String asText() {
        List<String> parts = new ArrayList<>();
        if (level != null && !level.isEmpty()) parts.add(level);
        if (law != null) parts.add(law);
        if (article != null) parts.add("Art. " + article);
        if (scope != null) parts.add(scope);
        return String.join(" - ", parts);
    }
}
