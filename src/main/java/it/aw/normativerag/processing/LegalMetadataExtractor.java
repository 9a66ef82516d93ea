package it.aw.normativerag.processing;

import it.aw.normativerag.model.ChunkMetadata;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Estrae dal testo di un chunk i riferimenti giuridici strutturati:
 * numero dell'articolo iniziale e prima citazione di legge (tipo, numero, anno).
 * L'assenza di un riferimento non è un errore: il campo resta non valorizzato.
 */
public final class LegalMetadataExtractor {

    /** Citazione di legge riconosciuta nel testo. */
    public record LawCitation(String type, String number, String year) {}

    private static final Pattern LAW = Pattern.compile(
            "\\b(L\\.\\s?R\\.|LR|Legge\\s+Regionale|D\\.\\s?P\\.\\s?R\\.|DPR|Decreto)"
                    + "\\s*(?:n\\.?\\s*)?(\\d+)\\s*(?:/|\\s+(?:del\\s+)?)\\s*(\\d{4})\\b",
            Pattern.CASE_INSENSITIVE);

    private LegalMetadataExtractor() {}

    public static Optional<LawCitation> findLaw(String text) {
        Matcher m = LAW.matcher(text);
        if (!m.find()) return Optional.empty();
        return Optional.of(new LawCitation(canonicalType(m.group(1)), m.group(2), m.group(3)));
    }

    /**
     * Completa i metadati di base con articolo e citazione di legge trovati nel testo.
     */
    public static ChunkMetadata enrich(String text, ChunkMetadata base) {
        ChunkMetadata.Builder builder = base.toBuilder()
                .article(ArticleDetector.leadingArticle(text));
        findLaw(text).ifPresent(law -> builder
                .lawType(law.type())
                .lawNumber(law.number())
                .lawYear(law.year()));
        return builder.build();
    }

    private static String canonicalType(String raw) {
        String compact = raw.replaceAll("[.\\s]", "").toUpperCase(Locale.ROOT);
        return switch (compact) {
            case "LR", "LEGGEREGIONALE" -> "LR";
            case "DPR" -> "DPR";
            default -> "Decreto";
        };
    }
}
