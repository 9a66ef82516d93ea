package it.aw.normativerag.processing;

import java.util.regex.Pattern;

/**
 * Normalizzazione del testo normativo prima del chunking.
 * <ul>
 *   <li>rimozione dei byte nulli</li>
 *   <li>whitespace consecutivo collassato in un singolo spazio</li>
 *   <li>"art." / "Art." / "ART." riscritti come "Articolo "</li>
 *   <li>spaziatura di "comma" uniformata</li>
 * </ul>
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE   = Pattern.compile("\\s+");
    private static final Pattern ARTICLE_ABBR = Pattern.compile("\\bart\\.\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMA        = Pattern.compile("\\bcomma\\s+", Pattern.CASE_INSENSITIVE);

    private TextNormalizer() {}

    public static String normalize(String text) {
        if (text == null) return "";
        String result = text.replace("\u0000", "");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        result = ARTICLE_ABBR.matcher(result).replaceAll("Articolo ");
        result = COMMA.matcher(result).replaceAll("comma ");
        return result.strip();
    }
}
