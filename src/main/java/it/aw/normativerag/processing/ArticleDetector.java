package it.aw.normativerag.processing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rileva l'inizio degli articoli in un testo normativo già normalizzato.
 * <p>
 * Un candidato è qualsiasi occorrenza di "Art" o "Articolo" seguita da un numero,
 * eventualmente con suffisso latino ("3-bis", "3 ter"), in qualunque punto del
 * testo (case-insensitive); "3-bis" segue "3" e precede "4". Poiché lo stesso pattern
 * intercetta anche i rinvii interni ("ai sensi dell'Articolo 3"), tra i candidati
 * si tiene la sequenza più lunga a numerazione strettamente crescente: i rinvii
 * restano nel corpo dell'articolo che li contiene. Se quella sequenza ha meno di
 * due elementi ma i candidati sono almeno due (numerazione decrescente o ripetuta),
 * si usano i candidati grezzi.
 */
public final class ArticleDetector {

    /**
     * Intestazione di articolo: offset 0-based nel testo, numero dell'articolo e
     * posizione dell'eventuale suffisso latino (0 senza suffisso, 1 bis, 2 ter, ...).
     */
    public record ArticleHeading(int offset, int number, int suffix) {

        boolean precedes(ArticleHeading other) {
            return number < other.number || (number == other.number && suffix < other.suffix);
        }
    }

    private static final List<String> SUFFIXES = List.of(
            "bis", "ter", "quater", "quinquies", "sexies", "septies", "octies", "novies", "decies");

    private static final Pattern HEADING = Pattern.compile(
            "\\bArt(?:icolo)?\\s+(\\d{1,4})(?:\\s*-?\\s*(" + String.join("|", SUFFIXES) + "))?\\b",
            Pattern.CASE_INSENSITIVE);

    private ArticleDetector() {}

    /** Tutte le occorrenze del pattern, nell'ordine del testo. */
    public static List<ArticleHeading> candidates(String text) {
        List<ArticleHeading> result = new ArrayList<>();
        Matcher m = HEADING.matcher(text);
        while (m.find()) {
            int suffix = m.group(2) == null ? 0 : SUFFIXES.indexOf(m.group(2).toLowerCase(Locale.ROOT)) + 1;
            result.add(new ArticleHeading(m.start(), Integer.parseInt(m.group(1)), suffix));
        }
        return result;
    }

    /**
     * Intestazioni effettive degli articoli, ordinate per offset crescente.
     *
     * @param text testo normalizzato
     * @return lista vuota se nessun articolo è riconosciuto
     */
    public static List<ArticleHeading> detect(String text) {
        List<ArticleHeading> candidates = candidates(text);
        int n = candidates.size();
        if (n < 2) return candidates;

        int[] length = new int[n];
        int[] previous = new int[n];
        int best = 0;
        for (int i = 0; i < n; i++) {
            length[i] = 1;
            previous[i] = -1;
            ArticleHeading current = candidates.get(i);
            for (int j = 0; j < i; j++) {
                // a parità di lunghezza vince il predecessore più vicino
                if (candidates.get(j).precedes(current) && length[j] + 1 >= length[i]) {
                    length[i] = length[j] + 1;
                    previous[i] = j;
                }
            }
            if (length[i] >= length[best]) best = i;
        }

        List<ArticleHeading> headings = new ArrayList<>(length[best]);
        for (int i = best; i >= 0; i = previous[i]) {
            headings.add(candidates.get(i));
        }
        Collections.reverse(headings);
        // numerazione non crescente: si tengono le intestazioni grezze
        return headings.size() < 2 ? candidates : headings;
    }

    /** Numero dell'articolo con cui inizia il testo, oppure null. */
    public static String leadingArticle(String text) {
        Matcher m = HEADING.matcher(text.stripLeading());
        return m.lookingAt() ? m.group(1) : null;
    }
}
