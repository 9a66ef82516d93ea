package it.aw.normativerag.retrieval;

import it.aw.normativerag.model.Chunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Ri-ordinamento ibrido: combina la posizione nel ranking semantico con la
 * copertura delle keyword della query.
 * <pre>
 *   semantic = 1 - i/N            (i = posizione 0-based, N = candidati)
 *   keyword  = keyword trovate / keyword totali
 *   combined = (1 - w) * semantic + w * keyword
 * </pre>
 * Il rank fa da proxy della similarità perché i punteggi assoluti non sono
 * sempre disponibili. L'ordinamento è stabile: a parità di punteggio resta
 * l'ordine di partenza.
 */
public class HybridScorer {

    static final Set<String> STOPWORDS = Set.of(
            "il", "lo", "la", "i", "gli", "le", "un", "uno", "una",
            "di", "a", "da", "in", "con", "su", "per", "tra", "fra",
            "è", "sono", "sia", "come", "quale", "quali", "che", "cosa");

    private final double keywordWeight;

    public HybridScorer(double keywordWeight) {
        if (keywordWeight < 0.0 || keywordWeight > 1.0) {
            throw new IllegalArgumentException("keywordWeight deve essere in [0, 1] (ricevuto: " + keywordWeight + ")");
        }
        this.keywordWeight = keywordWeight;
    }

    /** Keyword della query: minuscole, senza stopword e token di 2 caratteri o meno. */
    public static List<String> extractKeywords(String query) {
        List<String> keywords = new ArrayList<>();
        for (String word : query.toLowerCase(Locale.ITALIAN).split("\\s+")) {
            if (word.length() > 2 && !STOPWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    public static double keywordScore(String text, List<String> keywords) {
        if (keywords.isEmpty()) return 0.0;
        String lower = text.toLowerCase(Locale.ITALIAN);
        long matches = keywords.stream().filter(lower::contains).count();
        return (double) matches / keywords.size();
    }

    /** Punteggi combinati dei candidati, nell'ordine ricevuto. */
    public double[] score(String query, List<Chunk> candidates) {
        List<String> keywords = extractKeywords(query);
        int n = candidates.size();
        double[] combined = new double[n];
        for (int i = 0; i < n; i++) {
            double semantic = 1.0 - (double) i / n;
            double keyword = keywordScore(candidates.get(i).text(), keywords);
            combined[i] = (1.0 - keywordWeight) * semantic + keywordWeight * keyword;
        }
        return combined;
    }

    /** Candidati ordinati per punteggio combinato decrescente. */
    public List<Chunk> rank(String query, List<Chunk> candidates) {
        double[] combined = score(query, candidates);
        List<Integer> order = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) order.add(i);
        order.sort(Comparator.comparingDouble((Integer i) -> combined[i]).reversed());

        List<Chunk> ranked = new ArrayList<>(candidates.size());
        for (int i : order) ranked.add(candidates.get(i));
        return ranked;
    }
}
