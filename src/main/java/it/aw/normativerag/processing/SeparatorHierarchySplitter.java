package it.aw.normativerag.processing;

import it.aw.normativerag.model.ChunkingParams;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Splitter a finestra con gerarchia di separatori.
 * <p>
 * Il testo viene diviso sul primo separatore della lista presente nel testo; i pezzi
 * più lunghi di {@code chunkSize} vengono ridivisi con i separatori successivi, quelli
 * più corti vengono riaccorpati fino a {@code chunkSize} caratteri mantenendo
 * {@code overlap} caratteri di sovrapposizione tra chunk consecutivi.
 * Il separatore resta in testa al pezzo che lo segue, così un marcatore
 * di articolo apre sempre il proprio chunk.
 * <p>
 * Nessun chunk prodotto supera {@code chunkSize}: l'ultimo separatore ("") divide
 * carattere per carattere.
 */
public class SeparatorHierarchySplitter {

    public static final List<String> DEFAULT_SEPARATORS =
            List.of("Articolo ", "Art. ", "\n\n", "\n", ". ", " ", "");

    private final int chunkSize;
    private final int overlap;
    private final List<String> separators;

    public SeparatorHierarchySplitter(ChunkingParams params) {
        this(params, DEFAULT_SEPARATORS);
    }

    public SeparatorHierarchySplitter(ChunkingParams params, List<String> separators) {
        this.chunkSize = params.chunkSize();
        this.overlap = params.overlap();
        this.separators = List.copyOf(separators);
    }

    /** Divide il testo in chunk non vuoti, senza spazi iniziali o finali. */
    public List<String> splitText(String text) {
        if (text == null || text.isBlank()) return List.of();
        return split(text, separators);
    }

    private List<String> split(String text, List<String> candidates) {
        String separator = "";
        List<String> remaining = List.of();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate.isEmpty() || text.contains(candidate)) {
                separator = candidate;
                remaining = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        List<String> result = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (piece.length() < chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                result.addAll(merge(fitting));
                fitting.clear();
            }
            if (remaining.isEmpty()) {
                addIfNotBlank(result, piece);
            } else {
                result.addAll(split(piece, remaining));
            }
        }
        if (!fitting.isEmpty()) {
            result.addAll(merge(fitting));
        }
        return result;
    }

    private static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            for (int i = 0; i < text.length(); i++) {
                pieces.add(String.valueOf(text.charAt(i)));
            }
            return pieces;
        }
        int start = 0;
        int idx = text.indexOf(separator);
        while (idx >= 0) {
            if (idx > start) pieces.add(text.substring(start, idx));
            start = idx;
            idx = text.indexOf(separator, idx + separator.length());
        }
        pieces.add(text.substring(start));
        return pieces;
    }

    /** Riaccorpa pezzi corti in chunk di al massimo chunkSize caratteri. */
    private List<String> merge(List<String> pieces) {
        List<String> chunks = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int length = piece.length();
            if (total + length > chunkSize && !window.isEmpty()) {
                addIfNotBlank(chunks, String.join("", window));
                while (total > overlap || (total + length > chunkSize && total > 0)) {
                    total -= window.removeFirst().length();
                }
            }
            window.addLast(piece);
            total += length;
        }
        if (!window.isEmpty()) {
            addIfNotBlank(chunks, String.join("", window));
        }
        return chunks;
    }

    private static void addIfNotBlank(List<String> target, String chunk) {
        String stripped = chunk.strip();
        if (!stripped.isEmpty()) target.add(stripped);
    }
}
