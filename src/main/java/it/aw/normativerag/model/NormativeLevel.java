package it.aw.normativerag.model;

import it.aw.normativerag.exception.ValidationException;

import java.util.Locale;

/**
 * Livello gerarchico di una norma.
 * <p>
 * Le collection fisiche sono tre: la normativa provinciale è memorizzata nella
 * collection regionale, distinta dalla chiave {@code province} nei metadati.
 */
public enum NormativeLevel {

    NAZIONALE("nazionale", "Nazionale"),
    REGIONALE("regionale", "Regionale"),
    PROVINCIALE("provinciale", "Provinciale"),
    COMUNALE("comunale", "Comunale");

    private final String code;
    private final String label;

    NormativeLevel(String code, String label) {
        this.code = code;
        this.label = label;
    }

    /** Codice usato nei metadati ({@code normative_level}) e nei parametri di configurazione. */
    public String code() {
        return code;
    }

    /** Etichetta usata nel campo {@code hierarchy_level} dei risultati gerarchici. */
    public String label() {
        return label;
    }

    /** Livello della collection che ospita i documenti di questo livello. */
    public NormativeLevel storeLevel() {
        return this == PROVINCIALE ? REGIONALE : this;
    }

    public String collectionName() {
        return "normative_" + storeLevel().code;
    }

    /**
     * Converte un codice testuale (case-insensitive) nel livello corrispondente.
     *
     * @throws ValidationException se il codice è nullo o non riconosciuto
     */
    public static NormativeLevel fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (NormativeLevel level : values()) {
                if (level.code.equals(normalized)) return level;
            }
        }
        throw new ValidationException("Livello normativo non valido: " + code);
    }
}
