package it.aw.normativerag.retrieval;

/**
 * Backend generativo interrogabile con un prompt testuale.
 * Un'implementazione per backend; la scelta per compito è in {@link CompletionRouter}.
 */
public interface CompletionProvider {

    /** Identificativo del backend, usato nei log. */
    String id();

    String complete(String prompt);
}
