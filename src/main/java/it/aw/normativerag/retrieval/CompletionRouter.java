package it.aw.normativerag.retrieval;

import it.aw.normativerag.exception.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Tabella compito → provider, in ordine di preferenza.
 * Se il primo provider fallisce si prova il successivo.
 */
public class CompletionRouter {

    private static final Logger log = LoggerFactory.getLogger(CompletionRouter.class);

    private final Map<TaskType, List<CompletionProvider>> providers = new EnumMap<>(TaskType.class);

    public CompletionRouter register(TaskType task, CompletionProvider provider) {
        providers.computeIfAbsent(task, t -> new ArrayList<>()).add(provider);
        log.info("Provider {} registrato per {}", provider.id(), task);
        return this;
    }

    public boolean supports(TaskType task) {
        return !providers.getOrDefault(task, List.of()).isEmpty();
    }

    /**
     * Esegue il prompt con il primo provider disponibile per il compito.
     *
     * @throws BackendException se nessun provider è configurato o se falliscono tutti
     */
    public String complete(TaskType task, String prompt) {
        List<CompletionProvider> chain = providers.getOrDefault(task, List.of());
        if (chain.isEmpty()) {
            throw new BackendException("complete", task.name(), "Nessun provider configurato", null);
        }
        RuntimeException last = null;
        for (CompletionProvider provider : chain) {
            try {
                return provider.complete(prompt);
            } catch (RuntimeException e) {
                log.warn("Provider {} fallito per {}: {}", provider.id(), task, e.getMessage());
                last = e;
            }
        }
        throw new BackendException("complete", task.name(), "Tutti i provider hanno fallito", last);
    }
}
