package it.aw.normativerag.retrieval;

import it.aw.normativerag.exception.NormativeException;
import it.aw.normativerag.exception.RerankUnavailableException;
import it.aw.normativerag.model.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compressione contestuale via LLM: per ogni chunk chiede al modello di estrarre
 * testualmente le parti rilevanti per la query. I chunk per cui il modello risponde
 * {@value #NO_OUTPUT} vengono scartati; gli altri conservano i metadati originali.
 */
public class LlmContextCompressor implements ContextCompressor {

    private static final Logger log = LoggerFactory.getLogger(LlmContextCompressor.class);

    static final String NO_OUTPUT = "NO_OUTPUT";

    private static final String PROMPT = """
            Data la domanda e il contesto seguenti, estrai TESTUALMENTE, senza modificarle, \
            le parti del contesto rilevanti per rispondere alla domanda. \
            Se nessuna parte è rilevante, rispondi %s.

            > Domanda: %s
            > Contesto:
            >>>
            %s
            >>>
            Parti rilevanti estratte:""";

    private final CompletionRouter router;

    public LlmContextCompressor(CompletionRouter router) {
        this.router = router;
    }

    @Override
    public List<Chunk> compress(String query, List<Chunk> chunks) {
        if (!router.supports(TaskType.CONTEXT_COMPRESSION)) {
            throw new RerankUnavailableException("Nessun modello configurato per la compressione del contesto");
        }
        log.debug("Compressione di {} chunk", chunks.size());
        List<Chunk> compressed = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            String extracted;
            try {
                extracted = router.complete(TaskType.CONTEXT_COMPRESSION,
                        String.format(PROMPT, NO_OUTPUT, query, chunk.text()));
            } catch (NormativeException e) {
                throw new RerankUnavailableException("Compressione del contesto fallita: " + e.getMessage(), e);
            }
            if (extracted == null || extracted.isBlank() || extracted.strip().equals(NO_OUTPUT)) {
                continue;
            }
            compressed.add(chunk.withText(extracted.strip()));
        }
        log.debug("Compressione completata: {} chunk rilevanti su {}", compressed.size(), chunks.size());
        return compressed;
    }
}
