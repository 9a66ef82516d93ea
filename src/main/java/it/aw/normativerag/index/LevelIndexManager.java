package it.aw.normativerag.index;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import it.aw.normativerag.exception.BackendException;
import it.aw.normativerag.exception.ValidationException;
import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.model.ScoredChunk;
import it.aw.normativerag.model.StoreStats;
import it.aw.normativerag.registry.ChunkRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Gestisce la collection di un singolo livello normativo: inserimento a batch,
 * ricerca semantica con filtro sui metadati, cancellazione per metadati, statistiche.
 * <p>
 * Se il modello di embedding manca o fallisce, il manager ripiega su
 * {@link PseudoEmbeddingModel}: ingestione e ricerca continuano a funzionare e il
 * ranking resta affidato allo scoring per keyword.
 */
public class LevelIndexManager {

    private static final Logger log = LoggerFactory.getLogger(LevelIndexManager.class);

    public static final int DEFAULT_BATCH_SIZE = 100;

    private final NormativeLevel level;
    private final EmbeddingModel embeddingModel;
    private final String embeddingModelId;
    private final EmbeddingStore<TextSegment> store;
    private final ChunkRegistry registry;
    private final int batchSize;
    private final PseudoEmbeddingModel fallback;

    public LevelIndexManager(NormativeLevel level,
                             EmbeddingModel embeddingModel,
                             String embeddingModelId,
                             EmbeddingStore<TextSegment> store,
                             ChunkRegistry registry,
                             int batchSize,
                             int dimension) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize deve essere > 0 (ricevuto: " + batchSize + ")");
        }
        this.level = level.storeLevel();
        this.embeddingModel = embeddingModel;
        this.embeddingModelId = embeddingModel != null ? embeddingModelId : PseudoEmbeddingModel.MODEL_ID;
        this.store = store;
        this.registry = registry;
        this.batchSize = batchSize;
        this.fallback = new PseudoEmbeddingModel(dimension);
    }

    public NormativeLevel level() {
        return level;
    }

    public String collectionName() {
        return level.collectionName();
    }

    /**
     * Inserisce i chunk a batch sequenziali, nell'ordine dato.
     *
     * @return id generati, nello stesso ordine dei chunk
     * @throws BackendException se un batch fallisce: riporta l'indice del batch e gli id
     *                          dei batch già committati, che restano nello store
     */
    public List<String> upsert(List<Chunk> chunks) {
        log.info("{}: aggiunta di {} chunk", collectionName(), chunks.size());
        List<String> committed = new ArrayList<>(chunks.size());
        int batchIndex = 0;
        for (int start = 0; start < chunks.size(); start += batchSize, batchIndex++) {
            List<Chunk> batch = chunks.subList(start, Math.min(start + batchSize, chunks.size()));
            List<TextSegment> segments = batch.stream().map(Chunk::toSegment).toList();
            List<String> ids = List.of();
            try {
                List<Embedding> embeddings = embedAll(segments);
                ids = store.addAll(embeddings, segments);
                registry.register(collectionName(), ids, batch);
            } catch (RuntimeException e) {
                log.error("{}: errore nell'inserimento batch {}: {}", collectionName(), batchIndex, e.getMessage());
                discard(ids);
                throw new BackendException("upsert", collectionName(), batchIndex, committed,
                        "Inserimento fallito dopo " + committed.size() + " chunk", e);
            }
            committed.addAll(ids);
            log.debug("{}: batch {} - {} chunk inseriti", collectionName(), batchIndex, ids.size());
        }
        log.info("{}: inseriti {} chunk", collectionName(), committed.size());
        return committed;
    }

    public List<Chunk> search(String query, int k, Map<String, String> filter) {
        return doSearch(query, k, filter, null).stream()
                .map(m -> Chunk.fromSegment(m.embedded()))
                .toList();
    }

    /**
     * Ricerca con punteggio di similarità.
     *
     * @param minScore soglia minima (inclusa); null per nessuna soglia
     */
    public List<ScoredChunk> searchWithScore(String query, int k, Map<String, String> filter, Double minScore) {
        return doSearch(query, k, filter, minScore).stream()
                .map(m -> new ScoredChunk(Chunk.fromSegment(m.embedded()), m.score()))
                .toList();
    }

    /**
     * Cancella i chunk i cui metadati coincidono con il filtro.
     *
     * @return numero di chunk rimossi (0 se nessuno corrisponde)
     * @throws ValidationException se il filtro è vuoto o usa chiavi non filtrabili
     */
    public int deleteByMetadata(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) {
            throw new ValidationException("Filtro vuoto: l'eliminazione richiede almeno una condizione");
        }
        log.info("{}: eliminazione chunk con filtro {}", collectionName(), filter);
        List<String> ids = registry.findIds(collectionName(), filter);
        if (ids.isEmpty()) {
            log.info("{}: nessun chunk da eliminare", collectionName());
            return 0;
        }
        try {
            store.removeAll(ids);
        } catch (RuntimeException e) {
            throw new BackendException("delete", collectionName(), "Errore nell'eliminazione dallo store", e);
        }
        registry.remove(collectionName(), ids);
        log.info("{}: eliminati {} chunk", collectionName(), ids.size());
        return ids.size();
    }

    public StoreStats stats() {
        return new StoreStats(collectionName(), registry.count(collectionName()), embeddingModelId);
    }

    private List<EmbeddingMatch<TextSegment>> doSearch(String query, int k, Map<String, String> filter,
                                                        Double minScore) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query vuota");
        }
        if (k <= 0) {
            throw new ValidationException("k deve essere > 0 (ricevuto: " + k + ")");
        }
        Filter metadataFilter = toFilter(ChunkRegistry.validate(filter));
        Embedding queryEmbedding = embed(query);
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(k)
                .minScore(minScore != null ? minScore : 0.0)
                .filter(metadataFilter)
                .build();
        try {
            List<EmbeddingMatch<TextSegment>> matches = store.search(request).matches();
            log.debug("{}: {} risultati per '{}' (filtro {})", collectionName(), matches.size(), query, filter);
            return matches;
        } catch (RuntimeException e) {
            throw new BackendException("search", collectionName(), "Errore nella ricerca", e);
        }
    }

    /** Congiunzione di uguaglianze sui metadati; null se il filtro è vuoto. */
    static Filter toFilter(Map<String, String> filter) {
        Filter result = null;
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            Filter condition = metadataKey(entry.getKey()).isEqualTo(entry.getValue());
            result = result == null ? condition : Filter.and(result, condition);
        }
        return result;
    }

    private Embedding embed(String text) {
        return embedAll(List.of(TextSegment.from(text))).get(0);
    }

    private List<Embedding> embedAll(List<TextSegment> segments) {
        if (embeddingModel != null) {
            try {
                return embeddingModel.embedAll(segments).content();
            } catch (RuntimeException e) {
                log.warn("{}: modello di embedding non disponibile ({}), uso pseudo-embedding",
                        collectionName(), e.getMessage());
            }
        }
        return fallback.embedAll(segments).content();
    }

    private void discard(List<String> ids) {
        if (ids.isEmpty()) return;
        try {
            store.removeAll(ids);
        } catch (RuntimeException e) {
            log.warn("{}: impossibile rimuovere {} chunk del batch fallito: {}",
                    collectionName(), ids.size(), e.getMessage());
        }
    }
}
