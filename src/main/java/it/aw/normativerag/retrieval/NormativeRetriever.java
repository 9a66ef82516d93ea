package it.aw.normativerag.retrieval;

import it.aw.normativerag.config.NormativeRagProperties;
import it.aw.normativerag.exception.ValidationException;
import it.aw.normativerag.index.MultiLevelIndexRouter;
import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import it.aw.normativerag.model.Citation;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.model.RetrievalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Retriever di normative: ricerca (gerarchica o su un livello), ri-ordinamento
 * ibrido, compressione opzionale via LLM, filtro per soglia di score.
 * <p>
 * Pipeline di {@link #retrieve(RetrievalRequest)}:
 * <ol>
 *   <li>Fetch: livello esplicito → solo quella collection; altrimenti ricerca gerarchica
 *       con {@code 2 * topK} risultati per livello</li>
 *   <li>Hybrid scoring (HybridScorer)</li>
 *   <li>Re-ranking via ContextCompressor se ci sono più di {@code topK} candidati;
 *       in caso di errore si tiene l'ordine precedente</li>
 *   <li>Filtro per soglia sui chunk che riportano uno score</li>
 *   <li>Primi {@code topK}</li>
 * </ol>
 */
public class NormativeRetriever {

    private static final Logger log = LoggerFactory.getLogger(NormativeRetriever.class);
    private static final int PREVIEW_LENGTH = 200;

    private final MultiLevelIndexRouter router;
    private final ContextCompressor compressor;
    private final NormativeRagProperties.Retrieval config;
    private final HybridScorer scorer;

    public NormativeRetriever(MultiLevelIndexRouter router,
                              ContextCompressor compressor,
                              NormativeRagProperties.Retrieval config) {
        this.router = router;
        this.compressor = compressor;
        this.config = config;
        this.scorer = new HybridScorer(config.getKeywordWeight());
        log.info("Normative retriever inizializzato (hybrid={}, rerank={}, keywordWeight={})",
                config.isHybridSearch(), config.isRerank(), config.getKeywordWeight());
    }

    /** Ricerca gerarchica con i default di configurazione. */
    public List<Chunk> retrieve(String query, String municipality, String region) {
        return retrieve(RetrievalRequest.of(query).withLocation(municipality, null, region));
    }

    public List<Chunk> retrieve(RetrievalRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new ValidationException("Query vuota");
        }
        int topK = request.topK() != null ? request.topK() : config.getTopK();
        if (topK <= 0) {
            throw new ValidationException("topK deve essere > 0 (ricevuto: " + topK + ")");
        }
        boolean rerank = request.rerank() != null ? request.rerank() : config.isRerank();
        String query = request.query();
        log.info("Retrieve: '{}' (top_k={}, rerank={})", query, topK, rerank);

        List<Chunk> documents;
        if (request.level() != null) {
            documents = searchSpecificLevel(request, topK);
        } else {
            documents = router.searchHierarchical(query, request.municipality(), request.province(),
                    request.region(), topK * 2);
        }

        if (config.isHybridSearch()) {
            documents = scorer.rank(query, documents);
        }
        if (rerank && documents.size() > topK) {
            documents = rerankDocuments(query, documents, topK);
        }
        documents = filterByScore(documents);

        List<Chunk> result = documents.size() > topK ? List.copyOf(documents.subList(0, topK)) : documents;
        log.info("Recuperati {} documenti rilevanti", result.size());
        return result;
    }

    private List<Chunk> searchSpecificLevel(RetrievalRequest request, int topK) {
        NormativeLevel level = NormativeLevel.fromCode(request.level());
        Map<String, String> filter = Map.of();
        if (request.municipality() != null && level == NormativeLevel.COMUNALE) {
            filter = Map.of(ChunkMetadata.MUNICIPALITY, request.municipality());
        } else if (request.province() != null && level != NormativeLevel.NAZIONALE) {
            filter = Map.of(ChunkMetadata.PROVINCE, request.province());
        } else if (request.region() != null && level != NormativeLevel.NAZIONALE) {
            filter = Map.of(ChunkMetadata.REGION, request.region());
        }
        return router.manager(level).search(request.query(), topK, filter);
    }

    private List<Chunk> rerankDocuments(String query, List<Chunk> documents, int topK) {
        log.debug("Re-ranking di {} documenti", documents.size());
        try {
            if (compressor == null) {
                throw new IllegalStateException("nessun compressore configurato");
            }
            List<Chunk> reranked = compressor.compress(query, documents);
            log.debug("Re-ranking completato: {} documenti", reranked.size());
            return reranked.size() > topK ? reranked.subList(0, topK) : reranked;
        } catch (RuntimeException e) {
            log.warn("Errore nel re-ranking, uso ordine originale: {}", e.getMessage());
            return documents.subList(0, topK);
        }
    }

    /** Scarta i chunk con score inferiore alla soglia; quelli senza score restano. */
    private List<Chunk> filterByScore(List<Chunk> documents) {
        double threshold = config.getScoreThreshold();
        if (threshold <= 0) return documents;
        List<Chunk> filtered = new ArrayList<>(documents.size());
        for (Chunk chunk : documents) {
            Double score = chunk.metadata().score();
            if (score == null || score >= threshold) filtered.add(chunk);
        }
        if (filtered.size() < documents.size()) {
            log.debug("Filtrati {} documenti sotto soglia {}", documents.size() - filtered.size(), threshold);
        }
        return filtered;
    }

    /**
     * Formatta i chunk come contesto per un LLM: ogni chunk è preceduto da un
     * riferimento "[LR 38/1999 - Art. 12 - Regione Lazio]" e separato da "---".
     */
    public String formatContext(List<Chunk> chunks) {
        List<String> parts = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            String reference = referenceOf(chunk.metadata());
            if (reference.isEmpty()) reference = "Documento " + (i + 1);
            parts.add("[" + reference + "]\n" + chunk.text() + "\n");
        }
        return String.join("\n---\n\n", parts);
    }

    public List<Citation> getCitations(List<Chunk> chunks) {
        List<Citation> citations = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            ChunkMetadata meta = chunk.metadata();
            String scope = meta.municipality() != null ? meta.municipality()
                    : meta.province() != null ? meta.province()
                    : meta.region();
            String text = chunk.text();
            String preview = text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
            citations.add(new Citation(
                    meta.normativeLevel() != null ? meta.normativeLevel() : "",
                    meta.lawReference(),
                    meta.article(),
                    scope,
                    preview));
        }
        return citations;
    }

    private static String referenceOf(ChunkMetadata meta) {
        List<String> parts = new ArrayList<>(3);
        if (meta.lawReference() != null) parts.add(meta.lawReference());
        if (meta.article() != null) parts.add("Art. " + meta.article());
        if (meta.municipality() != null) {
            parts.add("Comune di " + meta.municipality());
        } else if (meta.region() != null) {
            parts.add("Regione " + meta.region());
        }
        return String.join(" - ", parts);
    }
}
