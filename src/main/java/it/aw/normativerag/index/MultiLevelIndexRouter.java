package it.aw.normativerag.index;

import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.model.StoreStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Instrada inserimenti e ricerche verso le collection dei tre livelli
 * (nazionale, regionale, comunale).
 * <p>
 * La ricerca gerarchica interroga in parallelo i livelli pertinenti e restituisce
 * l'unione dei risultati, ognuno marcato con {@code hierarchy_level} e
 * {@code context_scope}: nessuna deduplicazione né troncamento globale, così il
 * chiamante vede cosa dice ogni livello. Un livello in errore o in timeout
 * contribuisce zero risultati senza interrompere gli altri.
 */
public class MultiLevelIndexRouter {

    private static final Logger log = LoggerFactory.getLogger(MultiLevelIndexRouter.class);

    public static final String NATIONAL_SCOPE = "Italia";

    private final Map<NormativeLevel, LevelIndexManager> managers;
    private final ExecutorService executor;
    private final Duration tierTimeout;

    /** Ricerca su un livello: collection di destinazione, ambito e filtro sui metadati. */
    private record TierQuery(NormativeLevel level, String scope, Map<String, String> filter) {}

    public MultiLevelIndexRouter(List<LevelIndexManager> managers, ExecutorService executor, Duration tierTimeout) {
        Map<NormativeLevel, LevelIndexManager> byLevel = new EnumMap<>(NormativeLevel.class);
        for (LevelIndexManager manager : managers) {
            byLevel.put(manager.level(), manager);
        }
        if (!byLevel.keySet().containsAll(TierEmbeddingStores.STORE_LEVELS) || byLevel.size() != 3) {
            throw new IllegalArgumentException("Serve esattamente un manager per livello: " + byLevel.keySet());
        }
        this.managers = Collections.unmodifiableMap(byLevel);
        this.executor = executor;
        this.tierTimeout = tierTimeout;
        log.info("Multi-level index inizializzato: {}", byLevel.keySet());
    }

    /** Manager della collection che ospita il livello (il provinciale è nel regionale). */
    public LevelIndexManager manager(NormativeLevel level) {
        return managers.get(level.storeLevel());
    }

    /**
     * Aggiunge chunk alla collection del livello indicato.
     *
     * @throws it.aw.normativerag.exception.ValidationException se il livello non è riconosciuto
     */
    public List<String> addDocuments(List<Chunk> chunks, String level) {
        return manager(NormativeLevel.fromCode(level)).upsert(chunks);
    }

    public int deleteByMetadata(String level, Map<String, String> filter) {
        return manager(NormativeLevel.fromCode(level)).deleteByMetadata(filter);
    }

    public Map<NormativeLevel, StoreStats> stats() {
        Map<NormativeLevel, StoreStats> stats = new EnumMap<>(NormativeLevel.class);
        managers.forEach((level, manager) -> stats.put(level, manager.stats()));
        return stats;
    }

    /**
     * Ricerca gerarchica: il livello nazionale è sempre interrogato, quelli comunale,
     * provinciale e regionale solo se il relativo argomento geografico è presente.
     * <p>
     * L'ordine dei risultati va dal livello più specifico al nazionale
     * (Comunale, Provinciale, Regionale, Nazionale); all'interno di ogni livello
     * resta l'ordine di similarità.
     *
     * @param kPerTier massimo numero di risultati per livello
     */
    public List<Chunk> searchHierarchical(String query, String municipality, String province,
                                          String region, int kPerTier) {
        List<TierQuery> queries = new ArrayList<>(4);
        if (hasText(municipality)) {
            queries.add(new TierQuery(NormativeLevel.COMUNALE, municipality,
                    Map.of(ChunkMetadata.MUNICIPALITY, municipality)));
        }
        if (hasText(province)) {
            queries.add(new TierQuery(NormativeLevel.PROVINCIALE, province,
                    Map.of(ChunkMetadata.PROVINCE, province)));
        }
        if (hasText(region)) {
            queries.add(new TierQuery(NormativeLevel.REGIONALE, region,
                    Map.of(ChunkMetadata.REGION, region)));
        }
        queries.add(new TierQuery(NormativeLevel.NAZIONALE, NATIONAL_SCOPE, Map.of()));

        List<Chunk> results = new ArrayList<>();
        runTierQueries(query, queries, kPerTier).values().forEach(results::addAll);
        log.info("Ricerca gerarchica: {} risultati totali da {} livelli", results.size(), queries.size());
        return results;
    }

    /** Ricerca senza filtri geografici su ciascuna delle tre collection. */
    public Map<NormativeLevel, List<Chunk>> searchAllLevels(String query, int kPerLevel) {
        List<TierQuery> queries = new ArrayList<>();
        for (NormativeLevel level : TierEmbeddingStores.STORE_LEVELS) {
            queries.add(new TierQuery(level, level == NormativeLevel.NAZIONALE ? NATIONAL_SCOPE : null, Map.of()));
        }
        Map<NormativeLevel, List<Chunk>> results = new EnumMap<>(NormativeLevel.class);
        runTierQueries(query, queries, kPerLevel).forEach((q, chunks) -> results.put(q.level(), chunks));
        return results;
    }

    private Map<TierQuery, List<Chunk>> runTierQueries(String query, List<TierQuery> queries, int k) {
        Map<TierQuery, Future<List<Chunk>>> futures = new LinkedHashMap<>();
        for (TierQuery q : queries) {
            try {
                futures.put(q, executor.submit(() -> searchTier(query, q, k)));
            } catch (RejectedExecutionException e) {
                log.warn("Pool di ricerca saturo: livello {} saltato ({})", q.level().label(), e.getMessage());
            }
        }

        Map<TierQuery, List<Chunk>> results = new LinkedHashMap<>();
        queries.forEach(q -> results.put(q, List.of()));
        long deadline = System.nanoTime() + tierTimeout.toNanos();
        for (Map.Entry<TierQuery, Future<List<Chunk>>> entry : futures.entrySet()) {
            String label = entry.getKey().level().label();
            Future<List<Chunk>> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.put(entry.getKey(), future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Ricerca gerarchica interrotta: annullo le ricerche in corso");
                futures.values().forEach(f -> f.cancel(true));
                break;
            } catch (TimeoutException e) {
                log.warn("Ricerca livello {} oltre il timeout di {} ms: nessun risultato", label, tierTimeout.toMillis());
                future.cancel(true);
            } catch (ExecutionException e) {
                log.error("Errore nella ricerca livello {}: {}", label, e.getCause().getMessage(), e.getCause());
            }
        }
        return results;
    }

    private List<Chunk> searchTier(String query, TierQuery q, int k) {
        List<Chunk> found = manager(q.level()).search(query, k, q.filter());
        List<Chunk> tagged = new ArrayList<>(found.size());
        for (Chunk chunk : found) {
            tagged.add(chunk.withMetadata(chunk.metadata().withHierarchy(q.level().label(), q.scope())));
        }
        log.debug("Livello {} ({}): {} risultati", q.level().label(), q.scope(), tagged.size());
        return tagged;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
