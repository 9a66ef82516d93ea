package it.aw.normativerag.config;

import it.aw.normativerag.index.MultiLevelIndexRouter;
import it.aw.normativerag.index.TierEmbeddingStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;

/**
 * Salva su disco le collection allo shutdown dell'applicazione.
 * <p>
 * Il caricamento all'avvio è delegato a LangChain4jConfig.tierEmbeddingStores();
 * il registry DuckDB è persistente di suo.
 */
@Component
public class StoreLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);

    private final TierEmbeddingStores stores;
    private final MultiLevelIndexRouter router;

    public StoreLifecycle(TierEmbeddingStores stores, MultiLevelIndexRouter router) {
        this.stores = stores;
        this.router = router;
    }

    @PreDestroy
    public void save() {
        log.info("Shutdown: salvataggio delle collection su disco...");
        router.stats().values().forEach(s ->
                log.info("{}: {} chunk (modello {})", s.collectionName(), s.totalChunks(), s.embeddingModel()));
        stores.saveAll();
    }
}
