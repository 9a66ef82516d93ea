package it.aw.normativerag.index;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.normativerag.model.NormativeLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Un {@link InMemoryEmbeddingStore} per collection, persistito su file JSON
 * ({@code <dir>/normative_<livello>.json}).
 * All'avvio carica i file esistenti, altrimenti parte da zero; il salvataggio
 * avviene allo shutdown tramite StoreLifecycle.
 */
public class TierEmbeddingStores {

    private static final Logger log = LoggerFactory.getLogger(TierEmbeddingStores.class);

    public static final List<NormativeLevel> STORE_LEVELS =
            List.of(NormativeLevel.NAZIONALE, NormativeLevel.REGIONALE, NormativeLevel.COMUNALE);

    private final Path directory;
    private final Map<NormativeLevel, InMemoryEmbeddingStore<TextSegment>> stores;

    private TierEmbeddingStores(Path directory, Map<NormativeLevel, InMemoryEmbeddingStore<TextSegment>> stores) {
        this.directory = directory;
        this.stores = Collections.unmodifiableMap(stores);
    }

    public static TierEmbeddingStores load(Path directory) {
        Map<NormativeLevel, InMemoryEmbeddingStore<TextSegment>> stores = new EnumMap<>(NormativeLevel.class);
        for (NormativeLevel level : STORE_LEVELS) {
            Path file = fileFor(directory, level);
            if (Files.exists(file)) {
                log.info("EmbeddingStore {}: caricamento da file {}", level.collectionName(), file.toAbsolutePath());
                stores.put(level, InMemoryEmbeddingStore.fromFile(file));
            } else {
                log.info("EmbeddingStore {}: file {} non trovato, partenza da zero.",
                        level.collectionName(), file.toAbsolutePath());
                stores.put(level, new InMemoryEmbeddingStore<>());
            }
        }
        return new TierEmbeddingStores(directory, stores);
    }

    public InMemoryEmbeddingStore<TextSegment> get(NormativeLevel level) {
        return stores.get(level.storeLevel());
    }

    /** Serializza ogni collection nel proprio file; un errore su una non blocca le altre. */
    public void saveAll() {
        for (Map.Entry<NormativeLevel, InMemoryEmbeddingStore<TextSegment>> entry : stores.entrySet()) {
            Path file = fileFor(directory, entry.getKey());
            try {
                Files.createDirectories(file.toAbsolutePath().getParent());
                entry.getValue().serializeToFile(file);
                log.info("EmbeddingStore salvato: {}", file.toAbsolutePath());
            } catch (IOException | RuntimeException e) {
                log.error("Impossibile salvare l'EmbeddingStore su {}: {}", file.toAbsolutePath(), e.getMessage());
            }
        }
    }

    static Path fileFor(Path directory, NormativeLevel level) {
        return directory.resolve(level.collectionName() + ".json");
    }
}
