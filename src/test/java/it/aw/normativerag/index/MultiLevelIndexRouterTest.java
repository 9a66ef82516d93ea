package it.aw.normativerag.index;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.normativerag.exception.BackendException;
import it.aw.normativerag.exception.ValidationException;
import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.registry.ChunkRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MultiLevelIndexRouterTest {

    private ExecutorService executor;
    private ChunkRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new ChunkRegistry(null);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        registry.close();
    }

    @Test
    void hierarchicalSearchReturnsTaggedUnionFromMostSpecificTier() {
        MultiLevelIndexRouter router = realRouter(Duration.ofSeconds(5));
        router.addDocuments(chunks(2, "comunale", "Lazio", null, "Tarquinia"), "comunale");
        router.addDocuments(chunks(2, "regionale", "Lazio", null, null), "regionale");
        router.addDocuments(chunks(2, "nazionale", null, null, null), "nazionale");

        List<Chunk> results = router.searchHierarchical("distanze dai confini", "Tarquinia", null, "Lazio", 5);

        assertThat(results).hasSize(6);
        assertThat(results).extracting(c -> c.metadata().hierarchyLevel(), c -> c.metadata().contextScope())
                .containsExactly(
                        tuple("Comunale", "Tarquinia"), tuple("Comunale", "Tarquinia"),
                        tuple("Regionale", "Lazio"), tuple("Regionale", "Lazio"),
                        tuple("Nazionale", "Italia"), tuple("Nazionale", "Italia"));
    }

    @Test
    void onlyNationalTierWithoutLocation() {
        MultiLevelIndexRouter router = realRouter(Duration.ofSeconds(5));
        router.addDocuments(chunks(2, "comunale", "Lazio", null, "Tarquinia"), "comunale");
        router.addDocuments(chunks(1, "nazionale", null, null, null), "nazionale");

        List<Chunk> results = router.searchHierarchical("distanze", null, null, null, 5);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).metadata().hierarchyLevel()).isEqualTo("Nazionale");
    }

    @Test
    void provincialTierSearchesRegionalCollectionByProvince() {
        MultiLevelIndexRouter router = realRouter(Duration.ofSeconds(5));
        router.addDocuments(chunks(1, "regionale", "Lazio", "Viterbo", null), "provinciale");
        router.addDocuments(chunks(1, "regionale", "Lazio", "Roma", null), "regionale");

        List<Chunk> results = router.searchHierarchical("distanze", null, "Viterbo", null, 5);

        assertThat(results).extracting(c -> c.metadata().hierarchyLevel(), c -> c.metadata().province())
                .containsExactly(tuple("Provinciale", "Viterbo"));
    }

    @Test
    void failingTierIsIsolated() {
        LevelIndexManager comunale = mockManager(NormativeLevel.COMUNALE);
        LevelIndexManager regionale = mockManager(NormativeLevel.REGIONALE);
        LevelIndexManager nazionale = mockManager(NormativeLevel.NAZIONALE);
        when(comunale.search(anyString(), anyInt(), anyMap()))
                .thenThrow(new BackendException("search", "normative_comunale", "store non raggiungibile", null));
        when(regionale.search(anyString(), anyInt(), anyMap())).thenReturn(chunks(2, "regionale", "Lazio", null, null));
        when(nazionale.search(anyString(), anyInt(), anyMap())).thenReturn(chunks(1, "nazionale", null, null, null));
        MultiLevelIndexRouter router =
                new MultiLevelIndexRouter(List.of(comunale, regionale, nazionale), executor, Duration.ofSeconds(5));

        List<Chunk> results = router.searchHierarchical("altezze", "Tarquinia", null, "Lazio", 3);

        assertThat(results).extracting(c -> c.metadata().hierarchyLevel())
                .containsExactly("Regionale", "Regionale", "Nazionale");
    }

    @Test
    void slowTierIsDroppedAfterTimeout() {
        LevelIndexManager comunale = mockManager(NormativeLevel.COMUNALE);
        LevelIndexManager regionale = mockManager(NormativeLevel.REGIONALE);
        LevelIndexManager nazionale = mockManager(NormativeLevel.NAZIONALE);
        when(comunale.search(anyString(), anyInt(), anyMap())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return chunks(1, "comunale", "Lazio", null, "Tarquinia");
        });
        when(nazionale.search(anyString(), anyInt(), anyMap())).thenReturn(chunks(2, "nazionale", null, null, null));
        MultiLevelIndexRouter router =
                new MultiLevelIndexRouter(List.of(comunale, regionale, nazionale), executor, Duration.ofMillis(300));

        long start = System.nanoTime();
        List<Chunk> results = router.searchHierarchical("altezze", "Tarquinia", null, null, 3);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(results).extracting(c -> c.metadata().hierarchyLevel()).containsExactly("Nazionale", "Nazionale");
        assertThat(elapsedMillis).isLessThan(3_000);
    }

    @Test
    void searchAllLevelsReturnsOneEntryPerCollection() {
        MultiLevelIndexRouter router = realRouter(Duration.ofSeconds(5));
        router.addDocuments(chunks(2, "comunale", "Lazio", null, "Tarquinia"), "comunale");
        router.addDocuments(chunks(1, "nazionale", null, null, null), "nazionale");

        Map<NormativeLevel, List<Chunk>> results = router.searchAllLevels("distanze", 5);

        assertThat(results).containsOnlyKeys(NormativeLevel.NAZIONALE, NormativeLevel.REGIONALE, NormativeLevel.COMUNALE);
        assertThat(results.get(NormativeLevel.COMUNALE)).hasSize(2);
        assertThat(results.get(NormativeLevel.REGIONALE)).isEmpty();
        assertThat(results.get(NormativeLevel.NAZIONALE)).hasSize(1);
    }

    @Test
    void deleteAndStatsPerCollection() {
        MultiLevelIndexRouter router = realRouter(Duration.ofSeconds(5));
        router.addDocuments(chunks(3, "comunale", "Lazio", null, "Tarquinia"), "comunale");

        assertThat(router.stats().get(NormativeLevel.COMUNALE).totalChunks()).isEqualTo(3);
        assertThat(router.deleteByMetadata("comunale", Map.of(ChunkMetadata.MUNICIPALITY, "Tarquinia"))).isEqualTo(3);
        assertThat(router.stats().get(NormativeLevel.COMUNALE).totalChunks()).isZero();
    }

    @Test
    void unknownTierIsRejected() {
        MultiLevelIndexRouter router = realRouter(Duration.ofSeconds(5));

        assertThatThrownBy(() -> router.addDocuments(chunks(1, "europeo", null, null, null), "europeo"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void requiresOneManagerPerCollection() {
        LevelIndexManager nazionale = mockManager(NormativeLevel.NAZIONALE);

        assertThatThrownBy(() -> new MultiLevelIndexRouter(List.of(nazionale), executor, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private MultiLevelIndexRouter realRouter(Duration timeout) {
        List<LevelIndexManager> managers = new ArrayList<>();
        for (NormativeLevel level : TierEmbeddingStores.STORE_LEVELS) {
            managers.add(new LevelIndexManager(level, null, "test", new InMemoryEmbeddingStore<TextSegment>(),
                    registry, 100, 8));
        }
        return new MultiLevelIndexRouter(managers, executor, timeout);
    }

    private static LevelIndexManager mockManager(NormativeLevel level) {
        LevelIndexManager manager = mock(LevelIndexManager.class);
        when(manager.level()).thenReturn(level);
        return manager;
    }

    private static List<Chunk> chunks(int n, String level, String region, String province, String municipality) {
        List<Chunk> chunks = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            chunks.add(new Chunk("Articolo " + i + " Le distanze dai confini (" + level + ")",
                    ChunkMetadata.builder()
                            .normativeLevel(level)
                            .region(region)
                            .province(province)
                            .municipality(municipality)
                            .article(String.valueOf(i))
                            .build()));
        }
        return chunks;
    }
}
