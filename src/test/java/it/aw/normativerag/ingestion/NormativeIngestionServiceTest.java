package it.aw.normativerag.ingestion;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import it.aw.normativerag.config.NormativeRagProperties;
import it.aw.normativerag.exception.LoadException;
import it.aw.normativerag.index.LevelIndexManager;
import it.aw.normativerag.index.MultiLevelIndexRouter;
import it.aw.normativerag.index.TierEmbeddingStores;
import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import it.aw.normativerag.model.ChunkingParams;
import it.aw.normativerag.model.IngestionReport;
import it.aw.normativerag.model.IngestionRequest;
import it.aw.normativerag.model.IngestionResult;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.processing.DocumentLoader;
import it.aw.normativerag.processing.NormativeDocumentProcessor;
import it.aw.normativerag.registry.ChunkRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormativeIngestionServiceTest {

    private static final String NTA = """
            Norme tecniche di attuazione del piano regolatore.
            Art. 1 Ambito di applicazione. Le presenti norme si applicano all'intero territorio comunale.
            Art. 2 Distanze. La distanza minima dai confini è di cinque metri.
            Art. 3 Altezze. L'altezza massima degli edifici è di 7,50 metri.
            """;

    @TempDir
    Path dir;

    private ExecutorService executor;
    private ChunkRegistry registry;
    private MultiLevelIndexRouter router;
    private NormativeIngestionService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new ChunkRegistry(null);
        List<LevelIndexManager> managers = new ArrayList<>();
        for (NormativeLevel level : TierEmbeddingStores.STORE_LEVELS) {
            managers.add(new LevelIndexManager(level, null, "test", new InMemoryEmbeddingStore<TextSegment>(),
                    registry, 100, 8));
        }
        router = new MultiLevelIndexRouter(managers, executor, Duration.ofSeconds(5));
        NormativeDocumentProcessor processor = new NormativeDocumentProcessor(
                ChunkingParams.defaults(), true, new DocumentLoader(), Clock.systemUTC());
        service = new NormativeIngestionService(processor, router, new NormativeRagProperties.Library());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        registry.close();
    }

    @Test
    void ingestFileIndexesArticlesInTierCollection() throws IOException {
        Path file = Files.writeString(dir.resolve("nta_tarquinia.txt"), NTA);

        IngestionResult result = service.ingestFile(file, NormativeLevel.COMUNALE, "Lazio", null, "Tarquinia");

        assertThat(result.succeeded()).isTrue();
        assertThat(result.collection()).isEqualTo("normative_comunale");
        assertThat(result.chunkCount()).isEqualTo(4);
        assertThat(result.chunkIds()).hasSize(4);
        assertThat(result.supersededChunks()).isZero();
        List<Chunk> found = router.manager(NormativeLevel.COMUNALE)
                .search("distanze", 10, Map.of(ChunkMetadata.MUNICIPALITY, "Tarquinia"));
        assertThat(found).hasSize(4);
    }

    @Test
    void reIngestionSupersedesPreviousVersion() throws IOException {
        Path file = Files.writeString(dir.resolve("nta_tarquinia.txt"), NTA);
        service.ingestFile(file, NormativeLevel.COMUNALE, "Lazio", null, "Tarquinia");

        Files.writeString(file, NTA + "Art. 4 Recinzioni. Altezza massima due metri.\n");
        IngestionResult second = service.ingestFile(file, NormativeLevel.COMUNALE, "Lazio", null, "Tarquinia");

        assertThat(second.supersededChunks()).isEqualTo(4);
        assertThat(second.chunkCount()).isEqualTo(5);
        assertThat(router.stats().get(NormativeLevel.COMUNALE).totalChunks()).isEqualTo(5);
    }

    @Test
    void sameFileNameInTwoMunicipalitiesDoesNotSupersede() throws IOException {
        Path tarquinia = Files.writeString(
                Files.createDirectories(dir.resolve("Tarquinia")).resolve("regolamento.txt"), NTA);
        Path montalto = Files.writeString(
                Files.createDirectories(dir.resolve("Montalto")).resolve("regolamento.txt"), NTA);

        service.ingestFile(tarquinia, NormativeLevel.COMUNALE, "Lazio", "Viterbo", "Tarquinia");
        IngestionResult second = service.ingestFile(montalto, NormativeLevel.COMUNALE, "Lazio", "Viterbo", "Montalto");

        assertThat(second.supersededChunks()).isZero();
        assertThat(router.manager(NormativeLevel.COMUNALE)
                .search("distanze", 10, Map.of(ChunkMetadata.MUNICIPALITY, "Tarquinia"))).hasSize(4);
        assertThat(router.manager(NormativeLevel.COMUNALE)
                .search("distanze", 10, Map.of(ChunkMetadata.MUNICIPALITY, "Montalto"))).hasSize(4);
        assertThat(router.stats().get(NormativeLevel.COMUNALE).totalChunks()).isEqualTo(8);
    }

    @Test
    void failedReloadKeepsPreviousVersion() throws IOException {
        Path file = Files.writeString(dir.resolve("dpr380.txt"), NTA);
        service.ingestFile(file, NormativeLevel.NAZIONALE, null, null, null);

        Files.writeString(file, "   \n");

        assertThatThrownBy(() -> service.ingestFile(file, NormativeLevel.NAZIONALE, null, null, null))
                .isInstanceOf(LoadException.class);
        assertThat(router.stats().get(NormativeLevel.NAZIONALE).totalChunks()).isEqualTo(4);
        assertThat(router.manager(NormativeLevel.NAZIONALE)
                .search("distanze", 10, Map.of(ChunkMetadata.SOURCE, "dpr380.txt"))).hasSize(4);
    }

    @Test
    void documentFilterIncludesOnlyKnownGeography() {
        assertThat(NormativeIngestionService.documentFilter("nta.txt", "Lazio", null, "Tarquinia"))
                .containsExactly(
                        Map.entry(ChunkMetadata.SOURCE, "nta.txt"),
                        Map.entry(ChunkMetadata.REGION, "Lazio"),
                        Map.entry(ChunkMetadata.MUNICIPALITY, "Tarquinia"));
        assertThat(NormativeIngestionService.documentFilter("dpr380.txt", null, null, null))
                .containsOnlyKeys(ChunkMetadata.SOURCE);
    }

    @Test
    void provincialDocumentGoesToRegionalCollection() throws IOException {
        Path file = Files.writeString(dir.resolve("ptpg_viterbo.txt"), NTA);

        IngestionResult result = service.ingestFile(file, NormativeLevel.PROVINCIALE, "Lazio", "Viterbo", null);

        assertThat(result.collection()).isEqualTo("normative_regionale");
        assertThat(router.manager(NormativeLevel.REGIONALE)
                .search("distanze", 10, Map.of(ChunkMetadata.PROVINCE, "Viterbo"))).hasSize(4);
    }

    @Test
    void failingDocumentDoesNotStopTheBatch() throws IOException {
        Path good = Files.writeString(dir.resolve("dpr380.txt"), NTA);
        Path unsupported = Files.writeString(dir.resolve("tavola.dwg"), "binario");
        Path missing = dir.resolve("mancante.pdf");
        Path other = Files.writeString(dir.resolve("dm1444.txt"), NTA);

        IngestionReport report = service.ingestFiles(List.of(
                IngestionRequest.national(good), IngestionRequest.national(unsupported),
                IngestionRequest.national(missing), IngestionRequest.national(other)));

        assertThat(report.results()).extracting(IngestionResult::source)
                .containsExactly("dpr380.txt", "tavola.dwg", "mancante.pdf", "dm1444.txt");
        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(report.failed()).isEqualTo(2);
        assertThat(report.totalChunks()).isEqualTo(8);
        assertThat(report.results().get(1).error()).contains("tavola.dwg");
        assertThat(report.results().get(1).chunkIds()).isEmpty();
    }

    @Test
    void ingestDirectoryPicksSupportedFiles() throws IOException {
        Files.writeString(dir.resolve("a.txt"), NTA);
        Files.writeString(dir.resolve("note.md"), "# appunti");
        Path nested = Files.createDirectories(dir.resolve("allegati"));
        Files.writeString(nested.resolve("b.html"), "<html><body><p>Art. 1 Testo. Art. 2 Altro testo.</p></body></html>");

        IngestionReport flat = service.ingestDirectory(dir, NormativeLevel.NAZIONALE, null, null, null, false);
        IngestionReport recursive = service.ingestDirectory(dir, NormativeLevel.NAZIONALE, null, null, null, true);

        assertThat(flat.results()).extracting(IngestionResult::source).containsExactly("a.txt");
        assertThat(recursive.results()).extracting(IngestionResult::source).containsExactlyInAnyOrder("a.txt", "b.html");
    }

    @Test
    void ingestLibraryFollowsDirectoryLayout() throws IOException {
        Files.writeString(Files.createDirectories(dir.resolve("nazionale")).resolve("dpr380.txt"), NTA);
        Files.writeString(Files.createDirectories(dir.resolve("regionale")).resolve("lr38.txt"), NTA);
        Path comunale = Files.createDirectories(dir.resolve("comunale"));
        Files.writeString(comunale.resolve("generale.txt"), NTA);
        Files.writeString(Files.createDirectories(comunale.resolve("Tarquinia")).resolve("nta.txt"), NTA);

        IngestionReport report = service.ingestLibrary(dir);

        assertThat(report.succeeded()).isEqualTo(4);
        assertThat(report.results()).extracting(IngestionResult::collection).containsExactly(
                "normative_nazionale", "normative_regionale", "normative_comunale", "normative_comunale");
        assertThat(router.manager(NormativeLevel.REGIONALE)
                .search("distanze", 10, Map.of(ChunkMetadata.REGION, "Lazio"))).hasSize(4);
        assertThat(router.manager(NormativeLevel.COMUNALE)
                .search("distanze", 10, Map.of(ChunkMetadata.MUNICIPALITY, "Tarquinia"))).hasSize(4);
    }

    @Test
    void missingLibraryDirectoriesAreSkipped() {
        IngestionReport report = service.ingestLibrary(dir.resolve("vuota"));

        assertThat(report.results()).isEmpty();
    }
}
