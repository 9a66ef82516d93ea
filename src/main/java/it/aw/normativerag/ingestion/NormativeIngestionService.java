package it.aw.normativerag.ingestion;

import it.aw.normativerag.config.NormativeRagProperties;
import it.aw.normativerag.exception.LoadException;
import it.aw.normativerag.index.MultiLevelIndexRouter;
import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import it.aw.normativerag.model.IngestionReport;
import it.aw.normativerag.model.IngestionRequest;
import it.aw.normativerag.model.IngestionResult;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.processing.DocumentLoader;
import it.aw.normativerag.processing.NormativeDocumentProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Gestisce l'ingestione dei documenti normativi nelle collection per livello.
 * <p>
 * Pipeline per file:
 * <ol>
 *   <li>Processing: caricamento, normalizzazione, chunking per articoli, metadati</li>
 *   <li>Supersede: rimuove dalla collection i chunk dello stesso documento, cioè stesso
 *       {@code source} e stessa regione, provincia e comune</li>
 *   <li>Upsert nella collection del livello (il provinciale finisce nel regionale)</li>
 * </ol>
 * Se il caricamento fallisce la versione precedente resta indicizzata.
 */
public class NormativeIngestionService {

    private static final Logger log = LoggerFactory.getLogger(NormativeIngestionService.class);

    static final String NATIONAL_DIR  = "nazionale";
    static final String REGIONAL_DIR  = "regionale";
    static final String MUNICIPAL_DIR = "comunale";

    private final NormativeDocumentProcessor processor;
    private final MultiLevelIndexRouter router;
    private final NormativeRagProperties.Library library;

    public NormativeIngestionService(NormativeDocumentProcessor processor,
                                     MultiLevelIndexRouter router,
                                     NormativeRagProperties.Library library) {
        this.processor = processor;
        this.router = router;
        this.library = library;
    }

    /**
     * Indicizza un file sostituendo eventuali chunk precedenti dello stesso file.
     *
     * @throws it.aw.normativerag.exception.NormativeException se caricamento, processing o upsert falliscono
     */
    public IngestionResult ingestFile(Path file, NormativeLevel level,
                                      String region, String province, String municipality) {
        String source = file.getFileName().toString();
        String storeLevel = level.storeLevel().code();
        log.info("Inizio ingestione: {} (livello={}, regione={}, provincia={}, comune={})",
                source, level.code(), region, province, municipality);

        List<Chunk> chunks = processor.processFile(file, level, region, province, municipality);

        int superseded = router.deleteByMetadata(storeLevel, documentFilter(source, region, province, municipality));
        if (superseded > 0) {
            log.info("Rimossi {} chunk della versione precedente di {}", superseded, source);
        }
        List<String> ids = router.addDocuments(chunks, storeLevel);

        log.info("Ingestione completata: {} - {} chunk in {}", source, ids.size(), level.collectionName());
        return new IngestionResult(source, level.code(), level.collectionName(), LocalDateTime.now(),
                ids.size(), superseded, List.copyOf(ids), null);
    }

    /** Filtro che identifica un documento: nome del file più la geografia valorizzata. */
    static Map<String, String> documentFilter(String source, String region, String province, String municipality) {
        Map<String, String> filter = new LinkedHashMap<>();
        filter.put(ChunkMetadata.SOURCE, source);
        if (region != null) filter.put(ChunkMetadata.REGION, region);
        if (province != null) filter.put(ChunkMetadata.PROVINCE, province);
        if (municipality != null) filter.put(ChunkMetadata.MUNICIPALITY, municipality);
        return filter;
    }

    public IngestionResult ingest(IngestionRequest request) {
        return ingestFile(request.file(), request.level(),
                request.region(), request.province(), request.municipality());
    }

    /**
     * Indicizza più file; l'errore su un documento viene registrato nel report
     * e non interrompe i successivi.
     */
    public IngestionReport ingestFiles(List<IngestionRequest> requests) {
        List<IngestionResult> results = new ArrayList<>(requests.size());
        for (IngestionRequest request : requests) {
            try {
                results.add(ingest(request));
            } catch (RuntimeException e) {
                String source = request.file().getFileName().toString();
                log.error("Errore su {}: {}", source, e.getMessage());
                results.add(IngestionResult.failed(source, request.level().code(),
                        request.level().collectionName(), e.getMessage()));
            }
        }
        IngestionReport report = new IngestionReport(results);
        log.info("Ingestione di {} documenti: {} riusciti, {} falliti, {} chunk totali",
                results.size(), report.succeeded(), report.failed(), report.totalChunks());
        return report;
    }

    /** Indicizza tutti i file supportati (pdf, html, htm, txt) della directory. */
    public IngestionReport ingestDirectory(Path directory, NormativeLevel level,
                                           String region, String province, String municipality,
                                           boolean recursive) {
        List<IngestionRequest> requests = listSupported(directory, recursive).stream()
                .map(file -> new IngestionRequest(file, level, region, province, municipality))
                .collect(Collectors.toList());
        log.info("Trovati {} file in {}", requests.size(), directory);
        return ingestFiles(requests);
    }

    /**
     * Importa una libreria normativa organizzata per livello:
     * <pre>
     * root/nazionale/*            livello nazionale
     * root/regionale/*            regione di default
     * root/comunale/*             comunale senza comune
     * root/comunale/&lt;Comune&gt;/*   comunale del comune indicato dalla cartella
     * </pre>
     * Le directory mancanti vengono saltate.
     */
    public IngestionReport ingestLibrary(Path root) {
        log.info("Avvio importazione libreria normativa da {}", root.toAbsolutePath());
        String region = library.getDefaultRegion();
        List<IngestionRequest> requests = new ArrayList<>();

        for (Path file : listLevelDir(root.resolve(NATIONAL_DIR))) {
            requests.add(IngestionRequest.national(file));
        }
        for (Path file : listLevelDir(root.resolve(REGIONAL_DIR))) {
            requests.add(new IngestionRequest(file, NormativeLevel.REGIONALE, region, null, null));
        }
        Path municipal = root.resolve(MUNICIPAL_DIR);
        for (Path file : listLevelDir(municipal)) {
            requests.add(new IngestionRequest(file, NormativeLevel.COMUNALE, region, null, null));
        }
        for (Path dir : subdirectories(municipal)) {
            String municipality = dir.getFileName().toString();
            for (Path file : listSupported(dir, false)) {
                requests.add(new IngestionRequest(file, NormativeLevel.COMUNALE, region, null, municipality));
            }
        }

        IngestionReport report = ingestFiles(requests);
        log.info("Importazione completata. Totale file processati: {}", report.succeeded());
        return report;
    }

    private List<Path> listLevelDir(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.warn("Directory non trovata: {}", dir);
            return List.of();
        }
        return listSupported(dir, false);
    }

    private static List<Path> subdirectories(Path dir) {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new LoadException(dir.toString(), "Impossibile leggere la directory " + dir, e);
        }
    }

    private static List<Path> listSupported(Path dir, boolean recursive) {
        try (Stream<Path> entries = recursive ? Files.walk(dir) : Files.list(dir)) {
            return entries.filter(Files::isRegularFile)
                    .filter(DocumentLoader::isSupported)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new LoadException(dir.toString(), "Impossibile leggere la directory " + dir, e);
        }
    }
}
