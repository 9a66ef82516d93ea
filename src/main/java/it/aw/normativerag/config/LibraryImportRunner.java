package it.aw.normativerag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.normativerag.ingestion.NormativeIngestionService;
import it.aw.normativerag.model.IngestionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Importa la libreria normativa all'avvio ({@code normative.library.import-on-startup=true})
 * e, se configurato, scrive il report JSON dell'importazione.
 */
@Component
@ConditionalOnProperty(prefix = "normative.library", name = "import-on-startup", havingValue = "true")
public class LibraryImportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(LibraryImportRunner.class);

    private final NormativeIngestionService ingestionService;
    private final NormativeRagProperties properties;
    private final ObjectMapper objectMapper;

    public LibraryImportRunner(NormativeIngestionService ingestionService,
                               NormativeRagProperties properties,
                               ObjectMapper objectMapper) {
        this.ingestionService = ingestionService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        NormativeRagProperties.Library library = properties.getLibrary();
        IngestionReport report = ingestionService.ingestLibrary(Paths.get(library.getPath()));
        if (library.getReportFile() != null && !library.getReportFile().isBlank()) {
            writeReport(Paths.get(library.getReportFile()), report);
        }
    }

    void writeReport(Path path, IngestionReport report) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), report);
            log.info("Report di importazione salvato: {}", path.toAbsolutePath());
        } catch (IOException e) {
            log.error("Impossibile salvare il report su {}: {}", path.toAbsolutePath(), e.getMessage());
        }
    }
}
