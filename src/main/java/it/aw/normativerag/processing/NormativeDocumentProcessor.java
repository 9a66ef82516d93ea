package it.aw.normativerag.processing;

import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import it.aw.normativerag.model.ChunkingParams;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.model.RegulatoryDocument;
import it.aw.normativerag.processing.ArticleDetector.ArticleHeading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Trasforma un documento normativo in chunk pronti per l'indicizzazione.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Normalizzazione: TextNormalizer (whitespace, "art.", "comma", byte nulli)</li>
 *   <li>Chunking per articoli: ArticleDetector individua le intestazioni; ogni articolo
 *       è un chunk, quelli oltre {@code chunkSize * overflowFactor} vengono suddivisi
 *       in parti numerate ({@code article_part})</li>
 *   <li>Fallback: con meno di due articoli riconosciuti si usa lo splitter a finestra</li>
 *   <li>Metadata enrichment: livello, geografia, articolo, citazione di legge, data</li>
 * </ol>
 * Non scrive nello store: restituisce solo i chunk.
 */
public class NormativeDocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(NormativeDocumentProcessor.class);

    private final ChunkingParams params;
    private final boolean preserveArticles;
    private final DocumentLoader loader;
    private final SeparatorHierarchySplitter windowSplitter;
    private final SeparatorHierarchySplitter articlePartSplitter;
    private final Clock clock;

    public NormativeDocumentProcessor(ChunkingParams params, boolean preserveArticles,
                                      DocumentLoader loader, Clock clock) {
        this.params = params;
        this.preserveArticles = preserveArticles;
        this.loader = loader;
        this.clock = clock;
        this.windowSplitter = new SeparatorHierarchySplitter(params);
        // le parti di uno stesso articolo non si sovrappongono: concatenate ridanno l'articolo
        this.articlePartSplitter = new SeparatorHierarchySplitter(params.withoutOverlap());
    }

    /** Carica il file ed esegue {@link #process(RegulatoryDocument)}. */
    public List<Chunk> processFile(Path file, NormativeLevel level,
                                   String region, String province, String municipality) {
        log.info("Inizio processing di {}", file.getFileName());
        return process(loader.load(file, level, region, province, municipality));
    }

    public List<Chunk> process(String text, NormativeLevel level,
                               String region, String province, String municipality) {
        return process(new RegulatoryDocument(text, null, level, region, province, municipality));
    }

    public List<Chunk> process(RegulatoryDocument document) {
        String text = TextNormalizer.normalize(document.text());
        ChunkMetadata base = ChunkMetadata.builder()
                .normativeLevel(document.level().storeLevel().code())
                .region(document.region())
                .province(document.province())
                .municipality(document.municipality())
                .processedDate(LocalDateTime.now(clock).toString())
                .source(document.source())
                .build();

        List<Chunk> chunks = preserveArticles ? splitByArticles(text, base) : List.of();
        if (!chunks.isEmpty()) {
            log.info("Documento {} diviso in {} chunk per articoli", document.source(), chunks.size());
            return chunks;
        }

        chunks = new ArrayList<>();
        for (String piece : windowSplitter.splitText(text)) {
            chunks.add(new Chunk(piece, LegalMetadataExtractor.enrich(piece, base)));
        }
        log.info("Documento {} diviso in {} chunk standard", document.source(), chunks.size());
        return chunks;
    }

    /**
     * Un chunk per articolo; lista vuota se il testo contiene meno di due intestazioni.
     * Il testo che precede il primo articolo (intestazione, preambolo) forma un chunk a sé.
     */
    List<Chunk> splitByArticles(String text, ChunkMetadata base) {
        List<ArticleHeading> headings = ArticleDetector.detect(text);
        if (headings.size() < 2) {
            log.debug("Articoli riconosciuti: {}, uso chunking standard", headings.size());
            return List.of();
        }

        List<Chunk> chunks = new ArrayList<>();
        String preamble = text.substring(0, headings.get(0).offset()).strip();
        if (!preamble.isEmpty()) {
            addSpan(chunks, preamble, base);
        }
        for (int i = 0; i < headings.size(); i++) {
            int start = headings.get(i).offset();
            int end = i + 1 < headings.size() ? headings.get(i + 1).offset() : text.length();
            addSpan(chunks, text.substring(start, end).strip(), base);
        }
        return chunks;
    }

    private void addSpan(List<Chunk> chunks, String span, ChunkMetadata base) {
        ChunkMetadata metadata = LegalMetadataExtractor.enrich(span, base);
        if (span.length() <= params.maxArticleLength()) {
            chunks.add(new Chunk(span, metadata));
            return;
        }
        List<String> parts = articlePartSplitter.splitText(span);
        log.debug("Articolo {} oltre {} caratteri: {} parti", metadata.article(),
                params.maxArticleLength(), parts.size());
        for (int j = 0; j < parts.size(); j++) {
            chunks.add(new Chunk(parts.get(j), metadata.toBuilder().articlePart(j + 1).build()));
        }
    }
}
