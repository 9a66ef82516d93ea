package it.aw.normativerag.processing;

import it.aw.normativerag.exception.FormatException;
import it.aw.normativerag.exception.LoadException;
import it.aw.normativerag.model.NormativeLevel;
import it.aw.normativerag.model.RegulatoryDocument;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Carica il testo di un documento normativo da file.
 * <p>
 * Formati supportati: PDF con layer testuale (PDFBox, pagina per pagina),
 * HTML (jsoup, testo del body), testo UTF-8.
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("pdf", "html", "htm", "txt");

    public RegulatoryDocument load(Path file, NormativeLevel level,
                                   String region, String province, String municipality) {
        String text = readText(file);
        return new RegulatoryDocument(text, file.getFileName().toString(), level, region, province, municipality);
    }

    /**
     * Estrae il testo del file.
     *
     * @throws FormatException se l'estensione non è supportata
     * @throws LoadException   per errori di I/O o documenti senza testo estraibile
     */
    public String readText(Path file) {
        String filename = file.getFileName().toString();
        String extension = extensionOf(filename);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new FormatException("Formato file non supportato: " + filename);
        }
        log.info("Caricamento documento: {}", file);

        String text;
        try {
            text = switch (extension) {
                case "pdf" -> readPdf(file);
                case "html", "htm" -> readHtml(file);
                default -> Files.readString(file, StandardCharsets.UTF_8);
            };
        } catch (IOException e) {
            throw new LoadException(filename, "Errore nel caricamento di " + filename + ": " + e.getMessage(), e);
        }
        if (text.isBlank()) {
            throw new LoadException(filename, "Nessun testo estraibile da " + filename, null);
        }
        return text;
    }

    public static boolean isSupported(Path file) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(file.getFileName().toString()));
    }

    private String readPdf(Path file) throws IOException {
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            int totalPages = doc.getNumberOfPages();
            log.debug("{}: {} pagine trovate", file.getFileName(), totalPages);

            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder sb = new StringBuilder();
            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                sb.append(stripper.getText(doc)).append('\n');
            }
            return sb.toString();
        }
    }

    private String readHtml(Path file) throws IOException {
        org.jsoup.nodes.Document html = Jsoup.parse(file.toFile(), StandardCharsets.UTF_8.name());
        Element body = html.body();
        return body != null ? body.wholeText() : html.text();
    }

    private static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
