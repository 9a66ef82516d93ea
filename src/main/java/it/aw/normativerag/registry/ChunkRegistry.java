package it.aw.normativerag.registry;

import it.aw.normativerag.exception.BackendException;
import it.aw.normativerag.exception.ValidationException;
import it.aw.normativerag.model.Chunk;
import it.aw.normativerag.model.ChunkMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Registro dei chunk indicizzati, persistito nella tabella {@code chunks} di un file DuckDB.
 * <p>
 * Per ogni record dell'embedding store conserva id, collection e i metadati filtrabili
 * in colonne dedicate: consente di enumerare gli id che soddisfano un filtro di
 * uguaglianza (cancellazione per metadati) e di contare i record di una collection,
 * operazioni che l'embedding store non espone.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato perché DuckDBConnection non è thread-safe.
 */
public class ChunkRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChunkRegistry.class);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS chunks (
                chunk_id        VARCHAR   PRIMARY KEY,
                collection      VARCHAR   NOT NULL,
                normative_level VARCHAR,
                region          VARCHAR,
                province        VARCHAR,
                municipality    VARCHAR,
                article         VARCHAR,
                article_part    VARCHAR,
                law_type        VARCHAR,
                law_number      VARCHAR,
                law_year        VARCHAR,
                processed_date  VARCHAR,
                source          VARCHAR
            )
            """;

    private static final String INSERT = """
            INSERT INTO chunks
                (chunk_id, collection, normative_level, region, province, municipality, article,
                 article_part, law_type, law_number, law_year, processed_date, source)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (chunk_id) DO NOTHING
            """;

    private final Connection conn;

    /**
     * Apre (o crea) il registro sul file indicato.
     *
     * @param dbPath file DuckDB; null per un registro in memoria
     */
    public ChunkRegistry(Path dbPath) {
        try {
            String url = "jdbc:duckdb:";
            if (dbPath != null) {
                Path absolute = dbPath.toAbsolutePath();
                Files.createDirectories(absolute.getParent());
                url += absolute;
            }
            conn = DriverManager.getConnection(url);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(CREATE_TABLE);
            }
            log.info("ChunkRegistry: tabella 'chunks' pronta su {}", dbPath != null ? dbPath.toAbsolutePath() : "memoria");
        } catch (SQLException | IOException e) {
            throw new BackendException("init", "registry", "Impossibile aprire il registro DuckDB", e);
        }
    }

    @Override
    public void close() {
        try {
            if (!conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    /** Registra gli id appena inseriti nello store con i metadati dei rispettivi chunk. */
    public synchronized void register(String collection, List<String> ids, List<Chunk> chunks) {
        if (ids.size() != chunks.size()) {
            throw new IllegalArgumentException("ids (" + ids.size() + ") e chunks (" + chunks.size() + ") non allineati");
        }
        try (PreparedStatement ps = conn.prepareStatement(INSERT)) {
            for (int i = 0; i < ids.size(); i++) {
                ChunkMetadata meta = chunks.get(i).metadata();
                ps.setString(1, ids.get(i));
                ps.setString(2, collection);
                int column = 3;
                for (String key : ChunkMetadata.PERSISTED_KEYS) {
                    ps.setString(column++, meta.get(key));
                }
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new BackendException("register", collection, "Errore salvataggio chunk nel registry", e);
        }
    }

    /**
     * Id dei chunk della collection i cui metadati coincidono con tutte le coppie del filtro.
     *
     * @throws ValidationException se il filtro usa una chiave non filtrabile o un valore null
     */
    public synchronized List<String> findIds(String collection, Map<String, String> filter) {
        StringBuilder sql = new StringBuilder("SELECT chunk_id FROM chunks WHERE collection = ?");
        List<String> values = new ArrayList<>();
        values.add(collection);
        for (Map.Entry<String, String> entry : validate(filter).entrySet()) {
            // nome colonna da whitelist: coincide con la chiave di metadato
            sql.append(" AND ").append(entry.getKey()).append(" = ?");
            values.add(entry.getValue());
        }
        sql.append(" ORDER BY chunk_id");

        List<String> ids = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < values.size(); i++) {
                ps.setString(i + 1, values.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) ids.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new BackendException("findIds", collection, "Errore lettura registry", e);
        }
        return ids;
    }

    public synchronized int remove(String collection, List<String> ids) {
        if (ids.isEmpty()) return 0;
        int removed = 0;
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM chunks WHERE collection = ? AND chunk_id = ?")) {
            for (String id : ids) {
                ps.setString(1, collection);
                ps.setString(2, id);
                removed += ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new BackendException("remove", collection, "Errore rimozione chunk dal registry", e);
        }
        return removed;
    }

    public synchronized int count(String collection) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM chunks WHERE collection = ?")) {
            ps.setString(1, collection);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new BackendException("count", collection, "Errore conteggio chunk", e);
        }
    }

    /** Verifica che il filtro usi solo chiavi persistite e valori non null. */
    public static Map<String, String> validate(Map<String, String> filter) {
        if (filter == null) return Map.of();
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (!ChunkMetadata.PERSISTED_KEYS.contains(entry.getKey())) {
                throw new ValidationException("Chiave di filtro non supportata: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new ValidationException("Valore null nel filtro per la chiave " + entry.getKey());
            }
        }
        return filter;
    }
}
