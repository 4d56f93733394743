package it.aw.hybridsearch.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.hybridsearch.model.ChunkInfo;
import it.aw.hybridsearch.model.DocumentRecord;
import it.aw.hybridsearch.model.DocumentSummary;
import it.aw.hybridsearch.model.IngestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.util.*;

/**
 * Registro dei documenti indicizzati, persistito nella tabella {@code documents}
 * di un file DuckDB.
 * <p>
 * Per ogni documento conserva i metadati di ingestione, le anteprime dei chunk e gli
 * ID dei chunk nell'embedding store, necessari per cancellarli. La tabella
 * {@code store_settings} conserva le proprietà fisse dello store, in particolare la
 * dimensione degli embedding.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato per garantire la thread-safety (DuckDBConnection non è thread-safe).
 * <p>
 * Migrazione schema: se all'avvio mancano colonne dello schema corrente,
 * la tabella viene ricreata. I documenti esistenti devono essere re-indicizzati.
 */
@Component
public class DocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    public static final String EMBEDDING_DIMENSION = "embedding_dimension";

    private static final String CREATE_DOCUMENTS = """
            CREATE TABLE IF NOT EXISTS documents (
                document_id    VARCHAR   PRIMARY KEY,
                ingested_at    TIMESTAMP NOT NULL,
                chunk_count    INTEGER   NOT NULL,
                chunk_size     INTEGER   NOT NULL,
                overlap        INTEGER   NOT NULL,
                section_count  INTEGER   NOT NULL DEFAULT 0,
                user_metadata  VARCHAR   NOT NULL,
                chunk_previews VARCHAR   NOT NULL,
                chunk_ids      VARCHAR   NOT NULL
            )
            """;

    private static final String CREATE_SETTINGS = """
            CREATE TABLE IF NOT EXISTS store_settings (
                setting VARCHAR PRIMARY KEY,
                value   VARCHAR NOT NULL
            )
            """;

    private static final Set<String> REQUIRED_COLUMNS = Set.of("document_id", "user_metadata", "chunk_ids");

    private static final TypeReference<List<ChunkInfo>> CHUNK_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> ID_LIST_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, String>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String dbPath;
    private Connection conn;

    public DocumentRegistry(ObjectMapper objectMapper, @Value("${store.registry.path}") String dbPath) {
        this.objectMapper = objectMapper;
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path.toAbsolutePath().getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        migrateIfNeeded();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_DOCUMENTS);
            stmt.execute(CREATE_SETTINGS);
        }
        log.info("DocumentRegistry: tabelle pronte su {}", path.toAbsolutePath());
    }

    /** Rileva schema obsoleto e ricrea la tabella se necessario. */
    private void migrateIfNeeded() throws SQLException {
        Set<String> existing = new HashSet<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT column_name FROM information_schema.columns WHERE table_name = 'documents'")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) existing.add(rs.getString(1));
            }
        }
        if (!existing.isEmpty() && !existing.containsAll(REQUIRED_COLUMNS)) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS documents");
            }
            log.warn("DocumentRegistry: schema obsoleto rilevato, tabella 'documents' ricreata. " +
                     "Re-indicizzare i documenti esistenti.");
        }
    }

    @PreDestroy
    public void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    public synchronized void register(DocumentRecord record, List<String> chunkIds) {
        String sql = """
                INSERT INTO documents
                    (document_id, ingested_at, chunk_count, chunk_size, overlap, section_count,
                     user_metadata, chunk_previews, chunk_ids)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (document_id) DO UPDATE SET
                    ingested_at    = EXCLUDED.ingested_at,
                    chunk_count    = EXCLUDED.chunk_count,
                    chunk_size     = EXCLUDED.chunk_size,
                    overlap        = EXCLUDED.overlap,
                    section_count  = EXCLUDED.section_count,
                    user_metadata  = EXCLUDED.user_metadata,
                    chunk_previews = EXCLUDED.chunk_previews,
                    chunk_ids      = EXCLUDED.chunk_ids
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.documentId());
            ps.setTimestamp(2, Timestamp.valueOf(record.ingestedAt()));
            ps.setInt(3, record.chunkCount());
            ps.setInt(4, record.chunkSize());
            ps.setInt(5, record.overlap());
            ps.setInt(6, record.sectionCount());
            ps.setString(7, objectMapper.writeValueAsString(record.userMetadata()));
            ps.setString(8, objectMapper.writeValueAsString(record.chunkPreviews()));
            ps.setString(9, objectMapper.writeValueAsString(chunkIds));
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Errore salvataggio documento nel registry", e);
        }
    }

    public synchronized Optional<DocumentRecord> findById(String documentId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM documents WHERE document_id = ?")) {
            ps.setString(1, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toRecord(rs));
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura documento dal registry", e);
        }
        return Optional.empty();
    }

    public synchronized boolean contains(String documentId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM documents WHERE document_id = ?")) {
            ps.setString(1, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura registry", e);
        }
    }

    public synchronized List<DocumentSummary> findAllAsSummary() {
        List<DocumentSummary> result = new ArrayList<>();
        String sql = "SELECT document_id, ingested_at, chunk_count, chunk_size, overlap, section_count, user_metadata " +
                     "FROM documents ORDER BY document_id";
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) result.add(toSummary(rs));
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura registry (summary)", e);
        }
        return result;
    }

    /**
     * Rimuove il documento dal registry e restituisce i chunk IDs da cancellare
     * nell'embedding store. Ritorna {@link Optional#empty()} se il documento non esiste.
     */
    public synchronized Optional<List<String>> remove(String documentId) {
        List<String> chunkIds;
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT chunk_ids FROM documents WHERE document_id = ?")) {
            ps.setString(1, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                chunkIds = objectMapper.readValue(rs.getString("chunk_ids"), ID_LIST_TYPE);
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura chunk_ids dal registry", e);
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM documents WHERE document_id = ?")) {
            ps.setString(1, documentId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Errore rimozione documento dal registry", e);
        }
        return Optional.of(chunkIds);
    }

    public synchronized int totalDocuments() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM documents")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore conteggio documenti", e);
        }
    }

    public synchronized int totalChunks() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COALESCE(SUM(chunk_count), 0) FROM documents")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore conteggio chunk", e);
        }
    }

    public synchronized Optional<String> setting(String name) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT value FROM store_settings WHERE setting = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura impostazione " + name, e);
        }
    }

    public synchronized void saveSetting(String name, String value) {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO store_settings (setting, value) VALUES (?, ?) " +
                "ON CONFLICT (setting) DO UPDATE SET value = EXCLUDED.value")) {
            ps.setString(1, name);
            ps.setString(2, value);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Errore salvataggio impostazione " + name, e);
        }
    }

    private DocumentRecord toRecord(ResultSet rs) throws SQLException, IOException {
        return new DocumentRecord(
                rs.getString("document_id"),
                rs.getTimestamp("ingested_at").toLocalDateTime(),
                rs.getInt("chunk_count"),
                rs.getInt("chunk_size"),
                rs.getInt("overlap"),
                rs.getInt("section_count"),
                objectMapper.readValue(rs.getString("user_metadata"), METADATA_TYPE),
                objectMapper.readValue(rs.getString("chunk_previews"), CHUNK_LIST_TYPE)
        );
    }

    private DocumentSummary toSummary(ResultSet rs) throws SQLException, IOException {
        return new DocumentSummary(
                rs.getString("document_id"),
                IngestStatus.INDEXED,
                rs.getTimestamp("ingested_at").toLocalDateTime(),
                rs.getInt("chunk_count"),
                rs.getInt("chunk_size"),
                rs.getInt("overlap"),
                rs.getInt("section_count"),
                objectMapper.readValue(rs.getString("user_metadata"), METADATA_TYPE)
        );
    }
}
