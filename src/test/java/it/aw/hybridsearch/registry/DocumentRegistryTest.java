package it.aw.hybridsearch.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.hybridsearch.model.ChunkInfo;
import it.aw.hybridsearch.model.ChunkKind;
import it.aw.hybridsearch.model.DocumentRecord;
import it.aw.hybridsearch.model.DocumentSummary;
import it.aw.hybridsearch.model.IngestStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentRegistryTest {

    @TempDir
    Path tempDir;

    private DocumentRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        registry = new DocumentRegistry(new ObjectMapper(), tempDir.resolve("data/registry.duckdb").toString());
        registry.init();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private static DocumentRecord record(String documentId, int chunkCount) {
        ChunkInfo preview = new ChunkInfo(0, 0, "AFIO_MAPR2", "AFIO / AFIO_MAPR2", null,
                ChunkKind.REGISTER_DEFINITION, 42, "REGISTER DEFINITION: AFIO_MAPR2 ...");
        return new DocumentRecord(documentId, LocalDateTime.of(2024, 5, 2, 10, 30), chunkCount,
                500, 50, 3, Map.of("product", "stm32f1"), List.of(preview));
    }

    @Test
    @DisplayName("Registra e rilegge un documento con preview e metadati utente")
    void registerAndFind() {
        registry.register(record("rm0041.md", 2), List.of("id-1", "id-2"));

        Optional<DocumentRecord> found = registry.findById("rm0041.md");

        assertThat(found).isPresent();
        assertThat(found.get().chunkCount()).isEqualTo(2);
        assertThat(found.get().userMetadata()).containsEntry("product", "stm32f1");
        assertThat(found.get().chunkPreviews()).hasSize(1);
        assertThat(found.get().chunkPreviews().get(0).kind()).isEqualTo(ChunkKind.REGISTER_DEFINITION);
        assertThat(found.get().ingestedAt()).isNotNull();
        assertThat(registry.contains("rm0041.md")).isTrue();
        assertThat(registry.findById("missing.md")).isEmpty();
    }

    @Test
    @DisplayName("Una nuova registrazione sostituisce quella precedente")
    void registerReplaces() {
        registry.register(record("rm0041.md", 2), List.of("id-1", "id-2"));
        registry.register(record("rm0041.md", 5), List.of("id-3"));

        assertThat(registry.totalDocuments()).isEqualTo(1);
        assertThat(registry.totalChunks()).isEqualTo(5);
        assertThat(registry.remove("rm0041.md")).contains(List.of("id-3"));
    }

    @Test
    @DisplayName("La rimozione restituisce gli ID dei chunk e svuota il registry")
    void removeReturnsChunkIds() {
        registry.register(record("a.md", 2), List.of("id-1", "id-2"));
        registry.register(record("b.md", 1), List.of("id-3"));

        assertThat(registry.remove("a.md")).contains(List.of("id-1", "id-2"));
        assertThat(registry.remove("a.md")).isEmpty();
        assertThat(registry.findAllAsSummary()).extracting(DocumentSummary::documentId).containsExactly("b.md");
        assertThat(registry.findAllAsSummary().get(0).status()).isEqualTo(IngestStatus.INDEXED);
    }

    @Test
    @DisplayName("Le impostazioni dello store sono persistenti tra riaperture")
    void settingsSurviveReopen() throws Exception {
        registry.saveSetting(DocumentRegistry.EMBEDDING_DIMENSION, "384");
        registry.close();

        registry = new DocumentRegistry(new ObjectMapper(), tempDir.resolve("data/registry.duckdb").toString());
        registry.init();

        assertThat(registry.setting(DocumentRegistry.EMBEDDING_DIMENSION)).contains("384");
        assertThat(registry.setting("unknown")).isEmpty();
    }
}
