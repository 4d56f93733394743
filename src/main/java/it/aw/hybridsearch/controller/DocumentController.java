package it.aw.hybridsearch.controller;

import it.aw.hybridsearch.model.ChunkingParams;
import it.aw.hybridsearch.model.DocumentRecord;
import it.aw.hybridsearch.model.DocumentSummary;
import it.aw.hybridsearch.model.SearchQuery;
import it.aw.hybridsearch.model.SearchResult;
import it.aw.hybridsearch.model.StoreStats;
import it.aw.hybridsearch.registry.DocumentRegistry;
import it.aw.hybridsearch.rerank.RerankBackend;
import it.aw.hybridsearch.service.IngestionService;
import it.aw.hybridsearch.service.SearchService;
import it.aw.hybridsearch.store.EmbeddingDimensionGuard;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Espone le operazioni di ingestione, ricerca e consultazione dei documenti indicizzati.
 *
 * Endpoint disponibili:
 *   POST   /api/documents/ingest                 indicizza (o sostituisce) un documento
 *   GET    /api/documents/search?q=&topK=        ricerca ibrida
 *   GET    /api/documents                        lista dei documenti indicizzati
 *   GET    /api/documents/stats                  statistiche aggregate dello store
 *   GET    /api/documents/{documentId}           dettaglio e chunk preview di un documento
 *   DELETE /api/documents/{documentId}           rimuove un documento dall'indice
 *   PUT    /api/documents/{documentId}           sostituisce un documento con una nuova versione
 *
 * Gli errori sono tradotti in risposte JSON da {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/documents")
public class DocumentController {

    private final IngestionService ingestionService;
    private final SearchService searchService;
    private final DocumentRegistry registry;
    private final EmbeddingDimensionGuard dimensionGuard;
    private final ChunkingParams defaultParams;
    private final String embeddingModelName;

    public DocumentController(IngestionService ingestionService,
                              SearchService searchService,
                              DocumentRegistry registry,
                              EmbeddingDimensionGuard dimensionGuard,
                              ChunkingParams defaultParams,
                              @Value("${embedding.provider:local}") String embeddingModelName) {
        this.ingestionService = ingestionService;
        this.searchService = searchService;
        this.registry = registry;
        this.dimensionGuard = dimensionGuard;
        this.defaultParams = defaultParams;
        this.embeddingModelName = embeddingModelName;
    }

    /**
     * Indicizza un documento (PDF, Markdown o testo). Un documento con lo stesso nome
     * già indicizzato viene sostituito.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/documents/ingest?chunkSize=400&meta=product=stm32f1" \
     *        -F "file=@RM0041.pdf"
     */
    @PostMapping("/ingest")
    public ResponseEntity<DocumentSummary> ingest(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "chunkSize", required = false) Integer chunkSize,
            @RequestParam(value = "overlap",   required = false) Integer overlap,
            @RequestParam(value = "meta",      required = false) List<String> meta) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(ingestionService.ingest(
                file, params(chunkSize, overlap), KeyValueParams.parse("meta", meta)));
    }

    /**
     * Ricerca ibrida sui documenti indicizzati.
     *
     * Esempio:
     *   curl "http://localhost:8889/api/documents/search?q=AFIO_MAPR2+bit+fields&topK=3&rerank=bge&keywordBoost=true"
     */
    @GetMapping("/search")
    public ResponseEntity<List<SearchResult>> search(
            @RequestParam("q") String query,
            @RequestParam(value = "topK",         defaultValue = "5")     int topK,
            @RequestParam(value = "rerank",       required = false)       String rerank,
            @RequestParam(value = "keywordBoost", defaultValue = "false") boolean keywordBoost,
            @RequestParam(value = "filter",       required = false)       List<String> filter) {
        SearchQuery searchQuery = new SearchQuery(query, topK, RerankBackend.fromParameter(rerank),
                keywordBoost, KeyValueParams.parse("filter", filter));
        return ResponseEntity.ok(searchService.search(searchQuery));
    }

    @GetMapping
    public ResponseEntity<List<DocumentSummary>> listDocuments() {
        return ResponseEntity.ok(registry.findAllAsSummary());
    }

    /**
     * Statistiche aggregate: numero documenti, chunk totali, store, embedding model e dimensione.
     */
    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        StoreStats stats = new StoreStats(
                registry.totalDocuments(),
                registry.totalChunks(),
                "InMemoryEmbeddingStore",
                embeddingModelName,
                dimensionGuard.dimension().orElse(null)
        );
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentRecord> getDocument(@PathVariable String documentId) {
        return registry.findById(documentId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Rimuove un documento: i suoi chunk vengono cancellati dall'embedding store.
     */
    @DeleteMapping("/{documentId}")
    public ResponseEntity<Void> deleteDocument(@PathVariable String documentId) {
        return ingestionService.delete(documentId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * Sostituisce un documento esistente con una nuova versione del file.
     *
     * Esempio:
     *   curl -X PUT "http://localhost:8889/api/documents/RM0041.pdf?overlap=80" -F "file=@RM0041_rev7.pdf"
     */
    @PutMapping("/{documentId}")
    public ResponseEntity<DocumentSummary> reingestDocument(
            @PathVariable String documentId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "chunkSize", required = false) Integer chunkSize,
            @RequestParam(value = "overlap",   required = false) Integer overlap,
            @RequestParam(value = "meta",      required = false) List<String> meta) throws IOException {
        if (file.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        if (!registry.contains(documentId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(ingestionService.reingest(
                documentId, file, params(chunkSize, overlap), KeyValueParams.parse("meta", meta)));
    }

    private ChunkingParams params(Integer chunkSize, Integer overlap) {
        return defaultParams.withSizes(
                chunkSize != null ? chunkSize : defaultParams.chunkSize(),
                overlap   != null ? overlap   : defaultParams.overlap());
    }
}
