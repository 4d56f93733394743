package it.aw.hybridsearch.service;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import it.aw.hybridsearch.chunking.ChunkingPipeline;
import it.aw.hybridsearch.exception.Cancellation;
import it.aw.hybridsearch.exception.EmbeddingFailureException;
import it.aw.hybridsearch.exception.VectorStoreFailureException;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkInfo;
import it.aw.hybridsearch.model.ChunkingParams;
import it.aw.hybridsearch.model.DocumentRecord;
import it.aw.hybridsearch.model.DocumentSummary;
import it.aw.hybridsearch.reader.DocumentReaders;
import it.aw.hybridsearch.reader.ExtractedDocument;
import it.aw.hybridsearch.registry.DocumentRegistry;
import it.aw.hybridsearch.store.EmbeddingDimensionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Gestisce il ciclo di vita dei documenti: ingestione, re-ingestione e cancellazione.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Parse: DocumentReaders sceglie il reader in base all'estensione</li>
 *   <li>Chunking: ChunkingPipeline (normalizzazione, sezioni, TOC, chunk, annotazione, overlap)</li>
 *   <li>Embedding a batch e verifica della dimensione dei vettori</li>
 *   <li>Rimozione dei chunk della versione precedente, se presente</li>
 *   <li>Scrittura nello store e registrazione del DocumentRecord nel registry DuckDB</li>
 * </ol>
 * L'identificatore del documento è il nome del file: re-indicizzare lo stesso file con gli
 * stessi parametri produce gli stessi chunk, con gli stessi testi e metadati.
 * <p>
 * Rimozione della versione precedente, scrittura nello store e registrazione avvengono
 * sotto un lock per documento: due ingestioni concorrenti dello stesso file non lasciano
 * chunk orfani nello store. Parsing ed embedding restano fuori dal lock.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);
    private static final int PREVIEW_LENGTH = 150;

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final DocumentRegistry registry;
    private final EmbeddingDimensionGuard dimensionGuard;
    private final DocumentReaders readers;
    private final ChunkingPipeline pipeline;
    private final int batchSize;
    private final ConcurrentMap<String, Object> documentLocks = new ConcurrentHashMap<>();

    public IngestionService(EmbeddingModel embeddingModel,
                            EmbeddingStore<TextSegment> embeddingStore,
                            DocumentRegistry registry,
                            EmbeddingDimensionGuard dimensionGuard,
                            DocumentReaders readers,
                            ChunkingPipeline pipeline,
                            @Value("${embedding.batch-size:100}") int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("embedding.batch-size deve essere >= 1 (ricevuto: " + batchSize + ")");
        }
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.registry = registry;
        this.dimensionGuard = dimensionGuard;
        this.readers = readers;
        this.pipeline = pipeline;
        this.batchSize = batchSize;
    }

    /** Indicizza un documento; se esiste già con lo stesso nome viene sostituito. */
    public DocumentSummary ingest(MultipartFile file, ChunkingParams params, Map<String, String> userMetadata)
            throws IOException {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "unknown";
        try (InputStream is = file.getInputStream()) {
            return ingest(filename, is, params, userMetadata);
        }
    }

    /** Sostituisce il documento {@code documentId} con il contenuto di {@code file}. */
    public DocumentSummary reingest(String documentId, MultipartFile file, ChunkingParams params,
                                    Map<String, String> userMetadata) throws IOException {
        try (InputStream is = file.getInputStream()) {
            return ingest(documentId, is, params, userMetadata);
        }
    }

    public DocumentSummary ingest(String documentId, InputStream content, ChunkingParams params,
                                  Map<String, String> userMetadata) throws IOException {
        log.info("Inizio ingestione: {} (chunkSize={}, overlap={})",
                documentId, params.chunkSize(), params.overlap());

        ExtractedDocument document = readers.extract(documentId, content);
        ChunkingPipeline.Result result = pipeline.process(document, params, userMetadata);

        if (result.isEmpty()) {
            synchronized (lockFor(documentId)) {
                removeChunks(documentId);
            }
            log.info("Ingestione {}: nessun contenuto indicizzabile", documentId);
            return DocumentSummary.noContent(documentId, params, userMetadata);
        }

        List<TextSegment> segments = result.chunks().stream()
                .map(IngestionService::toSegment)
                .collect(Collectors.toList());
        List<Embedding> embeddings = embedInBatches(segments);
        dimensionGuard.checkWrite(embeddings);

        DocumentRecord record;
        synchronized (lockFor(documentId)) {
            removeChunks(documentId);
            Cancellation.checkpoint("scrittura nell'embedding store");
            List<String> chunkIds;
            try {
                chunkIds = embeddingStore.addAll(embeddings, segments);
            } catch (RuntimeException e) {
                throw new VectorStoreFailureException("Scrittura nell'embedding store fallita: " + e.getMessage(), e);
            }

            record = new DocumentRecord(
                    documentId, LocalDateTime.now(),
                    segments.size(), params.chunkSize(), params.overlap(),
                    result.sections().size(), userMetadata == null ? Map.of() : userMetadata,
                    previews(result.chunks()));
            registry.register(record, chunkIds);
        }

        log.info("Ingestione completata: {} ({} chunk, {} sezioni)",
                documentId, segments.size(), result.sections().size());
        return record.toSummary();
    }

    /**
     * Rimuove il documento dallo store e dal registry.
     *
     * @return false se il documento non era indicizzato
     */
    public boolean delete(String documentId) {
        boolean removed;
        synchronized (lockFor(documentId)) {
            removed = removeChunks(documentId);
        }
        if (removed) log.info("Documento rimosso: {}", documentId);
        return removed;
    }

    private Object lockFor(String documentId) {
        return documentLocks.computeIfAbsent(documentId, id -> new Object());
    }

    private boolean removeChunks(String documentId) {
        Optional<List<String>> chunkIds = registry.remove(documentId);
        if (chunkIds.isEmpty()) return false;
        if (!chunkIds.get().isEmpty()) {
            Cancellation.checkpoint("rimozione dall'embedding store");
            try {
                embeddingStore.removeAll(chunkIds.get());
            } catch (RuntimeException e) {
                throw new VectorStoreFailureException("Rimozione chunk di " + documentId + " fallita: " + e.getMessage(), e);
            }
        }
        log.debug("{}: rimossi {} chunk della versione precedente", documentId, chunkIds.get().size());
        return true;
    }

    private List<Embedding> embedInBatches(List<TextSegment> segments) {
        List<Embedding> embeddings = new ArrayList<>(segments.size());
        for (int from = 0; from < segments.size(); from += batchSize) {
            List<TextSegment> batch = segments.subList(from, Math.min(from + batchSize, segments.size()));
            Cancellation.checkpoint("embedding batch " + (from / batchSize + 1));
            List<Embedding> batchEmbeddings;
            try {
                batchEmbeddings = embeddingModel.embedAll(batch).content();
            } catch (RuntimeException e) {
                throw new EmbeddingFailureException("Embedding dei chunk fallito: " + e.getMessage(), e);
            }
            if (batchEmbeddings == null || batchEmbeddings.size() != batch.size()) {
                throw new EmbeddingFailureException("Embedding model: numero di vettori diverso dal numero di chunk");
            }
            embeddings.addAll(batchEmbeddings);
        }
        return embeddings;
    }

    static TextSegment toSegment(Chunk chunk) {
        Metadata meta = new Metadata();
        chunk.userMetadata().forEach(meta::put);
        meta.put("documentId",    chunk.documentId());
        meta.put("source",        chunk.documentId());
        meta.put("section",       chunk.section().heading());
        meta.put("section.path",  chunk.section().sectionPath());
        meta.put("section.level", chunk.section().level());
        meta.put("chunk.index",   chunk.index());
        meta.put("chunk.ordinal", chunk.ordinal());
        meta.put("chunk.kind",    chunk.kind().name());
        meta.put("chunk.units",   chunk.units());
        meta.put("chunk.overlap.leading",  chunk.leadingOverlapLength());
        meta.put("chunk.overlap.trailing", chunk.trailingOverlapLength());
        if (chunk.section().page() != null) meta.put("page", chunk.section().page());
        return TextSegment.from(chunk.text(), meta);
    }

    private static List<ChunkInfo> previews(List<Chunk> chunks) {
        List<ChunkInfo> previews = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            String text = chunk.annotatedText();
            String preview = text.length() > PREVIEW_LENGTH
                    ? text.substring(0, PREVIEW_LENGTH) + "..."
                    : text;
            previews.add(new ChunkInfo(chunk.index(), chunk.ordinal(),
                    chunk.section().heading(), chunk.section().sectionPath(), chunk.section().page(),
                    chunk.kind(), chunk.units(), preview));
        }
        return previews;
    }
}
