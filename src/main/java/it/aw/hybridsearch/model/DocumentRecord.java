package it.aw.hybridsearch.model;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Dettaglio completo di un documento indicizzato, incluse le preview dei chunk
 * con metadati di sezione, pagina e classificazione.
 * <p>
 * Restituito solo da GET /api/documents/{documentId}.
 * Per le operazioni di lista e ingest usare {@link DocumentSummary}.
 */
public record DocumentRecord(
        String              documentId,
        LocalDateTime       ingestedAt,
        int                 chunkCount,
        int                 chunkSize,
        int                 overlap,
        int                 sectionCount,
        Map<String, String> userMetadata,
        List<ChunkInfo>     chunkPreviews
) {
    /** Proietta il record nella vista leggera senza chunk preview. */
    public DocumentSummary toSummary() {
        return new DocumentSummary(documentId, IngestStatus.INDEXED, ingestedAt,
                chunkCount, chunkSize, overlap, sectionCount, userMetadata);
    }
}
