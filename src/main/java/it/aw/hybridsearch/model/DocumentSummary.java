package it.aw.hybridsearch.model;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Vista leggera di un documento indicizzato: metadati e contatori, senza dettaglio chunk.
 * <p>
 * Restituita da POST /ingest, PUT /{documentId} e GET /api/documents (lista).
 * Per il dettaglio completo con preview dei chunk usare GET /api/documents/{documentId}.
 */
public record DocumentSummary(
        String              documentId,     // coincide con il nome del file sorgente
        IngestStatus        status,
        LocalDateTime       ingestedAt,
        int                 chunkCount,
        int                 chunkSize,
        int                 overlap,
        int                 sectionCount,   // sezioni sopravvissute al filtro TOC
        Map<String, String> userMetadata
) {

    public static DocumentSummary noContent(String documentId, ChunkingParams params,
                                            Map<String, String> userMetadata) {
        return new DocumentSummary(documentId, IngestStatus.NO_CONTENT, LocalDateTime.now(),
                0, params.chunkSize(), params.overlap(), 0, userMetadata);
    }
}
