package it.aw.hybridsearch.model;

/**
 * Statistiche aggregate sullo stato dell'embedding store.
 */
public record StoreStats(
        int     totalDocuments,
        int     totalChunks,
        String  storeType,
        String  embeddingModel,
        Integer embeddingDimension   // null finché non è stato scritto alcun vettore
) {}
