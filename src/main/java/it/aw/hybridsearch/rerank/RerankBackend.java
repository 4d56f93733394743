package it.aw.hybridsearch.rerank;

import java.util.Locale;

/**
 * Backend di reranking selezionabili per singola query.
 */
public enum RerankBackend {
    /** API cloud Cohere Rerank. */
    COHERE,
    /** Cross-encoder piccolo locale (ms-marco-MiniLM) servito via HTTP. */
    LOCAL,
    /** Cross-encoder grande locale (bge-reranker-v2-m3) servito via HTTP. */
    BGE;

    /** Converte il valore del parametro {@code rerank} della API; null o vuoto = nessun rerank. */
    public static RerankBackend fromParameter(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Backend di rerank sconosciuto: " + value
                    + " (ammessi: cohere, local, bge)", e);
        }
    }
}
