package it.aw.hybridsearch.model;

import it.aw.hybridsearch.rerank.RerankBackend;

import java.util.Map;

/**
 * Richiesta di ricerca.
 *
 * @param rerank       backend di reranking da usare, {@code null} per disattivare il rerank
 * @param keywordBoost attiva il boost sugli identificatori tecnici presenti nella query
 * @param filter       predicati di uguaglianza sui metadati, in AND
 */
public record SearchQuery(
        String              text,
        int                 topK,
        RerankBackend       rerank,
        boolean             keywordBoost,
        Map<String, String> filter
) {

    public SearchQuery {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("il testo della query non può essere vuoto");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK deve essere >= 1 (ricevuto: " + topK + ")");
        }
        filter = filter == null ? Map.of() : Map.copyOf(filter);
    }

    public static SearchQuery of(String text, int topK) {
        return new SearchQuery(text, topK, null, false, Map.of());
    }

    public boolean reranks() {
        return rerank != null;
    }

    /** Vero se almeno uno stadio di post-processing richiede un pool di candidati più ampio. */
    public boolean refines() {
        return reranks() || keywordBoost;
    }
}
