package it.aw.hybridsearch.service;

import it.aw.hybridsearch.model.Candidate;
import it.aw.hybridsearch.model.ChunkKind;
import it.aw.hybridsearch.model.SearchQuery;
import it.aw.hybridsearch.model.SearchResult;
import it.aw.hybridsearch.search.HybridSearchRefiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Esegue ricerche ibride sull'embedding store.
 * <p>
 * Il raffinamento (espansione dei candidati, rerank, keyword boost, ordinamento) è
 * delegato a {@link HybridSearchRefiner}; qui i candidati finali diventano
 * {@link SearchResult} con una finestra di testo per la visualizzazione.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final HybridSearchRefiner refiner;
    private final int previewChars;

    public SearchService(HybridSearchRefiner refiner,
                         @Value("${search.preview-chars:200}") int previewChars) {
        this.refiner = refiner;
        this.previewChars = previewChars;
    }

    public List<SearchResult> search(SearchQuery query) {
        List<Candidate> ranked = refiner.refine(query);
        log.debug("Query '{}': {} risultati (topK={}, rerank={}, keywordBoost={})",
                query.text(), ranked.size(), query.topK(), query.rerank(), query.keywordBoost());
        return ranked.stream().map(this::toResult).collect(Collectors.toList());
    }

    private SearchResult toResult(Candidate c) {
        return new SearchResult(
                c.score(),
                c.baseScore(),
                c.boost(),
                window(c.text()),
                c.metadataString("source"),
                c.metadataString("documentId"),
                c.metadataInteger("page"),
                c.metadataString("section"),
                c.metadataString("section.path"),
                kindOf(c.metadataString("chunk.kind"))
        );
    }

    String window(String text) {
        if (previewChars <= 0 || text.length() <= previewChars) return text;
        return text.substring(0, previewChars) + "...";
    }

    private static ChunkKind kindOf(String value) {
        if (value == null) return ChunkKind.REGULAR;
        try {
            return ChunkKind.valueOf(value);
        } catch (IllegalArgumentException e) {
            log.warn("chunk.kind sconosciuto nei metadati: {}", value);
            return ChunkKind.REGULAR;
        }
    }
}
