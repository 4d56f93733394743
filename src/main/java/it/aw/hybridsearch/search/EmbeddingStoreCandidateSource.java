package it.aw.hybridsearch.search;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import it.aw.hybridsearch.exception.Cancellation;
import it.aw.hybridsearch.exception.EmbeddingFailureException;
import it.aw.hybridsearch.exception.VectorStoreFailureException;
import it.aw.hybridsearch.model.Candidate;
import it.aw.hybridsearch.store.EmbeddingDimensionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Candidati recuperati dall'embedding store LangChain4j.
 * <p>
 * Lo store restituisce uno score di rilevanza in [0, 1]; il punteggio base del
 * candidato è la similarità coseno corrispondente.
 */
@Component
public class EmbeddingStoreCandidateSource implements CandidateSource {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreCandidateSource.class);

    private final EmbeddingModel embeddingModel;
    private final EmbeddingStore<TextSegment> embeddingStore;
    private final EmbeddingDimensionGuard dimensionGuard;

    public EmbeddingStoreCandidateSource(EmbeddingModel embeddingModel,
                                         EmbeddingStore<TextSegment> embeddingStore,
                                         EmbeddingDimensionGuard dimensionGuard) {
        this.embeddingModel = embeddingModel;
        this.embeddingStore = embeddingStore;
        this.dimensionGuard = dimensionGuard;
    }

    @Override
    public List<Candidate> retrieve(String query, int maxResults, Map<String, String> filter) {
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(embed(query))
                .maxResults(maxResults)
                .filter(MetadataFilters.toFilter(filter))
                .build();

        Cancellation.checkpoint("ricerca vettoriale");
        List<EmbeddingMatch<TextSegment>> matches;
        try {
            matches = embeddingStore.search(request).matches();
        } catch (RuntimeException e) {
            throw new VectorStoreFailureException("Ricerca nell'embedding store fallita: " + e.getMessage(), e);
        }

        List<Candidate> candidates = new ArrayList<>(matches.size());
        for (EmbeddingMatch<TextSegment> match : matches) {
            TextSegment segment = match.embedded();
            candidates.add(new Candidate(
                    match.embeddingId(),
                    segment == null ? "" : segment.text(),
                    segment == null ? Map.of() : segment.metadata().toMap(),
                    CosineSimilarity.fromRelevanceScore(match.score()),
                    candidates.size()
            ));
        }
        log.debug("Recuperati {} candidati (richiesti {})", candidates.size(), maxResults);
        return candidates;
    }

    private Embedding embed(String query) {
        Cancellation.checkpoint("embedding della query");
        Embedding embedding;
        try {
            embedding = embeddingModel.embed(query).content();
        } catch (RuntimeException e) {
            throw new EmbeddingFailureException("Embedding della query fallito: " + e.getMessage(), e);
        }
        dimensionGuard.checkQuery(embedding);
        return embedding;
    }
}
