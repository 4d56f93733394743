package it.aw.hybridsearch.rerank;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.scoring.ScoringModel;
import it.aw.hybridsearch.exception.RerankFailureException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Backend di reranking configurati all'avvio, uno per {@link RerankBackend}.
 * <p>
 * Un backend richiesto ma non configurato (es. API key Cohere assente) è un errore
 * esplicito, non un rerank saltato in silenzio.
 */
public class RerankerRegistry {

    private final Map<RerankBackend, ScoringModel> models;

    public RerankerRegistry(Map<RerankBackend, ScoringModel> models) {
        this.models = models.isEmpty() ? new EnumMap<>(RerankBackend.class) : new EnumMap<>(models);
    }

    public boolean isAvailable(RerankBackend backend) {
        return models.containsKey(backend);
    }

    /**
     * Punteggi del cross-encoder per ogni testo, nello stesso ordine, con una sola chiamata.
     *
     * @throws RerankFailureException se il backend non è configurato o la chiamata fallisce
     */
    public List<Double> score(RerankBackend backend, String query, List<String> texts) {
        ScoringModel model = models.get(backend);
        if (model == null) {
            throw new RerankFailureException("Backend di rerank " + backend + " non configurato");
        }
        List<TextSegment> segments = texts.stream().map(TextSegment::from).collect(Collectors.toList());
        List<Double> scores;
        try {
            scores = model.scoreAll(segments, query).content();
        } catch (RuntimeException e) {
            throw new RerankFailureException("Rerank " + backend + " fallito: " + e.getMessage(), e);
        }
        if (scores == null || scores.size() != texts.size() || scores.stream().anyMatch(Objects::isNull)) {
            throw new RerankFailureException("Rerank " + backend + ": punteggi mancanti per alcuni candidati");
        }
        return scores;
    }
}
