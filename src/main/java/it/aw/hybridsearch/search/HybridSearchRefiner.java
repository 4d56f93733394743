package it.aw.hybridsearch.search;

import it.aw.hybridsearch.exception.Cancellation;
import it.aw.hybridsearch.model.Candidate;
import it.aw.hybridsearch.model.RefinementParams;
import it.aw.hybridsearch.model.SearchQuery;
import it.aw.hybridsearch.rerank.RerankerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pipeline di raffinamento della ricerca ibrida:
 * <ol>
 *   <li>Expand: con rerank o keyword boost attivi si chiedono {@code topK × expansionFactor} candidati</li>
 *   <li>Retrieve: ricerca vettoriale con i filtri sui metadati</li>
 *   <li>Rerank (opzionale): il punteggio del cross-encoder sostituisce quello base</li>
 *   <li>Keyword boost (opzionale): sempre dopo il rerank</li>
 *   <li>Ordinamento per punteggio decrescente, a parità per rank originale, e troncamento a topK</li>
 * </ol>
 * Un errore del reranker interrompe la query: non si ripiega sull'ordine vettoriale.
 */
public class HybridSearchRefiner {

    private static final Logger log = LoggerFactory.getLogger(HybridSearchRefiner.class);

    static final Comparator<Candidate> RANKING =
            Comparator.comparingDouble(Candidate::score).reversed()
                    .thenComparingInt(Candidate::originalRank);

    private final CandidateSource candidateSource;
    private final RerankerRegistry rerankers;
    private final KeywordBooster keywordBooster;
    private final RefinementParams params;

    public HybridSearchRefiner(CandidateSource candidateSource,
                               RerankerRegistry rerankers,
                               RefinementParams params) {
        this.candidateSource = candidateSource;
        this.rerankers = rerankers;
        this.keywordBooster = new KeywordBooster(params);
        this.params = params;
    }

    public int candidatePoolSize(SearchQuery query) {
        if (!query.refines()) return query.topK();
        try {
            return Math.multiplyExact(query.topK(), params.expansionFactor());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("topK troppo grande per l'espansione dei candidati: topK="
                    + query.topK() + ", fattore=" + params.expansionFactor(), e);
        }
    }

    public List<Candidate> refine(SearchQuery query) {
        int poolSize = candidatePoolSize(query);
        List<Candidate> candidates = new ArrayList<>(
                candidateSource.retrieve(query.text(), poolSize, query.filter()));
        if (candidates.isEmpty()) return List.of();

        if (query.reranks()) {
            rerank(query, candidates);
        }
        if (query.keywordBoost()) {
            int boosted = keywordBooster.apply(query.text(), candidates);
            log.debug("Keyword boost applicato a {}/{} candidati", boosted, candidates.size());
        }

        return candidates.stream()
                .sorted(RANKING)
                .limit(query.topK())
                .collect(Collectors.toList());
    }

    private void rerank(SearchQuery query, List<Candidate> candidates) {
        Cancellation.checkpoint("rerank " + query.rerank());
        List<String> texts = candidates.stream().map(Candidate::text).collect(Collectors.toList());
        List<Double> scores = rerankers.score(query.rerank(), query.text(), texts);
        for (int i = 0; i < candidates.size(); i++) {
            candidates.get(i).rescore(scores.get(i));
        }
        log.debug("Rerank {} su {} candidati completato", query.rerank(), candidates.size());
    }
}
