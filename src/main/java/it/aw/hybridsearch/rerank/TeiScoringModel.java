package it.aw.hybridsearch.rerank;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cross-encoder locale esposto da un server Text Embeddings Inference ({@code POST /rerank}).
 * <p>
 * Tutti i candidati vengono inviati in un'unica richiesta; il server restituisce
 * i punteggi in ordine di rilevanza con l'indice del testo originale, che qui
 * vengono riportati nell'ordine di input.
 */
public class TeiScoringModel implements ScoringModel {

    private static final Logger log = LoggerFactory.getLogger(TeiScoringModel.class);

    record RerankRequest(String query, List<String> texts,
                         @JsonProperty("raw_scores") boolean rawScores, boolean truncate) {}

    record RankedText(int index, double score) {}

    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String name;

    public TeiScoringModel(RestTemplate restTemplate, String baseUrl, String name) {
        this.restTemplate = restTemplate;
        this.endpoint = baseUrl.endsWith("/") ? baseUrl + "rerank" : baseUrl + "/rerank";
        this.name = name;
    }

    @Override
    public Response<List<Double>> scoreAll(List<TextSegment> segments, String query) {
        if (segments.isEmpty()) return Response.from(List.of());

        List<String> texts = segments.stream().map(TextSegment::text).collect(Collectors.toList());
        RankedText[] ranked = restTemplate.postForObject(endpoint,
                new RerankRequest(query, texts, false, true), RankedText[].class);
        if (ranked == null || ranked.length != texts.size()) {
            throw new IllegalStateException("Risposta di rerank incompleta da " + name + ": attesi "
                    + texts.size() + " punteggi, ricevuti " + (ranked == null ? 0 : ranked.length));
        }

        List<Double> scores = new ArrayList<>(Collections.nCopies(texts.size(), (Double) null));
        for (RankedText r : ranked) {
            scores.set(r.index(), r.score());
        }
        log.debug("{}: {} candidati valutati", name, texts.size());
        return Response.from(scores);
    }
}
