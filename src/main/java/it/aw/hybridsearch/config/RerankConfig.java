package it.aw.hybridsearch.config;

import dev.langchain4j.model.cohere.CohereScoringModel;
import dev.langchain4j.model.scoring.ScoringModel;
import it.aw.hybridsearch.rerank.RerankBackend;
import it.aw.hybridsearch.rerank.RerankerRegistry;
import it.aw.hybridsearch.rerank.TeiScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Backend di reranking.
 *
 * COHERE: Cohere Rerank via API, attivo solo se {@code rerank.cohere.api-key} è valorizzata.
 * LOCAL:  cross-encoder piccolo servito da Text Embeddings Inference su {@code rerank.local.url}.
 * BGE:    cross-encoder grande servito da Text Embeddings Inference su {@code rerank.bge.url}.
 *
 * Un backend senza configurazione non viene registrato: richiederlo in una query
 * produce un errore esplicito.
 */
@Configuration
public class RerankConfig {

    private static final Logger log = LoggerFactory.getLogger(RerankConfig.class);

    @Value("${rerank.cohere.api-key:}")
    private String cohereApiKey;

    @Value("${rerank.cohere.model:rerank-english-v3.0}")
    private String cohereModel;

    @Value("${rerank.local.url:}")
    private String localUrl;

    @Value("${rerank.bge.url:}")
    private String bgeUrl;

    @Value("${rerank.timeout-seconds:60}")
    private long timeoutSeconds;

    @Bean
    public RestTemplate rerankRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Bean
    public RerankerRegistry rerankerRegistry(RestTemplate rerankRestTemplate) {
        Map<RerankBackend, ScoringModel> models = new EnumMap<>(RerankBackend.class);
        if (!cohereApiKey.isBlank()) {
            models.put(RerankBackend.COHERE, CohereScoringModel.builder()
                    .apiKey(cohereApiKey)
                    .modelName(cohereModel)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .build());
        }
        if (!localUrl.isBlank()) {
            models.put(RerankBackend.LOCAL, new TeiScoringModel(rerankRestTemplate, localUrl, "local"));
        }
        if (!bgeUrl.isBlank()) {
            models.put(RerankBackend.BGE, new TeiScoringModel(rerankRestTemplate, bgeUrl, "bge"));
        }
        log.info("Reranker configurati: {}", models.keySet());
        return new RerankerRegistry(models);
    }
}
