package it.aw.hybridsearch.config;

import it.aw.hybridsearch.chunking.ChunkingPipeline;
import it.aw.hybridsearch.chunking.OverlapStitcher;
import it.aw.hybridsearch.chunking.RecursiveChunker;
import it.aw.hybridsearch.chunking.SectionSplitter;
import it.aw.hybridsearch.chunking.TextNormalizer;
import it.aw.hybridsearch.chunking.TokenCounter;
import it.aw.hybridsearch.model.ChunkingParams;
import it.aw.hybridsearch.model.RefinementParams;
import it.aw.hybridsearch.reader.DocumentReaders;
import it.aw.hybridsearch.rerank.RerankerRegistry;
import it.aw.hybridsearch.search.CandidateSource;
import it.aw.hybridsearch.search.HybridSearchRefiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Parametri e componenti delle pipeline di ingestione e di ricerca.
 * <p>
 * Le proprietà vengono lette una sola volta all'avvio e trasformate in record immutabili,
 * passati esplicitamente ai componenti.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public ChunkingParams chunkingParams(
            @Value("${chunking.chunk-size:500}")             int chunkSize,
            @Value("${chunking.overlap:50}")                 int overlap,
            @Value("${chunking.toc-min-chars:50}")           int tocMinChars,
            @Value("${chunking.overview-min-registers:4}")   int overviewMinRegisters) {
        ChunkingParams params = new ChunkingParams(chunkSize, overlap, tocMinChars, overviewMinRegisters);
        log.info("Chunking: {}", params);
        return params;
    }

    @Bean
    public RefinementParams refinementParams(
            @Value("${search.expansion-factor:5}")   int expansionFactor,
            @Value("${search.boost.title:0.20}")     double titleBoost,
            @Value("${search.boost.key-term:0.10}")  double keyTermBoost,
            @Value("${search.boost.body:0.05}")      double bodyBoost) {
        RefinementParams params = new RefinementParams(expansionFactor, titleBoost, keyTermBoost, bodyBoost);
        log.info("Ricerca: {}", params);
        return params;
    }

    @Bean
    public TokenCounter tokenCounter() {
        return new TokenCounter();
    }

    @Bean
    public ChunkingPipeline chunkingPipeline(TokenCounter tokens,
                                             @Value("${chunking.header-min-repeats:2}") int headerMinRepeats) {
        return new ChunkingPipeline(new TextNormalizer(headerMinRepeats), new SectionSplitter(),
                new RecursiveChunker(tokens), new OverlapStitcher(tokens));
    }

    @Bean
    public DocumentReaders documentReaders() {
        return DocumentReaders.defaults();
    }

    @Bean
    public HybridSearchRefiner hybridSearchRefiner(CandidateSource candidateSource,
                                                   RerankerRegistry rerankers,
                                                   RefinementParams params) {
        return new HybridSearchRefiner(candidateSource, rerankers, params);
    }
}
