package it.aw.hybridsearch.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Configura i bean LangChain4j.
 *
 * EmbeddingModel: scelto da {@code embedding.provider}
 *                 - local:  AllMiniLM-L6-v2 quantizzato (384 dimensioni), senza API key
 *                 - openai: text-embedding-3-small (1536 dimensioni), richiede {@code openai.api-key}
 * EmbeddingStore:  InMemoryEmbeddingStore con persistenza su file JSON.
 *                  All'avvio carica il file se esiste, altrimenti parte da zero.
 *                  Il salvataggio su disco avviene allo shutdown tramite StoreLifecycle.
 *
 * Cambiare provider su uno store già popolato viene rifiutato da EmbeddingDimensionGuard.
 */
@Configuration
public class LangChain4jConfig {

    private static final Logger log = LoggerFactory.getLogger(LangChain4jConfig.class);

    @Value("${store.embedding.file}")
    private String embeddingFilePath;

    @Value("${embedding.provider:local}")
    private String provider;

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.embedding-model:text-embedding-3-small}")
    private String openAiModelName;

    @Bean
    public EmbeddingModel embeddingModel() {
        switch (provider.trim().toLowerCase(Locale.ROOT)) {
            case "local":
                log.info("Inizializzazione EmbeddingModel: AllMiniLmL6V2Quantized (locale)");
                return new AllMiniLmL6V2QuantizedEmbeddingModel();
            case "openai":
                if (openAiApiKey.isBlank()) {
                    throw new IllegalStateException("embedding.provider=openai richiede openai.api-key");
                }
                log.info("Inizializzazione EmbeddingModel: OpenAI {}", openAiModelName);
                return OpenAiEmbeddingModel.builder()
                        .apiKey(openAiApiKey)
                        .modelName(openAiModelName)
                        .build();
            default:
                throw new IllegalStateException("embedding.provider sconosciuto: " + provider
                        + " (ammessi: local, openai)");
        }
    }

    @Bean
    public InMemoryEmbeddingStore<TextSegment> embeddingStore() {
        Path path = Paths.get(embeddingFilePath);
        if (Files.exists(path)) {
            log.info("EmbeddingStore: caricamento da file {}", path.toAbsolutePath());
            return InMemoryEmbeddingStore.fromFile(path);
        }
        log.info("EmbeddingStore: file {} non trovato, partenza da zero.", path.toAbsolutePath());
        return new InMemoryEmbeddingStore<>();
    }
}
