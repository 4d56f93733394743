package it.aw.hybridsearch.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Salva l'embedding store su disco allo shutdown dell'applicazione.
 * <p>
 * Il caricamento all'avvio avviene in LangChain4jConfig.embeddingStore();
 * il registry DuckDB è persistente e non richiede salvataggio.
 */
@Component
public class StoreLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StoreLifecycle.class);

    private final InMemoryEmbeddingStore<TextSegment> embeddingStore;
    private final String embeddingFilePath;

    public StoreLifecycle(InMemoryEmbeddingStore<TextSegment> embeddingStore,
                          @Value("${store.embedding.file}") String embeddingFilePath) {
        this.embeddingStore = embeddingStore;
        this.embeddingFilePath = embeddingFilePath;
    }

    @PreDestroy
    public void save() {
        Path path = Paths.get(embeddingFilePath);
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            embeddingStore.serializeToFile(path);
            log.info("EmbeddingStore salvato: {}", path.toAbsolutePath());
        } catch (IOException | RuntimeException e) {
            log.error("Impossibile salvare l'EmbeddingStore su {}: {}", path.toAbsolutePath(), e.getMessage(), e);
        }
    }
}
