package it.aw.hybridsearch.store;

import dev.langchain4j.data.embedding.Embedding;
import it.aw.hybridsearch.exception.IncompatibleEmbeddingException;
import it.aw.hybridsearch.registry.DocumentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Vincolo di dimensione degli embedding di uno store.
 * <p>
 * La dimensione viene fissata dalla prima scrittura e salvata nel registry: da quel
 * momento ogni scrittura e ogni query con vettori di dimensione diversa viene rifiutata.
 * Cambiare embedding model richiede uno store nuovo.
 */
@Component
public class EmbeddingDimensionGuard {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingDimensionGuard.class);

    private final DocumentRegistry registry;
    private Integer dimension;
    private boolean loaded;

    public EmbeddingDimensionGuard(DocumentRegistry registry) {
        this.registry = registry;
    }

    /**
     * Verifica un batch prima della scrittura. Il batch deve essere omogeneo e, se lo store
     * ha già una dimensione, coerente con essa; altrimenti la fissa.
     */
    public synchronized void checkWrite(List<Embedding> embeddings) {
        if (embeddings.isEmpty()) return;

        int batchDimension = embeddings.get(0).dimension();
        for (Embedding embedding : embeddings) {
            if (embedding.dimension() != batchDimension) {
                throw new IncompatibleEmbeddingException(batchDimension, embedding.dimension());
            }
        }

        Integer expected = current();
        if (expected == null) {
            registry.saveSetting(DocumentRegistry.EMBEDDING_DIMENSION, String.valueOf(batchDimension));
            dimension = batchDimension;
            log.info("Dimensione embedding dello store fissata a {}", batchDimension);
        } else if (expected != batchDimension) {
            throw new IncompatibleEmbeddingException(expected, batchDimension);
        }
    }

    public synchronized void checkQuery(Embedding queryEmbedding) {
        Integer expected = current();
        if (expected != null && expected != queryEmbedding.dimension()) {
            throw new IncompatibleEmbeddingException(expected, queryEmbedding.dimension());
        }
    }

    public synchronized Optional<Integer> dimension() {
        return Optional.ofNullable(current());
    }

    private Integer current() {
        if (!loaded) {
            dimension = registry.setting(DocumentRegistry.EMBEDDING_DIMENSION)
                    .map(Integer::valueOf)
                    .orElse(null);
            loaded = true;
        }
        return dimension;
    }
}
