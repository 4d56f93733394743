package it.aw.hybridsearch.search;

import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.filter.logical.And;

import java.util.Map;
import java.util.Set;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Traduce i predicati di uguaglianza della query in un {@link Filter} LangChain4j.
 * <p>
 * I metadati numerici sono salvati come interi: il valore del filtro viene convertito
 * prima del confronto, altrimenti lo store rifiuterebbe il confronto tra tipi diversi.
 */
public final class MetadataFilters {

    /** Chiavi di metadato salvate come intero. */
    public static final Set<String> INTEGER_KEYS =
            Set.of("page", "section.level", "chunk.index", "chunk.ordinal", "chunk.units",
                    "chunk.overlap.leading", "chunk.overlap.trailing");

    private MetadataFilters() {}

    /**
     * @return il filtro in AND di tutti i predicati, {@code null} se non ce ne sono
     * @throws IllegalArgumentException se una chiave intera ha un valore non numerico
     */
    public static Filter toFilter(Map<String, String> predicates) {
        if (predicates == null || predicates.isEmpty()) return null;

        Filter combined = null;
        for (Map.Entry<String, String> entry : predicates.entrySet()) {
            Filter next = equalTo(entry.getKey(), entry.getValue());
            combined = combined == null ? next : new And(combined, next);
        }
        return combined;
    }

    private static Filter equalTo(String key, String value) {
        if (INTEGER_KEYS.contains(key)) {
            try {
                return metadataKey(key).isEqualTo(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Filtro '" + key + "': atteso un intero, ricevuto '" + value + "'", e);
            }
        }
        return metadataKey(key).isEqualTo(value);
    }
}
