package it.aw.hybridsearch.model;

import java.util.Map;

/**
 * Candidato di una singola query: chunk recuperato dallo store con punteggio mutabile.
 * <p>
 * {@code originalRank} è la posizione 0-based nell'ordine restituito dallo store
 * e non cambia durante rerank e boost: serve come criterio di parità nell'ordinamento finale.
 */
public final class Candidate {

    private final String id;
    private final String text;
    private final Map<String, Object> metadata;
    private final double baseScore;
    private final int originalRank;

    private double score;
    private double boost;

    public Candidate(String id, String text, Map<String, Object> metadata, double baseScore, int originalRank) {
        this.id = id;
        this.text = text == null ? "" : text;
        this.metadata = metadata == null ? Map.of() : metadata;
        this.baseScore = baseScore;
        this.originalRank = originalRank;
        this.score = baseScore;
    }

    public String id()                    { return id; }
    public String text()                  { return text; }
    public Map<String, Object> metadata() { return metadata; }
    public double baseScore()             { return baseScore; }
    public int originalRank()             { return originalRank; }
    public double score()                 { return score; }
    public double boost()                 { return boost; }

    /** Sostituisce il punteggio (es. con quello del cross-encoder). */
    public void rescore(double newScore) {
        this.score = newScore;
    }

    public void addBoost(double amount) {
        this.boost += amount;
        this.score += amount;
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }

    public Integer metadataInteger(String key) {
        Object value = metadata.get(key);
        if (value instanceof Number) return ((Number) value).intValue();
        if (value != null && !value.toString().isBlank()) {
            try {
                return Integer.valueOf(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
