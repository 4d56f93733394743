package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Chunk;

import java.util.List;

/**
 * Aggiunge a ogni chunk il contesto di confine dei vicini nello stesso documento.
 * <p>
 * Il chunk riceve in testa gli ultimi O token del corpo originale del predecessore
 * e in coda i primi O token del corpo originale del successore, entrambi delimitati
 * da {@code [...]}. Lo stitching attraversa i confini di sezione. Il testo di overlap
 * è preso dal corpo non annotato, quindi non contiene mai titoli o key term dei vicini.
 */
public class OverlapStitcher {

    private final TokenCounter tokens;

    public OverlapStitcher(TokenCounter tokens) {
        this.tokens = tokens;
    }

    /**
     * @param chunks       chunk dell'intero documento, in ordine
     * @param overlapUnits token presi da ciascun vicino (0 disattiva lo stitching)
     */
    public void stitch(List<Chunk> chunks, int overlapUnits) {
        if (overlapUnits <= 0 || chunks.size() <= 1) return;

        for (int i = 0; i < chunks.size(); i++) {
            String leading = null;
            String trailing = null;
            if (i > 0) {
                leading = blankToNull(tokens.tail(chunks.get(i - 1).body(), overlapUnits).strip());
            }
            if (i < chunks.size() - 1) {
                trailing = blankToNull(tokens.head(chunks.get(i + 1).body(), overlapUnits).strip());
            }
            chunks.get(i).stitch(leading, trailing);
        }
    }

    private static String blankToNull(String s) {
        return s.isEmpty() ? null : s;
    }
}
