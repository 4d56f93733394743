package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Divide una sezione in chunk che rispettano il budget di token, spezzando sul
 * confine più naturale disponibile: paragrafo, riga, frase, spazio.
 * <p>
 * A ogni livello i pezzi vengono accumulati avidamente finché il pezzo successivo
 * farebbe superare il budget; un pezzo che da solo supera il budget viene
 * ridiviso al livello successivo. Una sequenza non divisibile più lunga del
 * budget viene emessa intera (mai troncata).
 * <p>
 * Se la sezione produce più di un chunk, l'heading viene ripetuto in testa a
 * ciascuno e il suo costo è sottratto al budget.
 */
public class RecursiveChunker {

    private static final Logger log = LoggerFactory.getLogger(RecursiveChunker.class);

    /** Confini di divisione in ordine di preferenza. */
    enum Boundary {
        PARAGRAPH(Pattern.compile(Pattern.quote("\n\n")), "\n\n"),
        LINE(Pattern.compile(Pattern.quote("\n")), "\n"),
        SENTENCE(Pattern.compile("(?<=[.!?])\\s+"), " "),
        WHITESPACE(Pattern.compile(" "), " ");

        private final Pattern splitter;
        private final String joiner;

        Boundary(Pattern splitter, String joiner) {
            this.splitter = splitter;
            this.joiner = joiner;
        }
    }

    private static final Boundary[] LEVELS = Boundary.values();

    private final TokenCounter tokens;

    public RecursiveChunker(TokenCounter tokens) {
        this.tokens = tokens;
    }

    /**
     * Chunk di una sezione, ciascuno con il proprio corpo (heading incluso) e la
     * lunghezza in token. Lista vuota se la sezione non ha contenuto.
     */
    public List<Chunk> chunk(Section section, int budget, Map<String, String> userMetadata) {
        String body = section.body().strip();
        if (body.isEmpty()) return List.of();

        String heading = section.renderedHeading();
        String prefix = heading.isEmpty() ? "" : heading + "\n\n";

        List<String> bodies;
        String whole = prefix + body;
        if (tokens.count(whole) <= budget) {
            bodies = List.of(whole);
        } else {
            int pieceBudget = Math.max(1, budget - tokens.count(prefix));
            bodies = new ArrayList<>();
            for (String piece : split(body, pieceBudget)) {
                bodies.add(prefix + piece);
            }
        }

        List<Chunk> chunks = new ArrayList<>(bodies.size());
        for (int i = 0; i < bodies.size(); i++) {
            String text = bodies.get(i);
            chunks.add(new Chunk(section, i, text, tokens.count(text), userMetadata));
        }
        return chunks;
    }

    /** Divide il testo in pezzi di al più {@code budget} token (salvo sequenze indivisibili). */
    public List<String> split(String text, int budget) {
        List<String> out = new ArrayList<>();
        for (String piece : split(text, budget, 0)) {
            String trimmed = piece.strip();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
        return out;
    }

    private List<String> split(String text, int budget, int level) {
        if (tokens.count(text) <= budget) {
            return text.isBlank() ? List.of() : List.of(text);
        }
        if (level >= LEVELS.length) {
            log.warn("Sequenza non divisibile di {} token oltre il budget di {}: emessa intera",
                    tokens.count(text), budget);
            return List.of(text);
        }

        Boundary boundary = LEVELS[level];
        List<String> chunks = new ArrayList<>();
        String current = "";

        for (String piece : boundary.splitter.split(text, -1)) {
            String candidate = current.isEmpty() ? piece : current + boundary.joiner + piece;
            if (tokens.count(candidate) <= budget) {
                current = candidate;
                continue;
            }
            if (!current.isBlank()) chunks.add(current);
            if (tokens.count(piece) > budget) {
                chunks.addAll(split(piece, budget, level + 1));
                current = "";
            } else {
                current = piece;
            }
        }
        if (!current.isBlank()) chunks.add(current);
        return chunks;
    }
}
