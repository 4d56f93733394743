package it.aw.hybridsearch.search;

import it.aw.hybridsearch.model.AnnotationFormat;
import it.aw.hybridsearch.model.Candidate;
import it.aw.hybridsearch.model.RefinementParams;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Boost lessicale sugli identificatori tecnici della query.
 * <p>
 * Per ogni identificatore estratto dalla query viene cercato un match esatto a
 * word boundary nelle regioni del candidato, in ordine di priorità: riga di titolo,
 * riga {@code [KEY: ...]}, resto del testo. Le parti di overlap delimitate da {@code [...]}
 * appartengono ai chunk vicini e non contano. Si applica una sola volta il boost della
 * regione più prioritaria; i boost di identificatori diversi si sommano senza tetto.
 * <p>
 * Il word boundary impedisce che {@code AFIO_MAPR} corrisponda dentro {@code AFIO_MAPR2}:
 * il carattere successivo è una cifra, quindi non c'è boundary.
 */
public class KeywordBooster {

    /** Identificatori tecnici: almeno due maiuscole, cifre opzionali, underscore, resto. */
    private static final Pattern QUERY_IDENTIFIER = Pattern.compile("\\b([A-Z]{2,}[0-9]*_[A-Z0-9_]+)\\b");

    private final RefinementParams params;

    public KeywordBooster(RefinementParams params) {
        this.params = params;
    }

    /** Identificatori della query, senza duplicati, nell'ordine di apparizione. */
    public static Set<String> extractIdentifiers(String query) {
        Set<String> identifiers = new LinkedHashSet<>();
        Matcher m = QUERY_IDENTIFIER.matcher(query.toUpperCase(Locale.ROOT));
        while (m.find()) identifiers.add(m.group(1));
        return identifiers;
    }

    /**
     * Applica il boost ai candidati (in place). Non riordina.
     *
     * @return numero di candidati che hanno ricevuto un boost
     */
    public int apply(String query, List<Candidate> candidates) {
        Set<String> identifiers = extractIdentifiers(query);
        if (identifiers.isEmpty()) return 0;

        List<Pattern> patterns = new ArrayList<>(identifiers.size());
        for (String id : identifiers) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(id) + "\\b"));
        }

        int boosted = 0;
        for (Candidate candidate : candidates) {
            Regions regions = Regions.of(primaryText(candidate));
            double total = 0;
            for (Pattern pattern : patterns) {
                total += boostFor(pattern, regions);
            }
            if (total > 0) {
                candidate.addBoost(total);
                boosted++;
            }
        }
        return boosted;
    }

    /** Testo del candidato senza le parti di overlap, le cui lunghezze sono nei metadati. */
    static String primaryText(Candidate candidate) {
        String text = candidate.text();
        Integer leading = candidate.metadataInteger("chunk.overlap.leading");
        Integer trailing = candidate.metadataInteger("chunk.overlap.trailing");
        int from = leading == null ? 0 : Math.min(Math.max(leading, 0), text.length());
        int to = trailing == null ? text.length() : Math.max(from, text.length() - Math.max(trailing, 0));
        return text.substring(from, to);
    }

    private double boostFor(Pattern pattern, Regions regions) {
        if (pattern.matcher(regions.title()).find())    return params.titleBoost();
        if (pattern.matcher(regions.keyTerms()).find()) return params.keyTermBoost();
        if (pattern.matcher(regions.body()).find())     return params.bodyBoost();
        return 0;
    }

    /** Regioni del testo di un candidato, già in maiuscolo. */
    record Regions(String title, String keyTerms, String body) {

        static Regions of(String text) {
            StringBuilder title = new StringBuilder();
            StringBuilder keyTerms = new StringBuilder();
            StringBuilder body = new StringBuilder();
            for (String line : text.split("\n", -1)) {
                if (AnnotationFormat.isTitleLine(line)) {
                    title.append(line).append('\n');
                } else if (AnnotationFormat.isKeyTermLine(line)) {
                    keyTerms.append(line).append('\n');
                } else {
                    body.append(line).append('\n');
                }
            }
            return new Regions(
                    title.toString().toUpperCase(Locale.ROOT),
                    keyTerms.toString().toUpperCase(Locale.ROOT),
                    body.toString().toUpperCase(Locale.ROOT));
        }
    }
}
