package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.AnnotationFormat;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifica i chunk e costruisce titolo e prefisso di key term.
 * <p>
 * Le regole sono valutate in ordine e sono mutuamente esclusive:
 * <ol>
 *   <li>{@link ChunkKind#REGISTER_DEFINITION}: tabella + riga "Address offset:"</li>
 *   <li>{@link ChunkKind#OVERVIEW}: almeno N identificatori di registro distinti</li>
 *   <li>{@link ChunkKind#REGULAR}: tutto il resto</li>
 * </ol>
 * I chunk di panoramica non espongono i nomi dei registri tra i key term: altrimenti
 * supererebbero le vere definizioni nelle query su un registro specifico.
 */
public class ChunkAnnotator {

    /** Classificazione di un chunk; titolo e key term sono null se assenti. */
    public record Annotation(ChunkKind kind, String title, String keyTerms) {}

    static final int MAX_REGULAR_TERMS = 5;
    static final int MAX_FIELDS        = 8;

    private static final String VALUE = "(0x[0-9A-Fa-f]+(?:[ _][0-9A-Fa-f]{4})?|\\d+)";

    private static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\|[ \\t\\-:]+\\|[ \\t\\-:|]*$", Pattern.MULTILINE);
    private static final Pattern ADDRESS_OFFSET  = Pattern.compile("Address offset:\\s*" + VALUE);
    private static final Pattern RESET_VALUE     = Pattern.compile("Reset value:\\s*" + VALUE);
    private static final Pattern BIT_FIELD       = Pattern.compile(
            "Bits?\\s+\\d+(?::\\d+)?\\s+([A-Z][A-Z0-9_]*(?:\\[\\d+(?::\\d+)?])?):");
    private static final Pattern FIELD_CELL      = Pattern.compile("^[A-Z][A-Z0-9_]+(?:\\[\\d+(?::\\d+)?])?$");

    private final int overviewMinRegisters;

    public ChunkAnnotator(int overviewMinRegisters) {
        this.overviewMinRegisters = overviewMinRegisters;
    }

    public void annotate(Chunk chunk) {
        Annotation a = classify(chunk.body(), chunk.section().heading());
        chunk.annotate(a.kind(), a.title(), a.keyTerms());
    }

    public Annotation classify(String body, String heading) {
        Set<String> registers = registerIdentifiers(body);

        Matcher offset = ADDRESS_OFFSET.matcher(body);
        if (TABLE_SEPARATOR.matcher(body).find() && offset.find()) {
            String name = registerName(heading, registers);
            List<String> terms = new ArrayList<>();
            terms.add(AnnotationFormat.TABLE_MARKER);
            terms.add(name);
            terms.add("offset:" + compact(offset.group(1)));
            Matcher reset = RESET_VALUE.matcher(body);
            if (reset.find()) terms.add("reset:" + compact(reset.group(1)));
            Set<String> fields = bitFields(body);
            if (!fields.isEmpty()) terms.add("fields:" + String.join(",", fields));
            return new Annotation(ChunkKind.REGISTER_DEFINITION,
                    AnnotationFormat.title(name), AnnotationFormat.keyTerms(terms));
        }

        if (registers.size() >= overviewMinRegisters) {
            return new Annotation(ChunkKind.OVERVIEW, null,
                    AnnotationFormat.keyTerms(List.of(AnnotationFormat.OVERVIEW_MARKER)));
        }

        if (registers.isEmpty()) {
            return new Annotation(ChunkKind.REGULAR, null, null);
        }
        List<String> terms = registers.stream().limit(MAX_REGULAR_TERMS).collect(Collectors.toList());
        return new Annotation(ChunkKind.REGULAR, null, AnnotationFormat.keyTerms(terms));
    }

    /** Identificatori di registro distinti, nell'ordine di prima occorrenza. */
    static Set<String> registerIdentifiers(String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = AnnotationFormat.REGISTER_IDENTIFIER.matcher(text);
        while (m.find()) found.add(m.group(1));
        return found;
    }

    private static String registerName(String heading, Set<String> bodyRegisters) {
        Set<String> fromHeading = registerIdentifiers(heading == null ? "" : heading);
        if (!fromHeading.isEmpty()) return fromHeading.iterator().next();
        if (!bodyRegisters.isEmpty()) return bodyRegisters.iterator().next();
        if (heading != null && !heading.isBlank()) return heading.strip();
        return "UNKNOWN";
    }

    private static Set<String> bitFields(String body) {
        Set<String> fields = new LinkedHashSet<>();
        Matcher m = BIT_FIELD.matcher(body);
        while (m.find() && fields.size() < MAX_FIELDS) fields.add(m.group(1));

        for (String line : body.split("\n")) {
            if (fields.size() >= MAX_FIELDS) break;
            String trimmed = line.strip();
            if (!trimmed.startsWith("|") || TABLE_SEPARATOR.matcher(trimmed).matches()) continue;
            for (String cell : trimmed.split("\\|")) {
                String c = cell.strip();
                if (FIELD_CELL.matcher(c).matches() && fields.size() < MAX_FIELDS) fields.add(c);
            }
        }
        return fields;
    }

    private static String compact(String value) {
        return value.replace(" ", "").replace("_", "");
    }
}
