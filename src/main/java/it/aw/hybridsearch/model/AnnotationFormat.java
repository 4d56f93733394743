package it.aw.hybridsearch.model;

import java.util.regex.Pattern;

/**
 * Formato delle annotazioni iniettate nel testo dei chunk.
 * <p>
 * È il contratto tra l'annotatore (ingestione) e il keyword boost (query):
 * il boost riconosce le regioni "titolo" e "key term" esclusivamente tramite
 * i prefissi definiti qui.
 * <p>
 * Layout del testo di un chunk:
 * <pre>
 * [...] coda del chunk precedente          (overlap, opzionale)
 *
 * REGISTER DEFINITION: X - Complete ...    (titolo, opzionale)
 * [KEY: ...]                               (key term, opzionale)
 *
 * corpo
 *
 * testa del chunk successivo [...]         (overlap, opzionale)
 * </pre>
 */
public final class AnnotationFormat {

    public static final String TITLE_PREFIX     = "REGISTER DEFINITION: ";
    public static final String TITLE_SUFFIX     = " - Complete bit field specification";
    public static final String KEY_PREFIX       = "[KEY: ";
    public static final String KEY_SUFFIX       = "]";
    public static final String KEY_SEPARATOR    = " | ";
    public static final String OVERLAP_MARKER   = "[...]";
    public static final String PART_SEPARATOR   = "\n\n";

    public static final String TABLE_MARKER     = "TABLE:register_bitfields";
    public static final String OVERVIEW_MARKER  = "OVERVIEW:register_list";

    /** Identificatore di registro: almeno due maiuscole, 'x' opzionale, underscore, resto. */
    public static final Pattern REGISTER_IDENTIFIER = Pattern.compile("\\b([A-Z]{2,}x?_[A-Z0-9_]+)\\b");

    private AnnotationFormat() {}

    public static String title(String registerName) {
        return TITLE_PREFIX + registerName + TITLE_SUFFIX;
    }

    public static String keyTerms(Iterable<String> terms) {
        return KEY_PREFIX + String.join(KEY_SEPARATOR, terms) + KEY_SUFFIX;
    }

    public static boolean isTitleLine(String line) {
        return line.startsWith(TITLE_PREFIX);
    }

    public static boolean isKeyTermLine(String line) {
        return line.startsWith(KEY_PREFIX) && line.endsWith(KEY_SUFFIX);
    }

    public static String leadingOverlap(String text) {
        return OVERLAP_MARKER + " " + text;
    }

    public static String trailingOverlap(String text) {
        return text + " " + OVERLAP_MARKER;
    }
}
