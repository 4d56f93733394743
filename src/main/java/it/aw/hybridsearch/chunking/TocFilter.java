package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Section;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scarta le sezioni che sono rumore da indice (table of contents).
 * <p>
 * Da ogni riga vengono rimossi i puntini di guida seguiti dal numero di pagina
 * ("Introduzione . . . . . 12") e le righe composte da solo numero; se il contenuto
 * residuo è più corto della soglia, la sezione viene scartata.
 */
public class TocFilter {

    private static final Pattern DOT_LEADER   = Pattern.compile("(?:\\s*[.·…_]){2,}\\s*\\d+\\s*$");
    private static final Pattern PAGE_NUMBER  = Pattern.compile("^\\s*\\d+\\s*$");

    private final int minChars;

    public TocFilter(int minChars) {
        this.minChars = minChars;
    }

    public boolean keep(Section section) {
        return strippedLength(section) >= minChars;
    }

    public List<Section> filter(List<Section> sections) {
        return sections.stream().filter(this::keep).collect(Collectors.toList());
    }

    static int strippedLength(Section section) {
        StringBuilder sb = new StringBuilder();
        for (String line : section.lines()) {
            if (PAGE_NUMBER.matcher(line).matches()) continue;
            sb.append(DOT_LEADER.matcher(line).replaceAll("")).append('\n');
        }
        return sb.toString().strip().length();
    }
}
