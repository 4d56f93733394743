package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Section;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Divide il testo normalizzato in sezioni delimitate dagli heading.
 * <p>
 * Heading riconosciuti: da uno a quattro {@code #} seguiti da uno spazio.
 * Il testo che precede il primo heading forma una sezione con heading vuoto.
 * Per i sorgenti a pagine ogni pagina diventa una sezione.
 * <p>
 * Il breadcrumb ({@code sectionPath}) segue la gerarchia degli heading: un heading
 * di livello n chiude tutti gli heading aperti di livello maggiore o uguale a n.
 */
public class SectionSplitter {

    private static final Pattern HEADING = Pattern.compile("^(#{1,4})\\s+(.+)$");
    private static final int MAX_LEVEL = 4;

    /** Sezioni di un documento strutturato a heading, nell'ordine del testo. */
    public List<Section> split(String documentId, String text) {
        List<Section> sections = new ArrayList<>();
        if (text == null || text.isEmpty()) return sections;

        String[] path = new String[MAX_LEVEL];
        String heading = "";
        int level = 0;
        List<String> lines = new ArrayList<>();

        for (String line : text.split("\n", -1)) {
            Matcher m = HEADING.matcher(line);
            if (m.matches()) {
                addIfNotEmpty(sections, documentId, heading, level, lines, path);
                level = m.group(1).length();
                heading = m.group(2).strip();
                path[level - 1] = heading;
                for (int l = level; l < MAX_LEVEL; l++) path[l] = null;
                lines = new ArrayList<>();
            } else {
                lines.add(line);
            }
        }
        addIfNotEmpty(sections, documentId, heading, level, lines, path);
        return sections;
    }

    /** Una sezione per pagina; le pagine vuote sono scartate. */
    public List<Section> perPage(String documentId, List<String> pages) {
        List<Section> sections = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            String page = pages.get(i);
            if (page == null || page.isBlank()) continue;
            sections.add(new Section(documentId, "", 0, List.of(page.split("\n", -1)), i + 1, ""));
        }
        return sections;
    }

    private static void addIfNotEmpty(List<Section> sections, String documentId, String heading,
                                      int level, List<String> lines, String[] path) {
        if (lines.isEmpty()) return;
        sections.add(new Section(documentId, heading, level, lines, null, buildPath(path, level)));
    }

    private static String buildPath(String[] path, int level) {
        List<String> parts = new ArrayList<>();
        for (int l = 0; l < level; l++) {
            if (path[l] != null) parts.add(path[l]);
        }
        return String.join(" / ", parts);
    }
}
