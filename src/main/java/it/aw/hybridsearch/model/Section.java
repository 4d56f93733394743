package it.aw.hybridsearch.model;

import java.util.List;

/**
 * Sezione di un documento prodotta dal SectionSplitter.
 * <p>
 * Per i sorgenti strutturati a heading (Markdown, testo) {@code heading} contiene
 * il testo dell'heading senza i marcatori e {@code level} la sua profondità (1-4);
 * il preambolo che precede il primo heading ha heading vuoto e livello 0.
 * Per i sorgenti a pagine (PDF) ogni pagina è una sezione con heading vuoto
 * e {@code page} valorizzato.
 *
 * @param sectionPath breadcrumb degli heading attivi, es. "GPIO / GPIO registers / GPIOx_CRL"
 */
public record Section(
        String       documentId,
        String       heading,
        int          level,
        List<String> lines,
        Integer      page,         // numero pagina 1-based (null per sorgenti a heading)
        String       sectionPath
) {

    public Section {
        heading = heading == null ? "" : heading;
        sectionPath = sectionPath == null ? "" : sectionPath;
        lines = List.copyOf(lines);
    }

    public String body() {
        return String.join("\n", lines);
    }

    public boolean hasHeading() {
        return !heading.isEmpty();
    }

    /** Riga di heading come appare nel testo del chunk, es. "## AFIO_MAPR". */
    public String renderedHeading() {
        if (!hasHeading()) return "";
        return "#".repeat(Math.max(level, 1)) + " " + heading;
    }
}
