package it.aw.hybridsearch.reader;

import java.util.List;

/**
 * Testo grezzo di un documento con l'indicazione della sua struttura.
 *
 * @param source nome del file sorgente, usato anche come identificatore del documento
 * @param paged  true se {@code parts} sono pagine fisiche (PDF); false se {@code parts}
 *               contiene il testo strutturato a heading (normalmente un solo elemento)
 */
public record ExtractedDocument(String source, boolean paged, List<String> parts) {

    public ExtractedDocument {
        parts = List.copyOf(parts);
    }

    public static ExtractedDocument ofPages(String source, List<String> pages) {
        return new ExtractedDocument(source, true, pages);
    }

    public static ExtractedDocument ofText(String source, String text) {
        return new ExtractedDocument(source, false, List.of(text == null ? "" : text));
    }
}
