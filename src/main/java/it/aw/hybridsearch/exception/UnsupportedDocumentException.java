package it.aw.hybridsearch.exception;

/**
 * Tipo di file non gestito da nessun DocumentReader.
 */
public class UnsupportedDocumentException extends SearchPipelineException {

    public UnsupportedDocumentException(String filename) {
        super("Tipo di file non supportato: " + filename + " (ammessi: .pdf, .md, .markdown, .txt)");
    }

    @Override
    public String kind() {
        return "UNSUPPORTED_DOCUMENT";
    }
}
