package it.aw.hybridsearch.reader;

import it.aw.hybridsearch.exception.UnsupportedDocumentException;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Sceglie il reader in base all'estensione del file.
 */
public class DocumentReaders {

    private final List<DocumentReader> readers;

    public DocumentReaders(List<DocumentReader> readers) {
        this.readers = List.copyOf(readers);
    }

    public static DocumentReaders defaults() {
        return new DocumentReaders(List.of(new PdfDocumentReader(), new TextDocumentReader()));
    }

    public boolean supports(String filename) {
        return readers.stream().anyMatch(r -> r.supports(filename));
    }

    public ExtractedDocument extract(String filename, InputStream inputStream) throws IOException {
        DocumentReader reader = readers.stream()
                .filter(r -> r.supports(filename))
                .findFirst()
                .orElseThrow(() -> new UnsupportedDocumentException(filename));
        return reader.extract(filename, inputStream);
    }
}
