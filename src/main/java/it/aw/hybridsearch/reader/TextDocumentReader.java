package it.aw.hybridsearch.reader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * File Markdown e testo semplice, letti come UTF-8 e strutturati a heading.
 */
public class TextDocumentReader implements DocumentReader {

    @Override
    public boolean supports(String filename) {
        String name = filename.toLowerCase(Locale.ROOT);
        return name.endsWith(".md") || name.endsWith(".markdown") || name.endsWith(".txt");
    }

    @Override
    public ExtractedDocument extract(String filename, InputStream inputStream) throws IOException {
        return ExtractedDocument.ofText(filename, new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
    }
}
