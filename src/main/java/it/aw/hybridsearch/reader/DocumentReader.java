package it.aw.hybridsearch.reader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Estrae il testo grezzo da un file. Un'implementazione per formato.
 */
public interface DocumentReader {

    /** True se il reader gestisce il file con questo nome. */
    boolean supports(String filename);

    /**
     * Estrae il testo. L'input stream NON viene chiuso: la responsabilità è del chiamante.
     */
    ExtractedDocument extract(String filename, InputStream inputStream) throws IOException;
}
