package it.aw.hybridsearch.reader;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsatore PDF pagina per pagina via PDFBox.
 * <p>
 * Produce un documento a pagine: il numero di pagina (1-based) di ogni chunk
 * deriva dalla posizione della pagina nella lista. Le pagine senza layer testuale
 * restano come stringhe vuote per non spostare la numerazione.
 */
public class PdfDocumentReader implements DocumentReader {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentReader.class);

    @Override
    public boolean supports(String filename) {
        return filename.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public ExtractedDocument extract(String filename, InputStream inputStream) throws IOException {
        try (PDDocument doc = PDDocument.load(inputStream)) {
            int totalPages = doc.getNumberOfPages();
            log.debug("PdfDocumentReader: {} pagine trovate in {}", totalPages, filename);

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(totalPages);
            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                pages.add(stripper.getText(doc));
            }
            return ExtractedDocument.ofPages(filename, pages);
        }
    }
}
