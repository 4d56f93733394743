package it.aw.hybridsearch.reader;

import it.aw.hybridsearch.exception.UnsupportedDocumentException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentReadersTest {

    private final DocumentReaders readers = DocumentReaders.defaults();

    private static byte[] pdf(String... pageTexts) throws IOException {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                doc.addPage(page);
                if (text.isEmpty()) continue;
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(PDType1Font.HELVETICA, 12);
                    cs.newLineAtOffset(50, 700);
                    cs.showText(text);
                    cs.endText();
                }
            }
            doc.save(out);
            return out.toByteArray();
        }
    }

    @Nested
    @DisplayName("Selezione del reader")
    class SelectionTests {

        @Test
        @DisplayName("Riconosce PDF, Markdown e testo indipendentemente dalle maiuscole")
        void supportedExtensions() {
            assertThat(readers.supports("RM0041.PDF")).isTrue();
            assertThat(readers.supports("notes.md")).isTrue();
            assertThat(readers.supports("notes.markdown")).isTrue();
            assertThat(readers.supports("readme.txt")).isTrue();
            assertThat(readers.supports("sheet.xlsx")).isFalse();
        }

        @Test
        @DisplayName("Un tipo non supportato solleva UnsupportedDocumentException")
        void unsupported() {
            assertThatThrownBy(() -> readers.extract("report.docx", new ByteArrayInputStream(new byte[0])))
                    .isInstanceOf(UnsupportedDocumentException.class)
                    .hasMessageContaining("report.docx");
        }
    }

    @Test
    @DisplayName("Il testo Markdown è letto come UTF-8 in un unico blocco a heading")
    void readsMarkdown() throws IOException {
        String markdown = "# Registri\n\nPiù dettagli su AFIO_MAPR2.";

        ExtractedDocument doc = readers.extract("rm.md",
                new ByteArrayInputStream(markdown.getBytes(StandardCharsets.UTF_8)));

        assertThat(doc.paged()).isFalse();
        assertThat(doc.source()).isEqualTo("rm.md");
        assertThat(doc.parts()).containsExactly(markdown);
    }

    @Test
    @DisplayName("Il PDF è letto pagina per pagina mantenendo le pagine vuote")
    void readsPdfPages() throws IOException {
        byte[] bytes = pdf("AFIO remap register", "", "GPIO port configuration");

        ExtractedDocument doc = readers.extract("rm.pdf", new ByteArrayInputStream(bytes));

        assertThat(doc.paged()).isTrue();
        assertThat(doc.parts()).hasSize(3);
        assertThat(doc.parts().get(0)).contains("AFIO remap register");
        assertThat(doc.parts().get(1)).isBlank();
        assertThat(doc.parts().get(2)).contains("GPIO port configuration");
    }
}
