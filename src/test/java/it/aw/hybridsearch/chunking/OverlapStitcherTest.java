package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkKind;
import it.aw.hybridsearch.model.Section;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OverlapStitcherTest {

    private final TokenCounter tokens = new TokenCounter();
    private final OverlapStitcher stitcher = new OverlapStitcher(tokens);

    private Chunk first;
    private Chunk middle;
    private Chunk last;

    @BeforeEach
    void setUp() {
        Section section = new Section("doc.md", "", 0, List.of("x"), null, "");
        first = new Chunk(section, 0, "one two three four", 4, Map.of());
        middle = new Chunk(section, 1, "five six seven eight", 4, Map.of());
        last = new Chunk(section, 2, "nine ten eleven twelve", 4, Map.of());
    }

    @Test
    @DisplayName("Ogni chunk riceve la coda del precedente e la testa del successivo")
    void stitchesBothDirections() {
        stitcher.stitch(List.of(first, middle, last), 2);

        assertThat(first.leadingOverlap()).isNull();
        assertThat(first.trailingOverlap()).isEqualTo("five six");
        assertThat(middle.leadingOverlap()).isEqualTo("three four");
        assertThat(middle.trailingOverlap()).isEqualTo("nine ten");
        assertThat(last.leadingOverlap()).isEqualTo("seven eight");
        assertThat(last.trailingOverlap()).isNull();

        assertThat(middle.text())
                .isEqualTo("[...] three four\n\nfive six seven eight\n\nnine ten [...]");
    }

    @Test
    @DisplayName("Le lunghezze degli overlap delimitano il testo primario")
    void overlapLengthsBoundPrimaryText() {
        stitcher.stitch(List.of(first, middle, last), 2);

        String text = middle.text();
        String primary = text.substring(middle.leadingOverlapLength(),
                text.length() - middle.trailingOverlapLength());

        assertThat(primary).isEqualTo(middle.annotatedText());
        assertThat(first.leadingOverlapLength()).isZero();
        assertThat(last.trailingOverlapLength()).isZero();
    }

    @Test
    @DisplayName("L'overlap è preso dal corpo, non dalle annotazioni del vicino")
    void overlapExcludesAnnotations() {
        first.annotate(ChunkKind.REGULAR, null, "[KEY: AFIO_MAPR]");
        middle.annotate(ChunkKind.REGISTER_DEFINITION, "REGISTER DEFINITION: X - Complete bit field specification",
                "[KEY: TABLE:register_bitfields]");

        stitcher.stitch(List.of(first, middle), 10);

        assertThat(first.trailingOverlap()).isEqualTo("five six seven eight");
        assertThat(middle.leadingOverlap()).isEqualTo("one two three four");
    }

    @Test
    @DisplayName("Overlap zero o chunk singolo lasciano i chunk invariati")
    void noOpCases() {
        stitcher.stitch(List.of(first, middle), 0);
        stitcher.stitch(List.of(last), 5);

        assertThat(first.text()).isEqualTo("one two three four");
        assertThat(middle.text()).isEqualTo("five six seven eight");
        assertThat(last.text()).isEqualTo("nine ten eleven twelve");
    }

    @Test
    @DisplayName("Un chunk congelato non accetta altre modifiche")
    void frozenChunkIsImmutable() {
        first.freeze();

        assertThatThrownBy(() -> stitcher.stitch(List.of(first, middle), 2))
                .isInstanceOf(IllegalStateException.class);
    }
}
