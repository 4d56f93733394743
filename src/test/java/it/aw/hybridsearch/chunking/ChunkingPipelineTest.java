package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkKind;
import it.aw.hybridsearch.model.ChunkingParams;
import it.aw.hybridsearch.model.Section;
import it.aw.hybridsearch.reader.ExtractedDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkingPipelineTest {

    static final String REFERENCE_MANUAL = String.join("\n",
            "# GPIO",
            "",
            "The general purpose IO ports can be configured in several modes, including analog input and push-pull output.",
            "",
            ChunkAnnotatorTest.AFIO_MAPR2_DEFINITION);

    private final TokenCounter tokens = new TokenCounter();
    private final ChunkingPipeline pipeline = new ChunkingPipeline(tokens);

    private ChunkingPipeline.Result process(String text, ChunkingParams params) {
        return pipeline.process(ExtractedDocument.ofText("rm0041.md", text), params, Map.of("product", "stm32f1"));
    }

    @Nested
    @DisplayName("Documento strutturato a heading")
    class HeadingDocumentTests {

        @Test
        @DisplayName("Produce un chunk per sezione con definizione di registro annotata")
        void endToEndRegisterDefinition() {
            ChunkingPipeline.Result result = process(REFERENCE_MANUAL, ChunkingParams.defaults());

            assertThat(result.chunks()).hasSize(2);
            Chunk intro = result.chunks().get(0);
            Chunk register = result.chunks().get(1);

            assertThat(intro.kind()).isEqualTo(ChunkKind.REGULAR);
            assertThat(register.kind()).isEqualTo(ChunkKind.REGISTER_DEFINITION);
            assertThat(register.section().sectionPath()).isEqualTo("GPIO / AFIO_MAPR2");
            assertThat(result.chunks()).extracting(Chunk::index).containsExactly(0, 1);
            assertThat(result.chunks()).allMatch(Chunk::isFrozen);
            assertThat(result.chunks()).allMatch(c -> c.userMetadata().get("product").equals("stm32f1"));

            assertThat(register.text()).contains(
                    "REGISTER DEFINITION: AFIO_MAPR2 - Complete bit field specification\n[KEY: TABLE:register_bitfields");
        }

        @Test
        @DisplayName("L'overlap collega chunk adiacenti in entrambe le direzioni")
        void bidirectionalOverlap() {
            ChunkingPipeline.Result result = process(REFERENCE_MANUAL, ChunkingParams.defaults());
            Chunk intro = result.chunks().get(0);
            Chunk register = result.chunks().get(1);

            assertThat(intro.leadingOverlap()).isNull();
            assertThat(register.trailingOverlap()).isNull();
            assertThat(register.leadingOverlap()).isEqualTo(tokens.tail(intro.body(), 25).strip());
            assertThat(intro.trailingOverlap()).isEqualTo(tokens.head(register.body(), 25).strip());
            assertThat(intro.trailingOverlap()).doesNotContain("REGISTER DEFINITION").doesNotContain("[KEY:");
            assertThat(register.text()).startsWith("[...] " + register.leadingOverlap() + "\n\n");
            assertThat(intro.text()).endsWith("\n\n" + intro.trailingOverlap() + " [...]");
        }

        @Test
        @DisplayName("Con overlap zero i chunk non hanno regioni di overlap")
        void zeroOverlap() {
            ChunkingPipeline.Result result = process(REFERENCE_MANUAL, new ChunkingParams(500, 0));

            assertThat(result.chunks()).allMatch(c -> c.leadingOverlap() == null && c.trailingOverlap() == null);
        }

        @Test
        @DisplayName("Le sezioni di indice vengono scartate")
        void dropsTableOfContents() {
            String text = "## Contents\n1 Scope . . . . 3\n2 GPIO . . . . 7\n\n" + REFERENCE_MANUAL;

            ChunkingPipeline.Result result = process(text, ChunkingParams.defaults());

            assertThat(result.sections()).extracting(Section::heading).containsExactly("GPIO", "AFIO_MAPR2");
        }

        @Test
        @DisplayName("Due esecuzioni sullo stesso input producono chunk identici")
        void deterministic() {
            List<String> first = process(REFERENCE_MANUAL, ChunkingParams.defaults()).chunks().stream()
                    .map(Chunk::text).collect(Collectors.toList());
            List<String> second = process(REFERENCE_MANUAL, ChunkingParams.defaults()).chunks().stream()
                    .map(Chunk::text).collect(Collectors.toList());

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Un documento vuoto non produce chunk")
        void emptyDocument() {
            assertThat(process("   \n\n  ", ChunkingParams.defaults()).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("Documento a pagine: footer rimossi e numero di pagina sulle sezioni")
    void pagedDocument() {
        String body = "The AFIO remap register allows TIM9 channels to be mapped on alternate pins.";
        ExtractedDocument pdf = ExtractedDocument.ofPages("rm0041.pdf", List.of(
                body + "\nRM0041 Rev 6 112/709",
                body + "\nRM0041 Rev 6 113/709"));

        ChunkingPipeline.Result result = pipeline.process(pdf, ChunkingParams.defaults(), Map.of());

        assertThat(result.chunks()).hasSize(2);
        assertThat(result.chunks()).extracting(c -> c.section().page()).containsExactly(1, 2);
        assertThat(result.chunks()).allMatch(c -> c.body().equals(body));
    }
}
