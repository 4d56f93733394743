package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.chunking.ChunkAnnotator.Annotation;
import it.aw.hybridsearch.model.AnnotationFormat;
import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkKind;
import it.aw.hybridsearch.model.Section;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkAnnotatorTest {

    static final String AFIO_MAPR2_DEFINITION = String.join("\n",
            "## AFIO_MAPR2",
            "",
            "Address offset: 0x1C",
            "Reset value: 0x0000 0000",
            "",
            "| Bits | Field | Description |",
            "|------|-------|-------------|",
            "| 5 | TIM9_REMAP | TIM9 remapping |",
            "",
            "Bit 5 TIM9_REMAP: TIM9 remapping");

    private final ChunkAnnotator annotator = new ChunkAnnotator(4);

    @Nested
    @DisplayName("Definizione di registro")
    class RegisterDefinitionTests {

        @Test
        @DisplayName("Tabella e address offset producono titolo e key term completi")
        void classifiesRegisterDefinition() {
            Annotation a = annotator.classify(AFIO_MAPR2_DEFINITION, "AFIO_MAPR2");

            assertThat(a.kind()).isEqualTo(ChunkKind.REGISTER_DEFINITION);
            assertThat(a.title())
                    .isEqualTo("REGISTER DEFINITION: AFIO_MAPR2 - Complete bit field specification");
            assertThat(a.keyTerms()).isEqualTo(
                    "[KEY: TABLE:register_bitfields | AFIO_MAPR2 | offset:0x1C | reset:0x00000000 | fields:TIM9_REMAP]");
        }

        @Test
        @DisplayName("Senza identificatore nell'heading usa il primo del corpo")
        void registerNameFromBody() {
            String body = "| a | b |\n|---|---|\n| 1 | 2 |\nThe GPIOx_CRL register. Address offset: 0x00";

            Annotation a = annotator.classify(body, "Port configuration register low");

            assertThat(a.title()).isEqualTo(AnnotationFormat.title("GPIOx_CRL"));
            assertThat(a.keyTerms()).contains("offset:0x00").doesNotContain("reset:");
        }

        @Test
        @DisplayName("La tabella senza address offset non è una definizione")
        void tableWithoutOffset() {
            String body = "| Pin | Function |\n|-----|----------|\n| PA9 | USART_TX |";

            Annotation a = annotator.classify(body, "Pinout");

            assertThat(a.kind()).isEqualTo(ChunkKind.REGULAR);
            assertThat(a.title()).isNull();
            assertThat(a.keyTerms()).isEqualTo("[KEY: USART_TX]");
        }
    }

    @Nested
    @DisplayName("Panoramica e testo generico")
    class OverviewAndRegularTests {

        @Test
        @DisplayName("Quattro registri distinti senza definizione sono una panoramica")
        void classifiesOverview() {
            String body = "Registers: GPIOA_CRL, GPIOA_CRH, GPIOA_IDR and GPIOA_ODR, see GPIOA_CRL again.";

            Annotation a = annotator.classify(body, "GPIO register map");

            assertThat(a.kind()).isEqualTo(ChunkKind.OVERVIEW);
            assertThat(a.title()).isNull();
            assertThat(a.keyTerms()).isEqualTo("[KEY: OVERVIEW:register_list]");
        }

        @Test
        @DisplayName("Tre registri restano testo generico con i nomi come key term")
        void belowOverviewThreshold() {
            Annotation a = annotator.classify("Use AFIO_EVCR, AFIO_MAPR and AFIO_MAPR2.", "Remap");

            assertThat(a.kind()).isEqualTo(ChunkKind.REGULAR);
            assertThat(a.keyTerms()).isEqualTo("[KEY: AFIO_EVCR | AFIO_MAPR | AFIO_MAPR2]");
        }

        @Test
        @DisplayName("Testo senza identificatori non riceve annotazioni")
        void plainText() {
            Annotation a = annotator.classify("General description of the clock tree.", "Clocks");

            assertThat(a).isEqualTo(new Annotation(ChunkKind.REGULAR, null, null));
        }

        @Test
        @DisplayName("Il testo generico espone al massimo cinque identificatori")
        void regularTermsAreCapped() {
            ChunkAnnotator lenient = new ChunkAnnotator(100);

            Annotation a = lenient.classify("AA_1 BB_2 CC_3 DD_4 EE_5 FF_6 GG_7", "");

            assertThat(a.keyTerms()).isEqualTo("[KEY: AA_1 | BB_2 | CC_3 | DD_4 | EE_5]");
        }
    }

    @Test
    @DisplayName("annotate scrive classificazione, titolo e key term nel chunk")
    void annotateChunk() {
        Section section = new Section("rm.md", "AFIO_MAPR2", 2,
                List.of(AFIO_MAPR2_DEFINITION.split("\n")), null, "AFIO / AFIO_MAPR2");
        Chunk chunk = new Chunk(section, 0, AFIO_MAPR2_DEFINITION, 60, Map.of());

        annotator.annotate(chunk);

        assertThat(chunk.kind()).isEqualTo(ChunkKind.REGISTER_DEFINITION);
        assertThat(chunk.annotatedText()).startsWith(
                "REGISTER DEFINITION: AFIO_MAPR2 - Complete bit field specification\n[KEY: TABLE:register_bitfields");
        assertThat(chunk.annotatedText()).endsWith("\n\n" + AFIO_MAPR2_DEFINITION);
    }
}
