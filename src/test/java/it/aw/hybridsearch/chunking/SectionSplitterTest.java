package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Section;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SectionSplitterTest {

    private final SectionSplitter splitter = new SectionSplitter();

    @Test
    @DisplayName("Divide sugli heading e costruisce il breadcrumb gerarchico")
    void splitsOnHeadings() {
        String text = String.join("\n",
                "Preamble line",
                "# GPIO",
                "GPIO intro",
                "## GPIO registers",
                "Register list",
                "### GPIOx_CRL",
                "CRL body",
                "## AFIO registers",
                "AFIO body");

        List<Section> sections = splitter.split("rm.md", text);

        assertThat(sections).extracting(Section::heading)
                .containsExactly("", "GPIO", "GPIO registers", "GPIOx_CRL", "AFIO registers");
        assertThat(sections).extracting(Section::sectionPath)
                .containsExactly("", "GPIO", "GPIO / GPIO registers",
                        "GPIO / GPIO registers / GPIOx_CRL", "GPIO / AFIO registers");
        assertThat(sections).extracting(Section::level).containsExactly(0, 1, 2, 3, 2);
        assertThat(sections.get(3).body()).isEqualTo("CRL body");
        assertThat(sections).allMatch(s -> s.documentId().equals("rm.md"));
    }

    @Test
    @DisplayName("Heading di cinque cancelletti o senza spazio non aprono una sezione")
    void ignoresInvalidHeadings() {
        List<Section> sections = splitter.split("a.md", "# Title\n##### deep\n#hashtag\ntext");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).lines()).containsExactly("##### deep", "#hashtag", "text");
    }

    @Test
    @DisplayName("Heading consecutivi senza contenuto non producono sezioni vuote")
    void skipsHeadingsWithoutLines() {
        List<Section> sections = splitter.split("a.md", "# A\n## B\ncontent");

        assertThat(sections).hasSize(1);
        assertThat(sections.get(0).heading()).isEqualTo("B");
        assertThat(sections.get(0).sectionPath()).isEqualTo("A / B");
    }

    @Test
    @DisplayName("Sorgenti a pagine: una sezione per pagina non vuota, numerate da 1")
    void perPage() {
        List<Section> sections = splitter.perPage("rm.pdf", Arrays.asList("page one", "  ", "page three"));

        assertThat(sections).extracting(Section::page).containsExactly(1, 3);
        assertThat(sections).allMatch(s -> s.heading().isEmpty());
    }

    @Test
    @DisplayName("Testo vuoto non produce sezioni")
    void emptyText() {
        assertThat(splitter.split("a.md", "")).isEmpty();
    }
}
