package it.aw.hybridsearch.rerank;

import dev.langchain4j.data.segment.TextSegment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TeiScoringModelTest {

    private MockRestServiceServer server;
    private TeiScoringModel model;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        model = new TeiScoringModel(restTemplate, "http://tei-bge:8080/", "bge");
    }

    @Test
    @DisplayName("Invia tutti i testi in una richiesta e riporta i punteggi nell'ordine di input")
    void scoresInInputOrder() {
        server.expect(requestTo("http://tei-bge:8080/rerank"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.query").value("AFIO_MAPR2 fields"))
                .andExpect(jsonPath("$.texts.length()").value(2))
                .andExpect(jsonPath("$.raw_scores").value(false))
                .andRespond(withSuccess("[{\"index\":1,\"score\":0.93},{\"index\":0,\"score\":0.12}]",
                        MediaType.APPLICATION_JSON));

        List<Double> scores = model.scoreAll(
                List.of(TextSegment.from("clock tree"), TextSegment.from("AFIO_MAPR2 definition")),
                "AFIO_MAPR2 fields").content();

        assertThat(scores).containsExactly(0.12, 0.93);
        server.verify();
    }

    @Test
    @DisplayName("Una risposta incompleta è un errore")
    void incompleteResponse() {
        server.expect(requestTo("http://tei-bge:8080/rerank"))
                .andRespond(withSuccess("[{\"index\":0,\"score\":0.5}]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> model.scoreAll(
                List.of(TextSegment.from("a"), TextSegment.from("b")), "q"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Un errore HTTP del server si propaga")
    void serverError() {
        server.expect(requestTo("http://tei-bge:8080/rerank")).andRespond(withServerError());

        assertThatThrownBy(() -> model.scoreAll(List.of(TextSegment.from("a")), "q"))
                .isInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("Nessun candidato, nessuna chiamata")
    void emptyInput() {
        assertThat(model.scoreAll(List.of(), "q").content()).isEmpty();
        server.verify();
    }
}
