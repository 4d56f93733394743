package it.aw.hybridsearch.chunking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenCounterTest {

    private final TokenCounter tokens = new TokenCounter();

    @Test
    @DisplayName("Testo vuoto o null vale zero token")
    void emptyTextHasNoTokens() {
        assertThat(tokens.count("")).isZero();
        assertThat(tokens.count(null)).isZero();
    }

    @Test
    @DisplayName("Parole comuni inglesi valgono un token ciascuna")
    void countsCommonWords() {
        assertThat(tokens.count("hello world")).isEqualTo(2);
    }

    @Test
    @DisplayName("head e tail restituiscono i primi e gli ultimi token")
    void headAndTail() {
        String text = "one two three four";

        assertThat(tokens.head(text, 2)).isEqualTo("one two");
        assertThat(tokens.tail(text, 2)).isEqualTo(" three four");
    }

    @Test
    @DisplayName("head e tail oltre la lunghezza restituiscono il testo intero")
    void headAndTailBeyondLength() {
        assertThat(tokens.head("short text", 100)).isEqualTo("short text");
        assertThat(tokens.tail("short text", 100)).isEqualTo("short text");
    }
}
