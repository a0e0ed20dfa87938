package io.draftmate.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TextNormalizerTest {

    @Test
    void removesDisallowedCharactersAndCollapsesWhitespace() {
        String normalized = TextNormalizer.normalize("  My <b>Essay</b> costs $5 &   more…\n\tThan \"that\"!  ");

        assertThat(normalized).isEqualTo("my bessayb costs 5 more than \"that\"!");
    }

    @Test
    void keepsBasicPunctuation() {
        assertThat(TextNormalizer.normalize("Wait - really? Yes: (it's) fine; ok, done."))
                .isEqualTo("wait - really? yes: (it's) fine; ok, done.");
    }

    @Test
    void treatsNullAsEmptyText() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = { "Hello   World", "  #tags  and @mentions ", "a   b", "Tabs\tand\nlines",
            "x * y = z", "" })
    void isIdempotent(String text) {
        String once = TextNormalizer.normalize(text);

        assertThat(TextNormalizer.normalize(once)).isEqualTo(once);
    }
}
