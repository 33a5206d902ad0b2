package fr.lapetina.advisor.llm.engine.bigram;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VocabularyTest {

    private Vocabulary vocabulary;

    @BeforeEach
    void setUp() {
        vocabulary = BigramFixtures.vocabulary();
    }

    private int id(String token) {
        return vocabulary.id(token).orElseThrow();
    }

    @Test
    @DisplayName("should prefer the longest matching token")
    void shouldPreferLongestMatch() {
        int[] ids = vocabulary.encode("<|im_start|>assistant\n");

        assertThat(ids).containsExactly(id("<|im_start|>"), id("assistant\n"));
    }

    @Test
    @DisplayName("should map unmatched characters to the unknown token")
    void shouldMapUnknownCharacters() {
        int[] ids = vocabulary.encode("The?");

        assertThat(ids).containsExactly(id("The"), id("<unk>"));
    }

    @Test
    @DisplayName("should skip unmatched characters without an unknown token")
    void shouldSkipUnknownWithoutUnkToken() {
        Vocabulary plain = new Vocabulary(List.of("a", "b"), List.of(), List.of(), null);

        assertThat(plain.encode("axb")).containsExactly(0, 1);
    }

    @Test
    @DisplayName("should drop special tokens when decoding")
    void shouldDropSpecialTokensWhenDecoding() {
        int[] ids = vocabulary.encode("<|im_start|>The stock<|im_end|>");

        assertThat(vocabulary.decode(ids, ids.length)).isEqualTo("The stock");
    }

    @Test
    @DisplayName("should decode only the requested prefix")
    void shouldDecodePrefix() {
        int[] ids = {id("The"), id(" stock"), id(" looks")};

        assertThat(vocabulary.decode(ids, 2)).isEqualTo("The stock");
    }

    @Test
    @DisplayName("should flag stop tokens")
    void shouldFlagStopTokens() {
        assertThat(vocabulary.isStop(id("<|im_end|>"))).isTrue();
        assertThat(vocabulary.isStop(id("The"))).isFalse();
    }

    @Test
    @DisplayName("should reject out of range ids when decoding")
    void shouldRejectUnknownIds() {
        assertThatThrownBy(() -> vocabulary.decode(new int[]{vocabulary.size()}, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown token id");
    }

    @Test
    @DisplayName("should reject malformed token tables")
    void shouldRejectMalformedTables() {
        assertThatThrownBy(() -> new Vocabulary(List.of(), List.of(), List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Vocabulary(List.of("a", "a"), List.of(), List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> new Vocabulary(List.of("a"), List.of("b"), List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("special");
    }
}
