package im.arun.clausetree.normalize;

import im.arun.clausetree.model.NormalizedText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("null input normalizes to empty text")
        void null_input() {
            NormalizedText result = normalizer.normalize(null);
            assertThat(result.getNormalizedText()).isEmpty();
            assertThat(result.getRawToNormalized()).containsExactly(0);
            assertThat(result.getNormalizedToRaw()).containsExactly(0);
        }

        @Test
        @DisplayName("plain text passes through with identity maps")
        void plain_text() {
            NormalizedText result = normalizer.normalize("(a) x");
            assertThat(result.getNormalizedText()).isEqualTo("(a) x");
            assertThat(result.getRawToNormalized()).containsExactly(0, 1, 2, 3, 4, 5);
            assertThat(result.getNormalizedToRaw()).containsExactly(0, 1, 2, 3, 4, 5);
            assertThat(result.getNormalizationFlags()).containsOnlyKeys(
                TextNormalizer.FLAG_CR, TextNormalizer.FLAG_CRLF,
                TextNormalizer.FLAG_NBSP, TextNormalizer.FLAG_ZERO_WIDTH);
            assertThat(result.getNormalizationFlags().values()).containsOnly(false);
            assertThat(result.getNormalizationVersion()).isEqualTo(NormalizedText.NORMALIZATION_VERSION);
        }
    }

    @Nested
    @DisplayName("Line endings")
    class LineEndings {

        @Test
        @DisplayName("CRLF collapses to LF and both raw chars map to the same offset")
        void crlf() {
            NormalizedText result = normalizer.normalize("a\r\nb");
            assertThat(result.getNormalizedText()).isEqualTo("a\nb");
            assertThat(result.getRawToNormalized()).containsExactly(0, 1, 1, 2, 3);
            assertThat(result.getNormalizedToRaw()).containsExactly(0, 1, 3, 4);
            assertThat(result.flag(TextNormalizer.FLAG_CRLF)).isTrue();
            assertThat(result.flag(TextNormalizer.FLAG_CR)).isFalse();
        }

        @Test
        @DisplayName("lone CR becomes LF")
        void lone_cr() {
            NormalizedText result = normalizer.normalize("a\rb");
            assertThat(result.getNormalizedText()).isEqualTo("a\nb");
            assertThat(result.flag(TextNormalizer.FLAG_CR)).isTrue();
            assertThat(result.flag(TextNormalizer.FLAG_CRLF)).isFalse();
        }
    }

    @Nested
    @DisplayName("Invisible characters")
    class InvisibleCharacters {

        @Test
        @DisplayName("non-breaking space becomes a plain space")
        void nbsp() {
            NormalizedText result = normalizer.normalize("a\u00A0b");
            assertThat(result.getNormalizedText()).isEqualTo("a b");
            assertThat(result.flag(TextNormalizer.FLAG_NBSP)).isTrue();
        }

        @Test
        @DisplayName("zero-width characters are removed and offsets still resolve")
        void zero_width() {
            NormalizedText result = normalizer.normalize("x\u200By\uFEFF");
            assertThat(result.getNormalizedText()).isEqualTo("xy");
            assertThat(result.flag(TextNormalizer.FLAG_ZERO_WIDTH)).isTrue();
            assertThat(result.getRawToNormalized()).containsExactly(0, 1, 1, 2, 2);
            assertThat(result.toRaw(1)).isEqualTo(1);
            assertThat(result.toNormalized(2)).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("normalizing normalized text is a no-op")
    void idempotent() {
        String once = normalizer.normalize("(a)\u00A0One.\r\n(b)\u200B Two.\r").getNormalizedText();
        NormalizedText twice = normalizer.normalize(once);
        assertThat(twice.getNormalizedText()).isEqualTo(once);
        assertThat(twice.getNormalizationFlags().values()).containsOnly(false);
    }

    @Test
    @DisplayName("offsets map back to the raw character they were produced from")
    void round_trip() {
        String raw = "(a) One.\r\n\u00A0(b) Two.\rx";
        NormalizedText result = normalizer.normalize(raw);
        String text = result.getNormalizedText();
        for (int i = 0; i < text.length(); i++) {
            char rawChar = raw.charAt(result.toRaw(i));
            char expected = rawChar == '\r' ? '\n' : rawChar == '\u00A0' ? ' ' : rawChar;
            assertThat(text.charAt(i)).isEqualTo(expected);
        }
        assertThat(result.toRaw(text.length())).isEqualTo(raw.length());
    }
}
