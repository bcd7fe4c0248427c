package uk.gegc.mdexport.features.export.application.emoji;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmojiPreservationEncoder Tests")
class EmojiPreservationEncoderTest {

    private final EmojiPreservationEncoder encoder = new EmojiPreservationEncoder();

    @Test
    @DisplayName("preserveEmoji: pictographs get a preserve wrapper")
    void preserveEmoji_pictograph_wrapped() {
        // When
        String html = encoder.preserveEmoji("<p>Launch 🚀 now</p>");

        // Then
        Element span = Jsoup.parseBodyFragment(html).selectFirst("span." + EmojiPreservationEncoder.PRESERVE_CLASS);
        assertThat(span).isNotNull();
        assertThat(span.text()).isEqualTo("🚀");
        assertThat(span.attr("style")).contains("color:inherit");
        assertThat(html).startsWith("<p>Launch ").endsWith(" now</p>");
    }

    @Test
    @DisplayName("preserveEmoji: ZWJ sequences and flags stay in one wrapper")
    void preserveEmoji_sequences_singleWrapper() {
        // Given: family ZWJ sequence and the UK flag
        String family = "👨‍👩‍👧";
        String flag = "🇬🇧";

        // When
        Document doc = Jsoup.parseBodyFragment(encoder.preserveEmoji("<p>" + family + " " + flag + "</p>"));

        // Then
        assertThat(doc.select("span." + EmojiPreservationEncoder.PRESERVE_CLASS))
                .extracting(Element::text)
                .containsExactly(family, flag);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "\u270C\uD83C\uDFFD",                       // victory hand, medium skin tone
            "\u2764\uFE0F\u200D\uD83D\uDD25",           // heart on fire
            "1\uFE0F\u20E3",                               // keycap one
            "#\u20E3",                                      // keycap number sign
            "\u2B50\uFE0F\u200D\u2728"                   // star joined to sparkles
    })
    @DisplayName("preserveEmoji: dingbat, arrow and keycap sequences stay in one wrapper")
    void preserveEmoji_dingbatAndKeycapSequences_singleWrapper(String sequence) {
        // When
        Document doc = Jsoup.parseBodyFragment(encoder.preserveEmoji("<p>hi " + sequence + " there</p>"));

        // Then
        assertThat(doc.select("span." + EmojiPreservationEncoder.PRESERVE_CLASS))
                .singleElement()
                .satisfies(span -> assertThat(span.attr("data-emoji")).isEqualTo(sequence));
        assertThat(doc.select("span." + EmojiPreservationEncoder.LITERAL_CLASS)).isEmpty();
        assertThat(doc.select("p").text()).isEqualTo("hi " + sequence + " there");
    }

    @Test
    @DisplayName("preserveEmoji: lone listed dingbats keep the literal color")
    void preserveEmoji_loneDingbat_literal() {
        // When
        Document doc = Jsoup.parseBodyFragment(encoder.preserveEmoji("<p>\u2764\uFE0F \u2B50 \u27A1 ok</p>"));

        // Then
        assertThat(doc.select("span." + EmojiPreservationEncoder.LITERAL_CLASS)).hasSize(3);
        assertThat(doc.select("span." + EmojiPreservationEncoder.PRESERVE_CLASS)).isEmpty();
    }

    @Test
    @DisplayName("preserveEmoji: listed symbols get a literal color wrapper")
    void preserveEmoji_literalSymbol() {
        // When
        String html = encoder.preserveEmoji("<li>Done ✅</li>");

        // Then
        Element span = Jsoup.parseBodyFragment(html).selectFirst("span." + EmojiPreservationEncoder.LITERAL_CLASS);
        assertThat(span).isNotNull();
        assertThat(span.attr("style")).contains("color:#16a34a");
    }

    @Test
    @DisplayName("preserveEmoji: applying twice gives the same output")
    void preserveEmoji_idempotent() {
        // Given
        String input = "<!DOCTYPE html><html><head><title>Hi 🚀</title></head>"
                + "<body><p>✅ ok ❤️ 👍🏽</p></body></html>";

        // When
        String once = encoder.preserveEmoji(input);
        String twice = encoder.preserveEmoji(once);

        // Then
        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("preserveEmoji: script, style and title text is untouched")
    void preserveEmoji_skipsProtectedElements() {
        // Given
        String input = "<html><head><title>🚀</title><style>.x:after{content:'✅'}</style></head>"
                + "<body><script>var s = '🚀';</script></body></html>";

        // When
        Document doc = Jsoup.parse(encoder.preserveEmoji(input));

        // Then
        assertThat(doc.select("span")).isEmpty();
        assertThat(doc.title()).isEqualTo("🚀");
    }

    @Test
    @DisplayName("preserveEmoji: text without emoji is unchanged")
    void preserveEmoji_noEmoji_unchanged() {
        assertThat(encoder.preserveEmoji("<p>plain &amp; simple</p>")).isEqualTo("<p>plain &amp; simple</p>");
        assertThat(encoder.preserveEmoji(null)).isEmpty();
    }
}
