package uk.gegc.mdexport.features.markdown.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeadingIdGenerator Tests")
class HeadingIdGeneratorTest {

    @Test
    @DisplayName("next: slugifies to lowercase dash-separated ids")
    void next_slugifies() {
        HeadingIdGenerator ids = new HeadingIdGenerator();

        assertThat(ids.next("Getting Started: Part 1!")).isEqualTo("getting-started-part-1");
    }

    @Test
    @DisplayName("next: repeated headings get numeric suffixes")
    void next_duplicates_suffixed() {
        // Given
        HeadingIdGenerator ids = new HeadingIdGenerator();

        // When
        String first = ids.next("Intro");
        String second = ids.next("Intro");
        String third = ids.next("intro");

        // Then
        assertThat(first).isEqualTo("intro");
        assertThat(second).isEqualTo("intro-1");
        assertThat(third).isEqualTo("intro-2");
    }

    @Test
    @DisplayName("next: suffixed ids never collide with a heading whose own slug matches")
    void next_suffixCollidesWithRealSlug_stillUnique() {
        // Given
        HeadingIdGenerator ids = new HeadingIdGenerator();

        // When
        List<String> forward = List.of(ids.next("Intro"), ids.next("Intro"), ids.next("Intro 1"));
        HeadingIdGenerator reverseIds = new HeadingIdGenerator();
        List<String> reverse = List.of(reverseIds.next("Intro 1"), reverseIds.next("Intro"), reverseIds.next("Intro"));

        // Then
        assertThat(forward).containsExactly("intro", "intro-1", "intro-1-1");
        assertThat(reverse).containsExactly("intro-1", "intro", "intro-2");
    }

    @Test
    @DisplayName("next: text without ASCII letters or digits becomes section")
    void next_noSlugChars_section() {
        HeadingIdGenerator ids = new HeadingIdGenerator();

        assertThat(ids.next("🚀 !!")).isEqualTo("section");
        assertThat(ids.next(null)).isEqualTo("section-1");
    }
}
