package com.simmodel.catalog.catalog.language;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for LanguageMatcher.
 */
class LanguageMatcherTest {

    private final LanguageMatcher matcher = new LanguageMatcher(List.of("fr-CA", "EN", "de"));

    @ParameterizedTest
    @CsvSource({
            "en, EN",
            "en-US, EN",
            "EN_GB, EN",
            "fr-CA, fr-CA",
            "fr, fr-CA",
            "fr-FR, fr-CA",
            "de-AT, de",
            "ja, fr-CA"
    })
    void testMatchSingleTag(String preferred, String expected) {
        assertThat(matcher.match(List.of(preferred))).contains(expected);
    }

    @Test
    void testPreferenceOrderIsRespected() {
        assertThat(matcher.match(List.of("ja", "de", "en"))).contains("de");
    }

    @Test
    void testNoPreferenceGivesDefault() {
        assertThat(matcher.match(null)).contains("fr-CA");
        assertThat(matcher.match(List.of())).contains("fr-CA");
        assertThat(matcher.match(List.of(" ", "***"))).contains("fr-CA");
    }

    @Test
    void testEmptyMatcher() {
        LanguageMatcher empty = new LanguageMatcher(List.of());

        assertThat(empty.getDefaultCode()).isEmpty();
        assertThat(empty.match(List.of("en"))).isEmpty();
    }

    @Test
    void testCodesAreImmutableCopy() {
        assertThat(matcher.getCodes()).containsExactly("fr-CA", "EN", "de");
        assertThatThrownBy(() -> matcher.getCodes().add("it"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
